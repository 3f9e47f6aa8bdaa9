package dev.newsroom.service;

import dev.newsroom.domain.ErrorKind;
import dev.newsroom.domain.Roles;
import dev.newsroom.domain.SubscriptionResolver;
import dev.newsroom.domain.WorkflowException;
import dev.newsroom.dto.NewsletterRequest;
import dev.newsroom.dto.NewsletterResponse;
import dev.newsroom.entity.Newsletter;
import dev.newsroom.entity.Subscription;
import dev.newsroom.entity.User;
import dev.newsroom.exception.ResourceNotFoundException;
import dev.newsroom.metrics.NewsroomMetrics;
import dev.newsroom.repository.NewsletterRepository;
import dev.newsroom.repository.PublisherRepository;
import dev.newsroom.repository.SubscriptionRepository;
import dev.newsroom.security.AccessTarget;
import dev.newsroom.security.Action;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Set;

@Service
@RequiredArgsConstructor
@Slf4j
public class NewsletterService {

    // Stand-in for an empty IN list; generated ids are always positive.
    private static final List<Long> NO_IDS = List.of(-1L);

    private final NewsletterRepository newsletterRepository;
    private final SubscriptionRepository subscriptionRepository;
    private final PublisherRepository publisherRepository;
    private final AccessService accessService;
    private final IdService idService;
    private final NewsroomMetrics metrics;

    @Value("${newsroom.feed.page-size:" + SubscriptionResolver.DEFAULT_PAGE_SIZE + "}")
    private int feedPageSize = SubscriptionResolver.DEFAULT_PAGE_SIZE;

    @Value("${newsroom.feed.recent-size:20}")
    private int recentSize = 20;

    public Mono<NewsletterResponse> createNewsletter(User actor, NewsletterRequest request) {
        return accessService.require(actor, Action.CREATE_NEWSLETTER, AccessTarget.none())
                .then(Mono.defer(() -> checkPublisher(request.publisherId())))
                .then(Mono.defer(() -> newsletterRepository.save(Newsletter.builder()
                        .id(idService.nextId())
                        .title(request.title())
                        .content(request.content())
                        .authorId(actor.getId())
                        .publisherId(request.publisherId())
                        .createdAt(LocalDateTime.now())
                        .build())))
                .doOnNext(saved -> {
                    metrics.newsletterCreated();
                    log.info("Newsletter created: id={}, author={}, publisher={}",
                            saved.getId(), saved.getAuthorId(), saved.getPublisherId());
                })
                .map(NewsletterResponse::from);
    }

    /**
     * Journalists see their own issues, readers their subscription feed,
     * everyone else the most recent issues.
     */
    public Flux<NewsletterResponse> listNewsletters(User actor) {
        Flux<Newsletter> newsletters;
        if (Roles.isJournalist(actor)) {
            newsletters = newsletterRepository.findByAuthorId(actor.getId());
        } else if (Roles.isReader(actor)) {
            newsletters = feedFor(actor);
        } else {
            newsletters = newsletterRepository.findRecent(recentSize);
        }
        return newsletters.map(NewsletterResponse::from);
    }

    public Mono<NewsletterResponse> getNewsletter(Long id) {
        return newsletterRepository.findById(id)
                .switchIfEmpty(Mono.error(new WorkflowException(ErrorKind.NOT_FOUND)))
                .map(NewsletterResponse::from);
    }

    Flux<Newsletter> feedFor(User reader) {
        return subscriptionRepository.findByUserId(reader.getId())
                .collectList()
                .flatMapMany(subscriptions -> {
                    if (subscriptions.isEmpty()) {
                        return Flux.<Newsletter>empty();
                    }
                    return newsletterRepository.findFeedCandidates(
                                    orNone(SubscriptionResolver.publisherIds(subscriptions)),
                                    orNone(SubscriptionResolver.journalistIds(subscriptions)),
                                    feedPageSize)
                            .collectList()
                            .flatMapIterable(candidates -> resolve(subscriptions, candidates));
                })
                .doOnComplete(() -> log.debug("Resolved newsletter feed for reader {}", reader.getId()));
    }

    private List<Newsletter> resolve(List<Subscription> subscriptions, List<Newsletter> candidates) {
        return SubscriptionResolver.resolveVisibleNewsletters(subscriptions, candidates, feedPageSize);
    }

    private static Collection<Long> orNone(Set<Long> ids) {
        return ids.isEmpty() ? NO_IDS : ids;
    }

    private Mono<Void> checkPublisher(Long publisherId) {
        if (publisherId == null) {
            return Mono.empty();
        }
        return publisherRepository.existsById(publisherId)
                .flatMap(exists -> Boolean.TRUE.equals(exists)
                        ? Mono.<Void>empty()
                        : Mono.<Void>error(new ResourceNotFoundException("Publisher", "id", publisherId)));
    }
}
