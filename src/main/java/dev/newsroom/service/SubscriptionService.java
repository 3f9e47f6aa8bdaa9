package dev.newsroom.service;

import dev.newsroom.domain.ErrorKind;
import dev.newsroom.domain.Outcome;
import dev.newsroom.domain.SubscriptionTarget;
import dev.newsroom.domain.WorkflowException;
import dev.newsroom.dto.SubscribeRequest;
import dev.newsroom.entity.Subscription;
import dev.newsroom.entity.User;
import dev.newsroom.entity.UserRole;
import dev.newsroom.exception.ActionDeniedException;
import dev.newsroom.metrics.NewsroomMetrics;
import dev.newsroom.repository.PublisherRepository;
import dev.newsroom.repository.SubscriptionRepository;
import dev.newsroom.repository.UserRepository;
import dev.newsroom.security.AccessTarget;
import dev.newsroom.security.Action;
import dev.newsroom.security.DenialReason;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

/**
 * Reader subscriptions to publishers and journalists.
 * <p>
 * Subscribing is idempotent: an existing subscription, or one inserted
 * concurrently (unique index violation), comes back as an unchanged outcome.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SubscriptionService {

    private final SubscriptionRepository subscriptionRepository;
    private final PublisherRepository publisherRepository;
    private final UserRepository userRepository;
    private final AccessService accessService;
    private final IdService idService;
    private final NewsroomMetrics metrics;

    public Flux<Subscription> listSubscriptions(User reader) {
        return accessService.require(reader, Action.SUBSCRIBE, AccessTarget.none())
                .thenMany(Flux.defer(() -> subscriptionRepository.findByUserId(reader.getId())));
    }

    public Mono<Outcome<Subscription>> subscribe(User reader, SubscribeRequest request) {
        return accessService.require(reader, Action.SUBSCRIBE, AccessTarget.none())
                .then(Mono.defer(() -> {
                    SubscriptionTarget target = SubscriptionTarget.of(request.publisherId(), request.journalistId())
                            .orElseThrow();
                    return target.isPublisher()
                            ? subscribeToPublisher(reader, target.publisherId())
                            : subscribeToJournalist(reader, target.journalistId());
                }));
    }

    private Mono<Outcome<Subscription>> subscribeToPublisher(User reader, Long publisherId) {
        return publisherRepository.existsById(publisherId)
                .flatMap(exists -> {
                    if (!Boolean.TRUE.equals(exists)) {
                        return Mono.<Outcome<Subscription>>error(new WorkflowException(ErrorKind.NOT_FOUND));
                    }
                    return insertOnce(reader,
                            Subscription.builder().publisherId(publisherId),
                            Mono.defer(() -> subscriptionRepository.findByUserIdAndPublisherId(reader.getId(), publisherId)));
                });
    }

    private Mono<Outcome<Subscription>> subscribeToJournalist(User reader, Long journalistId) {
        return userRepository.findById(journalistId)
                .switchIfEmpty(Mono.error(new WorkflowException(ErrorKind.NOT_FOUND)))
                .flatMap(journalist -> {
                    if (!journalist.hasRole(UserRole.JOURNALIST)) {
                        return Mono.<Outcome<Subscription>>error(new WorkflowException(ErrorKind.ROLE_MISMATCH));
                    }
                    return insertOnce(reader,
                            Subscription.builder().journalistId(journalistId),
                            Mono.defer(() -> subscriptionRepository.findByUserIdAndJournalistId(reader.getId(), journalistId)));
                });
    }

    private Mono<Outcome<Subscription>> insertOnce(User reader, Subscription.SubscriptionBuilder draft,
                                                   Mono<Subscription> existing) {
        return existing
                .map(found -> {
                    log.debug("Reader {} already subscribed ({})", reader.getId(), found.getId());
                    return Outcome.unchanged(found);
                })
                .switchIfEmpty(Mono.defer(() -> subscriptionRepository.save(draft
                                .id(idService.nextId())
                                .userId(reader.getId())
                                .createdAt(LocalDateTime.now())
                                .build())
                        .map(saved -> {
                            metrics.subscriptionCreated();
                            log.info("Reader {} subscribed: publisher={}, journalist={}",
                                    reader.getId(), saved.getPublisherId(), saved.getJournalistId());
                            return Outcome.changed(saved);
                        })
                        // lost a race against an identical insert; any other violation propagates
                        .onErrorResume(DataIntegrityViolationException.class, e -> existing
                                .map(Outcome::unchanged)
                                .switchIfEmpty(Mono.error(e)))));
    }

    public Mono<Void> unsubscribe(User reader, Long subscriptionId) {
        return subscriptionRepository.findById(subscriptionId)
                .switchIfEmpty(Mono.error(new WorkflowException(ErrorKind.NOT_FOUND)))
                .flatMap(subscription -> accessService
                        .require(reader, Action.UNSUBSCRIBE, AccessTarget.subscription(subscription))
                        .onErrorMap(this::isForeignSubscription, e -> new WorkflowException(ErrorKind.NOT_OWNER))
                        .then(Mono.defer(() -> subscriptionRepository.delete(subscription)))
                        .doOnSuccess(done -> {
                            metrics.subscriptionCancelled();
                            log.info("Reader {} removed subscription {}", reader.getId(), subscriptionId);
                        }));
    }

    private boolean isForeignSubscription(Throwable error) {
        return error instanceof ActionDeniedException denied
                && denied.getReason() == DenialReason.NOT_SUBSCRIPTION_OWNER;
    }
}
