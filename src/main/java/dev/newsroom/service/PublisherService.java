package dev.newsroom.service;

import dev.newsroom.domain.ErrorKind;
import dev.newsroom.domain.Outcome;
import dev.newsroom.domain.PublisherTeam;
import dev.newsroom.domain.WorkflowException;
import dev.newsroom.dto.AddMemberRequest;
import dev.newsroom.dto.ArticleResponse;
import dev.newsroom.dto.MemberResult;
import dev.newsroom.dto.NewsletterResponse;
import dev.newsroom.dto.PublisherDashboardResponse;
import dev.newsroom.dto.PublisherRequest;
import dev.newsroom.dto.PublisherResponse;
import dev.newsroom.dto.PublisherUpdateRequest;
import dev.newsroom.entity.MemberRole;
import dev.newsroom.entity.Publisher;
import dev.newsroom.entity.PublisherMember;
import dev.newsroom.entity.User;
import dev.newsroom.entity.UserRole;
import dev.newsroom.exception.ActionDeniedException;
import dev.newsroom.exception.DuplicateResourceException;
import dev.newsroom.exception.ResourceNotFoundException;
import dev.newsroom.repository.ArticleRepository;
import dev.newsroom.repository.NewsletterRepository;
import dev.newsroom.repository.PublisherMemberRepository;
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
 * Publishing houses and their teams. Staff create and edit houses; the owner
 * manages the team.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PublisherService {

    private static final int DASHBOARD_ARTICLES = 10;
    private static final int DASHBOARD_NEWSLETTERS = 5;

    private final PublisherRepository publisherRepository;
    private final PublisherMemberRepository memberRepository;
    private final UserRepository userRepository;
    private final ArticleRepository articleRepository;
    private final NewsletterRepository newsletterRepository;
    private final SubscriptionRepository subscriptionRepository;
    private final AccessService accessService;
    private final IdService idService;

    public Mono<PublisherTeam> loadTeam(Long publisherId) {
        return publisherRepository.findById(publisherId)
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("Publisher", "id", publisherId)))
                .flatMap(this::loadTeam);
    }

    public Mono<PublisherTeam> loadTeam(Publisher publisher) {
        return memberRepository.findByPublisherId(publisher.getId())
                .collectList()
                .map(members -> PublisherTeam.of(publisher.getId(), publisher.getOwnerId(), members));
    }

    public Flux<PublisherResponse> listPublishers(User actor) {
        return accessService.require(actor, Action.LIST_PUBLISHERS, AccessTarget.none())
                .thenMany(Flux.defer(publisherRepository::findAllOrderByName))
                .map(publisher -> PublisherResponse.from(publisher, null));
    }

    public Mono<PublisherResponse> createPublisher(User actor, PublisherRequest request) {
        return accessService.require(actor, Action.CREATE_PUBLISHER, AccessTarget.none())
                .then(Mono.defer(() -> userRepository.findById(request.getOwnerId())))
                .switchIfEmpty(Mono.error(new WorkflowException(ErrorKind.NOT_FOUND)))
                .flatMap(owner -> createForOwner(owner, request.getName(), request.getDescription(), request.getWebsite()))
                .map(publisher -> PublisherResponse.from(publisher, null));
    }

    /**
     * Creates a house owned by {@code owner}, who must hold the PUBLISHER role.
     * Also used by self-registration, which has no acting staff member.
     */
    public Mono<Publisher> createForOwner(User owner, String name, String description, String website) {
        if (!owner.hasRole(UserRole.PUBLISHER)) {
            log.warn("Refusing to make user {} with role {} a publisher owner", owner.getId(), owner.getRole());
            return Mono.error(new WorkflowException(ErrorKind.ROLE_MISMATCH));
        }
        String trimmed = name.trim();
        return publisherRepository.existsByNameIgnoreCase(trimmed)
                .flatMap(exists -> {
                    if (Boolean.TRUE.equals(exists)) {
                        return Mono.<Publisher>error(new DuplicateResourceException("error.publisher_name_taken"));
                    }
                    LocalDateTime now = LocalDateTime.now();
                    Publisher publisher = Publisher.builder()
                            .id(idService.nextId())
                            .name(trimmed)
                            .description(description)
                            .website(website)
                            .ownerId(owner.getId())
                            .createdAt(now)
                            .updatedAt(now)
                            .build();
                    return publisherRepository.save(publisher);
                })
                .onErrorMap(DataIntegrityViolationException.class,
                        e -> new DuplicateResourceException("error.publisher_name_taken"))
                .doOnNext(saved -> log.info("Publisher created: id={}, name='{}', owner={}",
                        saved.getId(), saved.getName(), saved.getOwnerId()));
    }

    public Mono<PublisherResponse> updatePublisher(User actor, Long id, PublisherUpdateRequest request) {
        return accessService.require(actor, Action.EDIT_PUBLISHER, AccessTarget.none())
                .then(Mono.defer(() -> publisherRepository.findById(id)))
                .switchIfEmpty(Mono.error(new WorkflowException(ErrorKind.NOT_FOUND)))
                .flatMap(publisher -> checkRename(publisher, request.getName()).thenReturn(publisher))
                .flatMap(publisher -> {
                    if (request.getName() != null) {
                        publisher.setName(request.getName().trim());
                    }
                    if (request.getDescription() != null) {
                        publisher.setDescription(request.getDescription());
                    }
                    if (request.getWebsite() != null) {
                        publisher.setWebsite(request.getWebsite());
                    }
                    publisher.setUpdatedAt(LocalDateTime.now());
                    return publisherRepository.save(publisher);
                })
                .onErrorMap(DataIntegrityViolationException.class,
                        e -> new DuplicateResourceException("error.publisher_name_taken"))
                .flatMap(saved -> loadTeam(saved).map(team -> PublisherResponse.from(saved, team)))
                .doOnNext(saved -> log.info("Publisher {} updated", id));
    }

    private Mono<Void> checkRename(Publisher publisher, String newName) {
        if (newName == null || newName.trim().equalsIgnoreCase(publisher.getName())) {
            return Mono.empty();
        }
        return publisherRepository.existsByNameIgnoreCase(newName.trim())
                .flatMap(exists -> Boolean.TRUE.equals(exists)
                        ? Mono.<Void>error(new DuplicateResourceException("error.publisher_name_taken"))
                        : Mono.<Void>empty());
    }

    /**
     * Owner adds an editor or journalist by username. Adding an existing member
     * succeeds with {@code added = false}.
     */
    public Mono<MemberResult> addMember(User actor, Long publisherId, AddMemberRequest request) {
        return loadTeam(publisherId)
                .flatMap(team -> accessService.require(actor, Action.MANAGE_PUBLISHER_TEAM, AccessTarget.team(team))
                        .then(Mono.defer(() -> userRepository.findByUsername(request.username())))
                        .switchIfEmpty(Mono.error(new WorkflowException(ErrorKind.NOT_FOUND)))
                        .flatMap(user -> addToTeam(team, user, request.role())));
    }

    /**
     * Membership change without an acting owner: registration of an editor or journalist
     * naming the house they join.
     */
    public Mono<MemberResult> joinByName(String publisherName, User user, MemberRole role) {
        return publisherRepository.findByNameIgnoreCase(publisherName.trim())
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("error.publisher_not_found")))
                .flatMap(this::loadTeam)
                .flatMap(team -> addToTeam(team, user, role));
    }

    private Mono<MemberResult> addToTeam(PublisherTeam team, User user, MemberRole role) {
        Outcome<PublisherTeam> outcome = team.add(user, role);
        if (outcome.isFailed()) {
            log.warn("Cannot add user {} as {} of publisher {}: {}", user.getId(), role, team.publisherId(), outcome.error());
            return Mono.error(new WorkflowException(outcome.error()));
        }
        MemberResult alreadyMember = result(team, user, role, false);
        if (outcome.isUnchanged()) {
            return Mono.just(alreadyMember);
        }
        PublisherMember member = PublisherMember.builder()
                .id(idService.nextId())
                .publisherId(team.publisherId())
                .userId(user.getId())
                .memberRole(role)
                .createdAt(LocalDateTime.now())
                .build();
        return memberRepository.save(member)
                .map(saved -> result(team, user, role, true))
                .doOnNext(added -> log.info("User {} added as {} of publisher {}", user.getId(), role, team.publisherId()))
                // concurrent insert of the same membership
                .onErrorResume(DataIntegrityViolationException.class, e -> Mono.just(alreadyMember));
    }

    private static MemberResult result(PublisherTeam team, User user, MemberRole role, boolean added) {
        return new MemberResult(String.valueOf(team.publisherId()), String.valueOf(user.getId()), role.name(), added);
    }

    /**
     * Overview of the house owned by the acting publisher.
     */
    public Mono<PublisherDashboardResponse> dashboard(User actor) {
        if (actor == null) {
            return Mono.error(new ActionDeniedException(Action.MANAGE_PUBLISHER_TEAM, DenialReason.UNAUTHENTICATED));
        }
        return publisherRepository.findFirstByOwnerId(actor.getId())
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("error.publisher_not_found")))
                .flatMap(publisher -> loadTeam(publisher)
                        .flatMap(team -> accessService.require(actor, Action.MANAGE_PUBLISHER_TEAM, AccessTarget.team(team))
                                .then(Mono.defer(() -> Mono.zip(
                                        articleRepository.findRecentByPublisherId(publisher.getId(), DASHBOARD_ARTICLES)
                                                .map(ArticleResponse::from).collectList(),
                                        newsletterRepository.findRecentByPublisherId(publisher.getId(), DASHBOARD_NEWSLETTERS)
                                                .map(NewsletterResponse::from).collectList(),
                                        articleRepository.countByPublisherId(publisher.getId()),
                                        subscriptionRepository.countByPublisherId(publisher.getId()))))
                                .map(tuple -> PublisherDashboardResponse.builder()
                                        .publisher(PublisherResponse.from(publisher, team))
                                        .recentArticles(tuple.getT1())
                                        .recentNewsletters(tuple.getT2())
                                        .articleCount(tuple.getT3())
                                        .subscriberCount(tuple.getT4())
                                        .build())));
    }
}
