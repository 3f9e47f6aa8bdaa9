package dev.newsroom.service;

import dev.newsroom.domain.ArticleChanges;
import dev.newsroom.domain.ArticleWorkflow;
import dev.newsroom.domain.ErrorKind;
import dev.newsroom.domain.Outcome;
import dev.newsroom.domain.PublisherTeam;
import dev.newsroom.domain.Roles;
import dev.newsroom.domain.WorkflowException;
import dev.newsroom.dto.ArticleRequest;
import dev.newsroom.dto.ArticleResponse;
import dev.newsroom.dto.ArticleUpdateRequest;
import dev.newsroom.dto.PageResponse;
import dev.newsroom.entity.Article;
import dev.newsroom.entity.ArticleStatus;
import dev.newsroom.entity.MemberRole;
import dev.newsroom.entity.PublisherMember;
import dev.newsroom.entity.User;
import dev.newsroom.exception.ResourceNotFoundException;
import dev.newsroom.metrics.NewsroomMetrics;
import dev.newsroom.repository.ArticleRepository;
import dev.newsroom.repository.CategoryRepository;
import dev.newsroom.repository.PublisherMemberRepository;
import dev.newsroom.repository.PublisherRepository;
import dev.newsroom.security.AccessTarget;
import dev.newsroom.security.Action;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Article use cases. Each mutation loads the article and its publisher team,
 * asks the gate, applies the pure {@link ArticleWorkflow} step and persists.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ArticleService {

    private final ArticleRepository articleRepository;
    private final CategoryRepository categoryRepository;
    private final PublisherRepository publisherRepository;
    private final PublisherMemberRepository memberRepository;
    private final PublisherService publisherService;
    private final AccessService accessService;
    private final IdService idService;
    private final NewsroomMetrics metrics;

    /**
     * Role-scoped listing: readers and anonymous callers see published articles,
     * journalists their own, editors those of their houses, staff everything.
     */
    public Mono<PageResponse<ArticleResponse>> listArticles(User actor, int page, int size) {
        int offset = page * size;
        if (Roles.isJournalist(actor)) {
            return page(articleRepository.findByAuthorId(actor.getId(), size, offset),
                    articleRepository.countByAuthorId(actor.getId()), page, size);
        }
        if (Roles.isStaff(actor)) {
            return page(articleRepository.findAllPaged(size, offset), articleRepository.countAll(), page, size);
        }
        if (Roles.isEditor(actor)) {
            return memberRepository.findByUserIdAndMemberRole(actor.getId(), MemberRole.EDITOR.name())
                    .map(PublisherMember::getPublisherId)
                    .collectList()
                    .flatMap(publisherIds -> publisherIds.isEmpty()
                            ? Mono.just(PageResponse.of(List.<ArticleResponse>of(), page, size, 0))
                            : page(articleRepository.findByPublisherIdIn(publisherIds, size, offset),
                                    articleRepository.countByPublisherIdIn(publisherIds), page, size));
        }
        return page(articleRepository.findPublished(size, offset), articleRepository.countPublished(), page, size);
    }

    /**
     * Published articles only. Blank filters are ignored.
     */
    public Mono<PageResponse<ArticleResponse>> searchArticles(String query, String category, String publisher,
                                                              int page, int size) {
        String q = normalize(query);
        String c = normalize(category);
        String p = normalize(publisher);
        log.debug("Searching articles q='{}' category='{}' publisher='{}'", q, c, p);
        return page(articleRepository.searchPublished(q, c, p, size, page * size),
                articleRepository.countSearchPublished(q, c, p), page, size);
    }

    public Mono<ArticleResponse> getArticle(User actor, Long id) {
        return load(id)
                .flatMap(ctx -> accessService.require(actor, Action.VIEW_ARTICLE, ctx.target())
                        .thenReturn(ctx.article()))
                .map(ArticleResponse::from);
    }

    public Mono<ArticleResponse> createArticle(User actor, ArticleRequest request) {
        return accessService.require(actor, Action.CREATE_ARTICLE, AccessTarget.none())
                .then(Mono.defer(() -> checkPublisher(request.getPublisherId())))
                .then(Mono.defer(() -> checkCategory(request.getCategoryId())))
                .then(Mono.defer(() -> {
                    LocalDateTime now = LocalDateTime.now();
                    Article article = Article.builder()
                            .id(idService.nextId())
                            .title(request.getTitle())
                            .summary(request.getSummary())
                            .content(request.getContent())
                            .authorId(actor.getId())
                            .publisherId(request.getPublisherId())
                            .categoryId(request.getCategoryId())
                            .status(ArticleStatus.DRAFT)
                            .createdAt(now)
                            .updatedAt(now)
                            .build();
                    return articleRepository.save(article);
                }))
                .doOnNext(saved -> {
                    metrics.articleCreated();
                    log.info("Article created: id={}, author={}, publisher={}",
                            saved.getId(), saved.getAuthorId(), saved.getPublisherId());
                })
                .map(ArticleResponse::from);
    }

    public Mono<ArticleResponse> updateArticle(User actor, Long id, ArticleUpdateRequest request) {
        ArticleChanges changes = new ArticleChanges(
                request.getTitle(), request.getSummary(), request.getContent(), request.getCategoryId());
        return load(id)
                .flatMap(ctx -> accessService.require(actor, Action.EDIT_ARTICLE, ctx.target())
                        .then(Mono.defer(() -> checkCategory(changes.categoryId())))
                        .then(Mono.fromCallable(() -> ArticleWorkflow
                                .edit(ctx.article(), actor, ctx.team(), changes, LocalDateTime.now())
                                .orElseThrow())))
                .flatMap(edited -> articleRepository
                        .updateContentIfOpen(edited.getId(), edited.getTitle(), edited.getSummary(),
                                edited.getContent(), edited.getCategoryId(), edited.getUpdatedAt())
                        .flatMap(rows -> guarded(rows, id, "edit"))
                        .then(Mono.defer(() -> articleRepository.findById(id))))
                .doOnNext(saved -> log.info("Article {} edited by user {}", saved.getId(), actor.getId()))
                .map(ArticleResponse::from);
    }

    public Mono<ArticleResponse> submitArticle(User actor, Long id) {
        return load(id)
                .flatMap(ctx -> accessService.require(actor, Action.SUBMIT_ARTICLE, ctx.target())
                        .then(Mono.fromCallable(() -> ArticleWorkflow
                                .submit(ctx.article(), actor, LocalDateTime.now())
                                .orElseThrow())))
                .flatMap(submitted -> articleRepository.submitIfDraft(submitted.getId(), submitted.getUpdatedAt())
                        .flatMap(rows -> guarded(rows, id, "submit"))
                        .thenReturn(submitted))
                .doOnNext(saved -> {
                    metrics.articleSubmitted();
                    log.info("Article {} submitted for review", saved.getId());
                })
                .map(ArticleResponse::from);
    }

    public Mono<ArticleResponse> approveArticle(User actor, Long id) {
        return decide(actor, id, Action.APPROVE_ARTICLE, ArticleWorkflow::approve);
    }

    public Mono<ArticleResponse> rejectArticle(User actor, Long id) {
        return decide(actor, id, Action.REJECT_ARTICLE, ArticleWorkflow::reject);
    }

    /**
     * The decision is written with a conditional update on {@code status = 'PENDING'}.
     * When two editors race, the one whose update hits zero rows gets ALREADY_DECIDED.
     */
    private Mono<ArticleResponse> decide(User actor, Long id, Action action, Decider decider) {
        return load(id)
                .flatMap(ctx -> accessService.require(actor, action, ctx.target())
                        .then(Mono.fromCallable(() -> decider
                                .apply(ctx.article(), actor, ctx.team(), LocalDateTime.now())
                                .orElseThrow())))
                .flatMap(decided -> articleRepository
                        .decideIfPending(decided.getId(), decided.getStatus().name(),
                                decided.getApprovedBy(), decided.getApprovedAt())
                        .flatMap(rows -> {
                            if (rows == 0) {
                                metrics.decisionConflict();
                                log.warn("Article {} was decided concurrently; {} by user {} discarded",
                                        id, decided.getStatus(), actor.getId());
                                return Mono.<Article>error(new WorkflowException(ErrorKind.ALREADY_DECIDED));
                            }
                            metrics.articleDecided(decided.getStatus());
                            log.info("Article {} {} by editor {}", id, decided.getStatus(), actor.getId());
                            return Mono.just(decided);
                        }))
                .map(ArticleResponse::from);
    }

    /**
     * Status-guarded writes report 0 rows when the article moved on after it was loaded.
     */
    private Mono<Void> guarded(int rows, Long id, String operation) {
        if (rows == 0) {
            log.warn("Article {} changed state concurrently; {} discarded", id, operation);
            return Mono.error(new WorkflowException(ErrorKind.INVALID_TRANSITION));
        }
        return Mono.empty();
    }

    private Mono<ArticleContext> load(Long id) {
        return articleRepository.findById(id)
                .switchIfEmpty(Mono.error(new WorkflowException(ErrorKind.NOT_FOUND)))
                .flatMap(article -> article.hasPublisher()
                        ? publisherService.loadTeam(article.getPublisherId())
                                .map(team -> new ArticleContext(article, team))
                        : Mono.just(new ArticleContext(article, null)));
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

    private Mono<Void> checkCategory(Long categoryId) {
        if (categoryId == null) {
            return Mono.empty();
        }
        return categoryRepository.existsById(categoryId)
                .flatMap(exists -> Boolean.TRUE.equals(exists)
                        ? Mono.<Void>empty()
                        : Mono.<Void>error(new ResourceNotFoundException("Category", "id", categoryId)));
    }

    private Mono<PageResponse<ArticleResponse>> page(Flux<Article> content, Mono<Long> total, int page, int size) {
        return content.map(ArticleResponse::from)
                .collectList()
                .zipWith(total)
                .map(tuple -> PageResponse.of(tuple.getT1(), page, size, tuple.getT2()));
    }

    private static String normalize(String filter) {
        return filter == null ? "" : filter.trim();
    }

    private record ArticleContext(Article article, PublisherTeam team) {
        AccessTarget target() {
            return AccessTarget.article(article, team);
        }
    }

    @FunctionalInterface
    private interface Decider {
        Outcome<Article> apply(Article article, User editor, PublisherTeam team, LocalDateTime now);
    }
}
