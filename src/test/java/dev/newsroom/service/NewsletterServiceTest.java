package dev.newsroom.service;

import dev.newsroom.domain.ErrorKind;
import dev.newsroom.domain.WorkflowException;
import dev.newsroom.dto.NewsletterRequest;
import dev.newsroom.entity.Newsletter;
import dev.newsroom.entity.Subscription;
import dev.newsroom.entity.User;
import dev.newsroom.entity.UserRole;
import dev.newsroom.exception.ActionDeniedException;
import dev.newsroom.exception.ResourceNotFoundException;
import dev.newsroom.metrics.NewsroomMetrics;
import dev.newsroom.repository.NewsletterRepository;
import dev.newsroom.repository.PublisherRepository;
import dev.newsroom.repository.SubscriptionRepository;
import dev.newsroom.security.AccessControlGate;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class NewsletterServiceTest {

    private static final LocalDateTime BASE = LocalDateTime.of(2025, 6, 1, 7, 0);

    @Mock
    private NewsletterRepository newsletterRepository;
    @Mock
    private SubscriptionRepository subscriptionRepository;
    @Mock
    private PublisherRepository publisherRepository;
    @Mock
    private IdService idService;

    private NewsletterService newsletterService;

    private final User reader = User.builder().id(4L).role(UserRole.READER).build();
    private final User journalist = User.builder().id(20L).role(UserRole.JOURNALIST).build();
    private final User editor = User.builder().id(2L).role(UserRole.EDITOR).build();

    @BeforeEach
    void setUp() {
        NewsroomMetrics metrics = new NewsroomMetrics(new SimpleMeterRegistry());
        metrics.init();
        newsletterService = new NewsletterService(newsletterRepository, subscriptionRepository, publisherRepository,
                new AccessService(new AccessControlGate(), metrics), idService, metrics);
    }

    private static Newsletter newsletter(Long id, Long authorId, Long publisherId, int minutes) {
        return Newsletter.builder()
                .id(id)
                .newRecord(false)
                .title("Morning brief " + id)
                .content("...")
                .authorId(authorId)
                .publisherId(publisherId)
                .createdAt(BASE.plusMinutes(minutes))
                .build();
    }

    private static Subscription toPublisher(Long publisherId) {
        return Subscription.builder().id(1L).userId(4L).publisherId(publisherId).build();
    }

    private static Subscription toJournalist(Long journalistId) {
        return Subscription.builder().id(2L).userId(4L).journalistId(journalistId).build();
    }

    @Nested
    @DisplayName("reader feed")
    class Feed {

        @Test
        @DisplayName("should merge publisher and journalist subscriptions, newest first")
        void shouldResolveFeed() {
            when(subscriptionRepository.findByUserId(4L)).thenReturn(Flux.just(toPublisher(100L), toJournalist(20L)));
            when(newsletterRepository.findFeedCandidates(anyCollection(), anyCollection(), eq(50)))
                    .thenReturn(Flux.just(
                            newsletter(1L, 20L, 100L, 1),
                            newsletter(2L, 21L, 100L, 5),
                            newsletter(3L, 20L, null, 3),
                            newsletter(4L, 99L, 101L, 9)));

            StepVerifier.create(newsletterService.listNewsletters(reader).map(n -> n.getId()))
                    .expectNext("2", "3", "1")
                    .verifyComplete();
        }

        @Test
        @DisplayName("after unsubscribing, the journalist's newsletters disappear")
        void shouldDropContentAfterUnsubscribe() {
            when(subscriptionRepository.findByUserId(4L))
                    .thenReturn(Flux.just(toJournalist(20L)), Flux.empty());
            when(newsletterRepository.findFeedCandidates(anyCollection(), anyCollection(), anyInt()))
                    .thenReturn(Flux.just(newsletter(3L, 20L, null, 3)));

            StepVerifier.create(newsletterService.feedFor(reader)).expectNextCount(1).verifyComplete();
            StepVerifier.create(newsletterService.feedFor(reader)).verifyComplete();
        }

        @Test
        @DisplayName("a reader without subscriptions gets an empty feed without querying newsletters")
        void shouldSkipQueryWithoutSubscriptions() {
            when(subscriptionRepository.findByUserId(4L)).thenReturn(Flux.empty());

            StepVerifier.create(newsletterService.listNewsletters(reader)).verifyComplete();

            verify(newsletterRepository, never()).findFeedCandidates(anyCollection(), anyCollection(), anyInt());
        }

        @Test
        @DisplayName("should honour the configured page size")
        void shouldCapFeed() {
            ReflectionTestUtils.setField(newsletterService, "feedPageSize", 1);
            when(subscriptionRepository.findByUserId(4L)).thenReturn(Flux.just(toPublisher(100L)));
            when(newsletterRepository.findFeedCandidates(anyCollection(), anyCollection(), eq(1)))
                    .thenReturn(Flux.just(newsletter(1L, 20L, 100L, 1), newsletter(2L, 20L, 100L, 2)));

            StepVerifier.create(newsletterService.feedFor(reader).map(Newsletter::getId))
                    .expectNext(2L)
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("listing by role")
    class Listing {

        @Test
        @DisplayName("journalists see their own newsletters")
        void shouldListOwn() {
            when(newsletterRepository.findByAuthorId(20L)).thenReturn(Flux.just(newsletter(3L, 20L, null, 0)));

            StepVerifier.create(newsletterService.listNewsletters(journalist)).expectNextCount(1).verifyComplete();
        }

        @Test
        @DisplayName("other callers see the most recent issues")
        void shouldListRecent() {
            when(newsletterRepository.findRecent(20)).thenReturn(Flux.empty());

            StepVerifier.create(newsletterService.listNewsletters(null)).verifyComplete();
        }
    }

    @Nested
    @DisplayName("create")
    class Create {

        @Test
        @DisplayName("a journalist should publish a newsletter immediately")
        void shouldCreate() {
            when(publisherRepository.existsById(100L)).thenReturn(Mono.just(true));
            when(idService.nextId()).thenReturn(700L);
            when(newsletterRepository.save(any(Newsletter.class))).thenAnswer(inv -> Mono.just(inv.getArgument(0)));

            StepVerifier.create(newsletterService.createNewsletter(journalist,
                            new NewsletterRequest("Weekly", "Five stories", 100L)))
                    .assertNext(response -> {
                        assertThat(response.getId()).isEqualTo("700");
                        assertThat(response.getAuthorId()).isEqualTo("20");
                        assertThat(response.getPublisherId()).isEqualTo("100");
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("an unknown publisher fails creation")
        void shouldRejectUnknownPublisher() {
            when(publisherRepository.existsById(404L)).thenReturn(Mono.just(false));

            StepVerifier.create(newsletterService.createNewsletter(journalist,
                            new NewsletterRequest("Weekly", "Five stories", 404L)))
                    .expectError(ResourceNotFoundException.class)
                    .verify();
        }

        @Test
        @DisplayName("editors cannot write newsletters")
        void shouldDenyEditor() {
            StepVerifier.create(newsletterService.createNewsletter(editor, new NewsletterRequest("t", "c", null)))
                    .expectError(ActionDeniedException.class)
                    .verify();
        }
    }

    @Test
    @DisplayName("a missing newsletter is NOT_FOUND")
    void shouldReportMissingNewsletter() {
        when(newsletterRepository.findById(9L)).thenReturn(Mono.empty());

        StepVerifier.create(newsletterService.getNewsletter(9L))
                .expectErrorSatisfies(e -> assertThat(((WorkflowException) e).getKind()).isEqualTo(ErrorKind.NOT_FOUND))
                .verify();
    }

    @Test
    @DisplayName("empty id sets are replaced by a sentinel for the IN query")
    void shouldSendSentinelForMissingKind() {
        when(subscriptionRepository.findByUserId(4L)).thenReturn(Flux.just(toPublisher(100L)));
        when(newsletterRepository.findFeedCandidates(anyCollection(), eq(List.of(-1L)), anyInt())).thenReturn(Flux.empty());

        StepVerifier.create(newsletterService.feedFor(reader)).verifyComplete();
    }
}
