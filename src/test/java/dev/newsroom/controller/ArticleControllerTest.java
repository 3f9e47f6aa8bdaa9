package dev.newsroom.controller;

import dev.newsroom.domain.ErrorKind;
import dev.newsroom.domain.WorkflowException;
import dev.newsroom.dto.ArticleRequest;
import dev.newsroom.dto.ArticleResponse;
import dev.newsroom.dto.PageResponse;
import dev.newsroom.entity.User;
import dev.newsroom.entity.UserRole;
import dev.newsroom.exception.ActionDeniedException;
import dev.newsroom.security.Action;
import dev.newsroom.security.DenialReason;
import dev.newsroom.service.ArticleService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ArticleControllerTest {

    @Mock
    private ArticleService articleService;

    private final User editor = User.builder().id(2L).username("ed").role(UserRole.EDITOR).build();
    private final User journalist = User.builder().id(1L).username("jo").role(UserRole.JOURNALIST).build();

    private WebTestClient client(User actor) {
        return ControllerTestSupport.bind(new ArticleController(articleService), actor);
    }

    private static ArticleResponse response(String status) {
        return ArticleResponse.builder().id("50").title("City council").status(status)
                .approved("PUBLISHED".equals(status)).build();
    }

    @Test
    @DisplayName("GET /api/v1/articles passes the anonymous caller as null")
    void shouldListForAnonymous() {
        when(articleService.listArticles(isNull(), eq(0), eq(10)))
                .thenReturn(Mono.just(PageResponse.of(List.of(response("PUBLISHED")), 0, 10, 1)));

        client(null).get().uri("/api/v1/articles")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.content[0].id").isEqualTo("50")
                .jsonPath("$.totalElements").isEqualTo(1);
    }

    @Test
    @DisplayName("POST /approve returns the published article")
    void shouldApprove() {
        when(articleService.approveArticle(editor, 50L)).thenReturn(Mono.just(response("PUBLISHED")));

        client(editor).post().uri("/api/v1/articles/50/approve")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("PUBLISHED")
                .jsonPath("$.approved").isEqualTo(true);
    }

    @Test
    @DisplayName("a lost approval race answers 409 ALREADY_DECIDED")
    void shouldReportConflict() {
        when(articleService.approveArticle(editor, 50L))
                .thenReturn(Mono.error(new WorkflowException(ErrorKind.ALREADY_DECIDED)));

        client(editor).post().uri("/api/v1/articles/50/approve")
                .exchange()
                .expectStatus().isEqualTo(409)
                .expectBody()
                .jsonPath("$.code").isEqualTo("ALREADY_DECIDED");
    }

    @Test
    @DisplayName("a gate denial answers 403 with the reason")
    void shouldReportDenial() {
        when(articleService.rejectArticle(journalist, 50L))
                .thenReturn(Mono.error(new ActionDeniedException(Action.REJECT_ARTICLE, DenialReason.NOT_EDITOR)));

        client(journalist).post().uri("/api/v1/articles/50/reject")
                .exchange()
                .expectStatus().isForbidden()
                .expectBody()
                .jsonPath("$.code").isEqualTo("NOT_EDITOR");
    }

    @Test
    @DisplayName("POST /api/v1/articles creates a draft with 201")
    void shouldCreate() {
        when(articleService.createArticle(eq(journalist), any(ArticleRequest.class)))
                .thenReturn(Mono.just(response("DRAFT")));

        client(journalist).post().uri("/api/v1/articles")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"title\":\"City council\",\"content\":\"Body\"}")
                .exchange()
                .expectStatus().isCreated()
                .expectBody()
                .jsonPath("$.status").isEqualTo("DRAFT");
    }

    @Test
    @DisplayName("a missing title is rejected before reaching the service")
    void shouldValidateBody() {
        client(journalist).post().uri("/api/v1/articles")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"content\":\"Body\"}")
                .exchange()
                .expectStatus().isBadRequest();

        verify(articleService, never()).createArticle(any(), any());
    }
}
