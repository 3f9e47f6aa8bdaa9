package dev.newsroom.exception;

import dev.newsroom.domain.ErrorKind;
import dev.newsroom.domain.WorkflowException;
import dev.newsroom.security.Action;
import dev.newsroom.security.DenialReason;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.springframework.context.support.ResourceBundleMessageSource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;
import org.springframework.mock.web.server.MockServerWebExchange;
import org.springframework.security.authentication.BadCredentialsException;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;
    private MockServerWebExchange exchange;

    @BeforeEach
    void setUp() {
        ResourceBundleMessageSource messageSource = new ResourceBundleMessageSource();
        messageSource.setBasename("messages");
        messageSource.setDefaultEncoding("UTF-8");
        handler = new GlobalExceptionHandler(messageSource);
        exchange = MockServerWebExchange.from(MockServerHttpRequest.post("/api/v1/articles/50/approve")
                .header(HttpHeaders.ACCEPT_LANGUAGE, "en-US,en;q=0.9"));
    }

    @Nested
    @DisplayName("workflow failures")
    class Workflow {

        @Test
        @DisplayName("ALREADY_DECIDED maps to 409 with its code")
        void shouldMapAlreadyDecided() {
            StepVerifier.create(handler.handleWorkflow(new WorkflowException(ErrorKind.ALREADY_DECIDED), exchange))
                    .assertNext(response -> {
                        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
                        assertThat(response.getBody().getCode()).isEqualTo("ALREADY_DECIDED");
                        assertThat(response.getBody().getMessage())
                                .isEqualTo("The article has already been approved or rejected");
                        assertThat(response.getBody().getPath()).isEqualTo("/api/v1/articles/50/approve");
                    })
                    .verifyComplete();
        }

        @ParameterizedTest
        @EnumSource(ErrorKind.class)
        @DisplayName("every kind has a status and a message")
        void shouldCoverEveryKind(ErrorKind kind) {
            assertThat(GlobalExceptionHandler.statusFor(kind).is4xxClientError()).isTrue();

            StepVerifier.create(handler.handleWorkflow(new WorkflowException(kind), exchange))
                    .assertNext(response -> assertThat(response.getBody().getMessage()).doesNotStartWith("error."))
                    .verifyComplete();
        }

        @Test
        @DisplayName("status mapping")
        void shouldMapStatuses() {
            assertThat(GlobalExceptionHandler.statusFor(ErrorKind.NOT_FOUND)).isEqualTo(HttpStatus.NOT_FOUND);
            assertThat(GlobalExceptionHandler.statusFor(ErrorKind.INVALID_TRANSITION)).isEqualTo(HttpStatus.CONFLICT);
            assertThat(GlobalExceptionHandler.statusFor(ErrorKind.NOT_OWNER)).isEqualTo(HttpStatus.FORBIDDEN);
            assertThat(GlobalExceptionHandler.statusFor(ErrorKind.AMBIGUOUS_TARGET)).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
        }
    }

    @Nested
    @DisplayName("access denials")
    class Denials {

        @Test
        @DisplayName("a denial maps to 403 with the reason as code")
        void shouldMapDenial() {
            var ex = new ActionDeniedException(Action.APPROVE_ARTICLE, DenialReason.NOT_PUBLISHER_EDITOR);

            StepVerifier.create(handler.handleActionDenied(ex, exchange))
                    .assertNext(response -> {
                        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN);
                        assertThat(response.getBody().getCode()).isEqualTo("NOT_PUBLISHER_EDITOR");
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("a missing publisher scope answers 422 like the workflow error")
        void shouldMapPublisherScopeLikeWorkflowError() {
            var ex = new ActionDeniedException(Action.APPROVE_ARTICLE, DenialReason.NO_PUBLISHER_SCOPE);

            StepVerifier.create(handler.handleActionDenied(ex, exchange))
                    .assertNext(response -> {
                        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
                        assertThat(response.getStatusCode())
                                .isEqualTo(GlobalExceptionHandler.statusFor(ErrorKind.NO_PUBLISHER_SCOPE));
                        assertThat(response.getBody().getCode()).isEqualTo("NO_PUBLISHER_SCOPE");
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("an anonymous denial maps to 401")
        void shouldMapUnauthenticated() {
            var ex = new ActionDeniedException(Action.CREATE_ARTICLE, DenialReason.UNAUTHENTICATED);

            StepVerifier.create(handler.handleActionDenied(ex, exchange))
                    .assertNext(response -> assertThat(response.getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED))
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("other errors")
    class Others {

        @Test
        @DisplayName("duplicates map to 409 with a localized message")
        void shouldMapDuplicate() {
            StepVerifier.create(handler.handleDuplicateResource(
                            new DuplicateResourceException("error.publisher_name_taken"), exchange))
                    .assertNext(response -> {
                        assertThat(response.getStatus()).isEqualTo(409);
                        assertThat(response.getMessage()).isEqualTo("A publishing house with that name already exists");
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("not found keeps a plain message")
        void shouldMapNotFound() {
            StepVerifier.create(handler.handleResourceNotFound(
                            new ResourceNotFoundException("Publisher", "id", 404L), exchange))
                    .assertNext(response -> {
                        assertThat(response.getStatus()).isEqualTo(404);
                        assertThat(response.getMessage()).isEqualTo("Publisher not found with id: '404'");
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("bad credentials never reveal which part was wrong")
        void shouldMapBadCredentials() {
            StepVerifier.create(handler.handleBadCredentials(new BadCredentialsException("user missing"), exchange))
                    .assertNext(response -> {
                        assertThat(response.getStatus()).isEqualTo(401);
                        assertThat(response.getMessage()).doesNotContain("user missing");
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("unexpected errors hide their details")
        void shouldHideInternalErrors() {
            StepVerifier.create(handler.handleGenericException(new IllegalStateException("db password wrong"), exchange))
                    .assertNext(response -> {
                        assertThat(response.getStatus()).isEqualTo(500);
                        assertThat(response.getMessage()).doesNotContain("db password");
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("a malformed Accept-Language header falls back to English")
        void shouldIgnoreMalformedLanguage() {
            MockServerWebExchange odd = MockServerWebExchange.from(MockServerHttpRequest.get("/api/v1/newsletters")
                    .header(HttpHeaders.ACCEPT_LANGUAGE, ";;;q=abc"));

            StepVerifier.create(handler.handleWorkflow(new WorkflowException(ErrorKind.NOT_FOUND), odd))
                    .assertNext(response -> assertThat(response.getBody().getMessage())
                            .isEqualTo("The requested resource does not exist"))
                    .verifyComplete();
        }
    }
}
