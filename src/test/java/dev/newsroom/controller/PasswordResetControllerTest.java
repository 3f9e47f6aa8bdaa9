package dev.newsroom.controller;

import dev.newsroom.dto.PasswordResetConfirmRequest;
import dev.newsroom.dto.PasswordResetRequest;
import dev.newsroom.service.PasswordResetService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.MessageSource;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PasswordResetControllerTest {

    @Mock
    private PasswordResetService passwordResetService;

    @Mock
    private MessageSource messageSource;

    @InjectMocks
    private PasswordResetController controller;

    @BeforeEach
    void setUp() {
        lenient().when(messageSource.getMessage(anyString(), any(), anyString(), any(Locale.class)))
                .thenAnswer(inv -> inv.getArgument(2));
    }

    @Test
    @DisplayName("a reset request always answers with the same message")
    void shouldAcknowledgeRequest() {
        PasswordResetRequest request = PasswordResetRequest.builder().email("nobody@example.com").build();
        when(passwordResetService.requestPasswordReset("nobody@example.com")).thenReturn(Mono.empty());

        StepVerifier.create(controller.requestPasswordReset(request))
                .assertNext(response -> assertThat(response.getMessage()).isEqualTo("success.password_reset_requested"))
                .verifyComplete();
    }

    @Test
    @DisplayName("validate wraps the result in a map")
    void shouldValidate() {
        when(passwordResetService.validateToken("tok")).thenReturn(Mono.just(true));

        StepVerifier.create(controller.validateResetToken("tok"))
                .assertNext(body -> assertThat(body).containsEntry("valid", true))
                .verifyComplete();
    }

    @Test
    @DisplayName("confirm propagates an invalid token")
    void shouldPropagateInvalidToken() {
        PasswordResetConfirmRequest request = PasswordResetConfirmRequest.builder()
                .token("tok")
                .newPassword("long-enough-pass")
                .build();
        when(passwordResetService.resetPassword("tok", "long-enough-pass"))
                .thenReturn(Mono.error(new SecurityException("error.invalid_reset_token")));

        StepVerifier.create(controller.confirmPasswordReset(request))
                .expectError(SecurityException.class)
                .verify();
    }
}
