package dev.newsroom.controller;

import dev.newsroom.dto.MessageResponse;
import dev.newsroom.dto.PasswordResetConfirmRequest;
import dev.newsroom.dto.PasswordResetRequest;
import dev.newsroom.service.PasswordResetService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.MessageSource;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.Locale;
import java.util.Map;

/**
 * Public password reset flow. Responses never reveal whether an account exists.
 */
@RestController
@RequestMapping("/api/v1/auth/password-reset")
@RequiredArgsConstructor
@Tag(name = "Password Reset", description = "Password reset endpoints")
@Slf4j
public class PasswordResetController {

    private final PasswordResetService passwordResetService;
    private final MessageSource messageSource;

    private String msg(String key) {
        return messageSource.getMessage(key, null, key, Locale.ENGLISH);
    }

    @PostMapping("/request")
    @ResponseStatus(HttpStatus.ACCEPTED)
    @Operation(summary = "Request a password reset email",
            description = "Always accepted, whether or not the address belongs to an account")
    @ApiResponses({
            @ApiResponse(responseCode = "202", description = "Request accepted"),
            @ApiResponse(responseCode = "400", description = "Invalid email format")
    })
    public Mono<MessageResponse> requestPasswordReset(@Valid @RequestBody PasswordResetRequest request) {
        log.info("Password reset requested");
        return passwordResetService.requestPasswordReset(request.getEmail())
                .then(Mono.fromCallable(() -> MessageResponse.of(msg("success.password_reset_requested"))));
    }

    @GetMapping("/validate")
    @Operation(summary = "Check a reset token before showing the reset form")
    public Mono<Map<String, Boolean>> validateResetToken(@RequestParam(required = false) String token) {
        return passwordResetService.validateToken(token)
                .map(valid -> Map.of("valid", valid));
    }

    @PostMapping("/confirm")
    @Operation(summary = "Set a new password with a reset token")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Password changed"),
            @ApiResponse(responseCode = "400", description = "Token invalid, expired or already used")
    })
    public Mono<MessageResponse> confirmPasswordReset(@Valid @RequestBody PasswordResetConfirmRequest request) {
        return passwordResetService.resetPassword(request.getToken(), request.getNewPassword())
                .then(Mono.fromCallable(() -> MessageResponse.of(msg("success.password_reset"))));
    }
}
