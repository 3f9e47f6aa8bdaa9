package dev.newsroom.controller;

import dev.newsroom.dto.AuthResponse;
import dev.newsroom.dto.LoginRequest;
import dev.newsroom.dto.RegisterRequest;
import dev.newsroom.service.AuthService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/auth")
@RequiredArgsConstructor
@Tag(name = "Authentication", description = "Registration and login")
@Slf4j
public class AuthController {

    private final AuthService authService;

    @PostMapping("/register")
    @ResponseStatus(HttpStatus.CREATED)
    @Operation(summary = "Register an account", description = "The role is fixed at registration; staff cannot self-register")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Account created"),
            @ApiResponse(responseCode = "400", description = "Invalid data or forbidden role"),
            @ApiResponse(responseCode = "409", description = "Username, email or publisher name taken")
    })
    public Mono<AuthResponse> register(@Valid @RequestBody RegisterRequest request) {
        log.info("Registration for username='{}' role={}", request.username(), request.role());
        return authService.register(request);
    }

    @PostMapping("/login")
    @Operation(summary = "Log in", description = "Exchanges username and password for a bearer token")
    public Mono<AuthResponse> login(@Valid @RequestBody LoginRequest request) {
        log.info("Login attempt for username='{}'", request.getUsername());
        return authService.login(request);
    }
}
