package dev.newsroom.service;

import dev.newsroom.dto.AuthResponse;
import dev.newsroom.dto.LoginRequest;
import dev.newsroom.dto.RegisterRequest;
import dev.newsroom.entity.MemberRole;
import dev.newsroom.entity.User;
import dev.newsroom.entity.UserRole;
import dev.newsroom.exception.DuplicateResourceException;
import dev.newsroom.repository.UserRepository;
import dev.newsroom.security.JwtTokenProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.LocalDateTime;
import java.util.Locale;

/**
 * Registration and login. The role chosen at registration is permanent.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AuthService {

    private final UserRepository userRepository;
    private final PublisherService publisherService;
    private final PasswordEncoder passwordEncoder;
    private final JwtTokenProvider tokenProvider;
    private final IdService idService;

    /**
     * Creates the account. A PUBLISHER also founds the house named in the request;
     * an EDITOR joins the named house, a JOURNALIST optionally does. STAFF accounts
     * are provisioned out of band and cannot self-register.
     */
    @Transactional
    public Mono<AuthResponse> register(RegisterRequest request) {
        UserRole role = request.role();
        if (role == UserRole.STAFF) {
            return Mono.error(new IllegalArgumentException("error.staff_registration_forbidden"));
        }
        boolean namesPublisher = StringUtils.hasText(request.publisherName());
        if ((role == UserRole.PUBLISHER || role == UserRole.EDITOR) && !namesPublisher) {
            return Mono.error(new IllegalArgumentException("error.publisher_name_required"));
        }
        String email = request.email().toLowerCase(Locale.ROOT).trim();

        return userRepository.existsByUsername(request.username())
                .flatMap(taken -> Boolean.TRUE.equals(taken)
                        ? Mono.<Boolean>error(new DuplicateResourceException("error.username_taken"))
                        : userRepository.existsByEmail(email))
                .flatMap(taken -> Boolean.TRUE.equals(taken)
                        ? Mono.<String>error(new DuplicateResourceException("error.email_taken"))
                        : Mono.fromCallable(() -> passwordEncoder.encode(request.password()))
                                .subscribeOn(Schedulers.boundedElastic()))
                .flatMap(hash -> {
                    LocalDateTime now = LocalDateTime.now();
                    return userRepository.save(User.builder()
                            .id(idService.nextId())
                            .username(request.username())
                            .email(email)
                            .passwordHash(hash)
                            .firstName(request.firstName())
                            .lastName(request.lastName())
                            .role(role)
                            .active(true)
                            .createdAt(now)
                            .updatedAt(now)
                            .build());
                })
                .flatMap(user -> attachToPublisher(user, request).thenReturn(user))
                .doOnNext(user -> log.info("Registered user {} with role {}", user.getId(), user.getRole()))
                .map(this::toAuthResponse);
    }

    private Mono<Void> attachToPublisher(User user, RegisterRequest request) {
        return switch (user.getRole()) {
            case PUBLISHER -> publisherService.createForOwner(user, request.publisherName(), null, null).then();
            case EDITOR -> publisherService.joinByName(request.publisherName(), user, MemberRole.EDITOR).then();
            case JOURNALIST -> StringUtils.hasText(request.publisherName())
                    ? publisherService.joinByName(request.publisherName(), user, MemberRole.JOURNALIST).then()
                    : Mono.empty();
            default -> Mono.empty();
        };
    }

    public Mono<AuthResponse> login(LoginRequest request) {
        return userRepository.findByUsername(request.getUsername())
                .filter(user -> Boolean.TRUE.equals(user.getActive()))
                .flatMap(user -> Mono.fromCallable(() -> passwordEncoder.matches(request.getPassword(), user.getPasswordHash()))
                        .subscribeOn(Schedulers.boundedElastic())
                        .filter(Boolean::booleanValue)
                        .map(matched -> user))
                .switchIfEmpty(Mono.defer(() -> {
                    log.warn("Failed login for username '{}'", request.getUsername());
                    return Mono.error(new BadCredentialsException("error.invalid_credentials"));
                }))
                .doOnNext(user -> log.info("User {} logged in", user.getId()))
                .map(this::toAuthResponse);
    }

    private AuthResponse toAuthResponse(User user) {
        return AuthResponse.builder()
                .token(tokenProvider.generateToken(user.getUsername(), user.getRole().name()))
                .expiresIn(tokenProvider.getExpirationMillis() / 1000)
                .userId(String.valueOf(user.getId()))
                .username(user.getUsername())
                .role(user.getRole().name())
                .build();
    }
}
