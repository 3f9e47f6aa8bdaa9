package dev.newsroom.controller;

import dev.newsroom.dto.NewsletterRequest;
import dev.newsroom.dto.NewsletterResponse;
import dev.newsroom.entity.User;
import dev.newsroom.security.JwtAuthenticationFilter;
import dev.newsroom.service.NewsletterService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/newsletters")
@RequiredArgsConstructor
@Tag(name = "Newsletters", description = "Newsletter issues and reader feeds")
public class NewsletterController {

    private final NewsletterService newsletterService;

    @GetMapping
    @Operation(summary = "List newsletters",
            description = "Journalists: own issues. Readers: subscription feed. Others: most recent issues")
    public Flux<NewsletterResponse> listNewsletters(
            @RequestAttribute(name = JwtAuthenticationFilter.AUTHENTICATED_USER_ATTR, required = false) User actor) {
        return newsletterService.listNewsletters(actor);
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get a newsletter")
    public Mono<NewsletterResponse> getNewsletter(@PathVariable Long id) {
        return newsletterService.getNewsletter(id);
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    @Operation(summary = "Create a newsletter", description = "Journalists only")
    public Mono<NewsletterResponse> createNewsletter(
            @RequestAttribute(name = JwtAuthenticationFilter.AUTHENTICATED_USER_ATTR, required = false) User actor,
            @Valid @RequestBody NewsletterRequest request) {
        return newsletterService.createNewsletter(actor, request);
    }
}
