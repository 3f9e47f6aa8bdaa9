package dev.newsroom.controller;

import dev.newsroom.dto.ArticleRequest;
import dev.newsroom.dto.ArticleResponse;
import dev.newsroom.dto.ArticleUpdateRequest;
import dev.newsroom.dto.PageResponse;
import dev.newsroom.entity.User;
import dev.newsroom.security.JwtAuthenticationFilter;
import dev.newsroom.service.ArticleService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/articles")
@Validated
@RequiredArgsConstructor
@Tag(name = "Articles", description = "Article authoring and moderation")
@Slf4j
public class ArticleController {

    private final ArticleService articleService;

    @GetMapping
    @Operation(summary = "List articles", description = "Role-scoped list: published, own, publisher queue or all")
    public Mono<PageResponse<ArticleResponse>> listArticles(
            @RequestAttribute(name = JwtAuthenticationFilter.AUTHENTICATED_USER_ATTR, required = false) User actor,
            @RequestParam(defaultValue = "0") @Min(0) int page,
            @RequestParam(defaultValue = "10") @Min(1) @Max(100) int size) {
        log.debug("Listing articles page={}, size={}", page, size);
        return articleService.listArticles(actor, page, size);
    }

    @GetMapping("/search")
    @Operation(summary = "Search published articles", description = "Filter by text, category name and publisher name")
    public Mono<PageResponse<ArticleResponse>> searchArticles(
            @RequestParam(name = "q", required = false) String query,
            @RequestParam(required = false) String category,
            @RequestParam(required = false) String publisher,
            @RequestParam(defaultValue = "0") @Min(0) int page,
            @RequestParam(defaultValue = "10") @Min(1) @Max(100) int size) {
        return articleService.searchArticles(query, category, publisher, page, size);
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get an article")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Article found"),
            @ApiResponse(responseCode = "403", description = "Article not visible to the caller"),
            @ApiResponse(responseCode = "404", description = "Article not found")
    })
    public Mono<ArticleResponse> getArticle(
            @RequestAttribute(name = JwtAuthenticationFilter.AUTHENTICATED_USER_ATTR, required = false) User actor,
            @PathVariable Long id) {
        return articleService.getArticle(actor, id);
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    @Operation(summary = "Create a draft article", description = "Journalists only")
    public Mono<ArticleResponse> createArticle(
            @RequestAttribute(name = JwtAuthenticationFilter.AUTHENTICATED_USER_ATTR, required = false) User actor,
            @Valid @RequestBody ArticleRequest request) {
        return articleService.createArticle(actor, request);
    }

    @PutMapping("/{id}")
    @Operation(summary = "Edit article content", description = "Author or an editor of the article's publisher")
    public Mono<ArticleResponse> updateArticle(
            @RequestAttribute(name = JwtAuthenticationFilter.AUTHENTICATED_USER_ATTR, required = false) User actor,
            @PathVariable Long id,
            @Valid @RequestBody ArticleUpdateRequest request) {
        return articleService.updateArticle(actor, id, request);
    }

    @PostMapping("/{id}/submit")
    @Operation(summary = "Submit a draft for review")
    public Mono<ArticleResponse> submitArticle(
            @RequestAttribute(name = JwtAuthenticationFilter.AUTHENTICATED_USER_ATTR, required = false) User actor,
            @PathVariable Long id) {
        return articleService.submitArticle(actor, id);
    }

    @PostMapping("/{id}/approve")
    @Operation(summary = "Approve and publish a pending article")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Article published"),
            @ApiResponse(responseCode = "403", description = "Caller may not moderate this article"),
            @ApiResponse(responseCode = "409", description = "Article already decided or not pending")
    })
    public Mono<ArticleResponse> approveArticle(
            @RequestAttribute(name = JwtAuthenticationFilter.AUTHENTICATED_USER_ATTR, required = false) User actor,
            @PathVariable Long id) {
        return articleService.approveArticle(actor, id);
    }

    @PostMapping("/{id}/reject")
    @Operation(summary = "Reject a pending article")
    public Mono<ArticleResponse> rejectArticle(
            @RequestAttribute(name = JwtAuthenticationFilter.AUTHENTICATED_USER_ATTR, required = false) User actor,
            @PathVariable Long id) {
        return articleService.rejectArticle(actor, id);
    }
}
