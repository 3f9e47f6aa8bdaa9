package dev.newsroom.controller;

import dev.newsroom.dto.AddMemberRequest;
import dev.newsroom.dto.MemberResult;
import dev.newsroom.dto.PublisherDashboardResponse;
import dev.newsroom.dto.PublisherRequest;
import dev.newsroom.dto.PublisherResponse;
import dev.newsroom.dto.PublisherUpdateRequest;
import dev.newsroom.entity.User;
import dev.newsroom.security.JwtAuthenticationFilter;
import dev.newsroom.service.PublisherService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/publishers")
@RequiredArgsConstructor
@Tag(name = "Publishers", description = "Publishing houses and their teams")
@Slf4j
public class PublisherController {

    private final PublisherService publisherService;

    @GetMapping
    @Operation(summary = "List publishing houses", description = "Staff only")
    public Flux<PublisherResponse> listPublishers(
            @RequestAttribute(name = JwtAuthenticationFilter.AUTHENTICATED_USER_ATTR, required = false) User actor) {
        return publisherService.listPublishers(actor);
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    @Operation(summary = "Create a publishing house", description = "Staff only; the owner must have the PUBLISHER role")
    public Mono<PublisherResponse> createPublisher(
            @RequestAttribute(name = JwtAuthenticationFilter.AUTHENTICATED_USER_ATTR, required = false) User actor,
            @Valid @RequestBody PublisherRequest request) {
        log.info("Creating publisher '{}'", request.getName());
        return publisherService.createPublisher(actor, request);
    }

    @PutMapping("/{id}")
    @Operation(summary = "Edit a publishing house", description = "Staff only; the owner cannot be changed")
    public Mono<PublisherResponse> updatePublisher(
            @RequestAttribute(name = JwtAuthenticationFilter.AUTHENTICATED_USER_ATTR, required = false) User actor,
            @PathVariable Long id,
            @Valid @RequestBody PublisherUpdateRequest request) {
        return publisherService.updatePublisher(actor, id, request);
    }

    @GetMapping("/dashboard")
    @Operation(summary = "Owner dashboard", description = "Team, recent content and counts of the caller's house")
    public Mono<PublisherDashboardResponse> dashboard(
            @RequestAttribute(name = JwtAuthenticationFilter.AUTHENTICATED_USER_ATTR, required = false) User actor) {
        return publisherService.dashboard(actor);
    }

    @PostMapping("/{id}/members")
    @Operation(summary = "Add an editor or journalist", description = "Owner only; 200 when already a member")
    public Mono<ResponseEntity<MemberResult>> addMember(
            @RequestAttribute(name = JwtAuthenticationFilter.AUTHENTICATED_USER_ATTR, required = false) User actor,
            @PathVariable Long id,
            @Valid @RequestBody AddMemberRequest request) {
        return publisherService.addMember(actor, id, request)
                .map(result -> ResponseEntity.status(result.added() ? HttpStatus.CREATED : HttpStatus.OK).body(result));
    }
}
