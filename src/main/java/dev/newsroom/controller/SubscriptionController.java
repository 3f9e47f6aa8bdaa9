package dev.newsroom.controller;

import dev.newsroom.dto.SubscribeRequest;
import dev.newsroom.dto.SubscriptionResponse;
import dev.newsroom.entity.User;
import dev.newsroom.security.JwtAuthenticationFilter;
import dev.newsroom.service.SubscriptionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/subscriptions")
@RequiredArgsConstructor
@Tag(name = "Subscriptions", description = "Reader subscriptions to publishers and journalists")
public class SubscriptionController {

    private final SubscriptionService subscriptionService;

    @GetMapping
    @Operation(summary = "List the caller's subscriptions")
    public Flux<SubscriptionResponse> listSubscriptions(
            @RequestAttribute(name = JwtAuthenticationFilter.AUTHENTICATED_USER_ATTR, required = false) User reader) {
        return subscriptionService.listSubscriptions(reader)
                .map(subscription -> SubscriptionResponse.from(subscription, false));
    }

    @PostMapping
    @Operation(summary = "Subscribe to a publisher or a journalist")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Subscription created"),
            @ApiResponse(responseCode = "200", description = "Already subscribed"),
            @ApiResponse(responseCode = "422", description = "Both or neither target given, or target is not a journalist")
    })
    public Mono<ResponseEntity<SubscriptionResponse>> subscribe(
            @RequestAttribute(name = JwtAuthenticationFilter.AUTHENTICATED_USER_ATTR, required = false) User reader,
            @RequestBody SubscribeRequest request) {
        return subscriptionService.subscribe(reader, request)
                .map(outcome -> ResponseEntity
                        .status(outcome.isChanged() ? HttpStatus.CREATED : HttpStatus.OK)
                        .body(SubscriptionResponse.from(outcome.value(), outcome.isChanged())));
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    @Operation(summary = "Remove one of the caller's subscriptions")
    public Mono<Void> unsubscribe(
            @RequestAttribute(name = JwtAuthenticationFilter.AUTHENTICATED_USER_ATTR, required = false) User reader,
            @PathVariable Long id) {
        return subscriptionService.unsubscribe(reader, id);
    }
}
