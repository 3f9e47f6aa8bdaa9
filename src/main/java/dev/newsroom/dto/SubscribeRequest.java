package dev.newsroom.dto;

/**
 * Exactly one of the two ids must be set.
 */
public record SubscribeRequest(Long publisherId, Long journalistId) {}
