package dev.newsroom.dto;

/**
 * Result of adding a team member. {@code added} is false when the user was already on the team.
 */
public record MemberResult(String publisherId, String userId, String role, boolean added) {}
