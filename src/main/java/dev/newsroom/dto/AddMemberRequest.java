package dev.newsroom.dto;

import dev.newsroom.entity.MemberRole;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record AddMemberRequest(
        @NotBlank(message = "Username is required")
        String username,

        @NotNull(message = "Member role is required")
        MemberRole role
) {}
