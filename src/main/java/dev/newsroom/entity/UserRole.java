package dev.newsroom.entity;

import java.util.Locale;

/**
 * The single, fixed role of a user. Assigned at registration and never
 * reassigned by ordinary flows.
 */
public enum UserRole {
    READER,
    JOURNALIST,
    EDITOR,
    PUBLISHER,
    STAFF;

    /**
     * Parse a role name case-insensitively.
     *
     * @throws IllegalArgumentException if the value is not a known role
     */
    public static UserRole fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("error.role_required");
        }
        try {
            return UserRole.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("error.role_unknown");
        }
    }
}
