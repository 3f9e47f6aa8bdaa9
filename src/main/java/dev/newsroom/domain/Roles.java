package dev.newsroom.domain;

import dev.newsroom.entity.User;
import dev.newsroom.entity.UserRole;

/**
 * Role predicates. A {@code null} user stands for an anonymous caller and
 * satisfies none of them.
 */
public final class Roles {

    private Roles() {
        // utility class
    }

    public static boolean isReader(User user) {
        return has(user, UserRole.READER);
    }

    public static boolean isJournalist(User user) {
        return has(user, UserRole.JOURNALIST);
    }

    public static boolean isEditor(User user) {
        return has(user, UserRole.EDITOR);
    }

    public static boolean isPublisher(User user) {
        return has(user, UserRole.PUBLISHER);
    }

    public static boolean isStaff(User user) {
        return has(user, UserRole.STAFF);
    }

    private static boolean has(User user, UserRole role) {
        return user != null && user.getRole() == role;
    }
}
