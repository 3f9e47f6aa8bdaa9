package dev.newsroom.entity;

/**
 * Capacity in which a user belongs to a publisher team.
 */
public enum MemberRole {
    EDITOR,
    JOURNALIST;

    /**
     * The user role a member must hold to be added in this capacity.
     */
    public UserRole requiredUserRole() {
        return this == EDITOR ? UserRole.EDITOR : UserRole.JOURNALIST;
    }
}
