package dev.newsroom.domain;

import dev.newsroom.entity.MemberRole;
import dev.newsroom.entity.PublisherMember;
import dev.newsroom.entity.User;
import dev.newsroom.entity.UserRole;

import java.util.Collection;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable snapshot of a publishing house's team: owner, editors and journalists.
 * <p>
 * Pure data and queries. Who may change the team is decided by
 * {@link dev.newsroom.security.AccessControlGate}, not here.
 */
public record PublisherTeam(Long publisherId, Long ownerId, Set<Long> editorIds, Set<Long> journalistIds) {

    public PublisherTeam {
        Objects.requireNonNull(publisherId, "publisherId");
        editorIds = editorIds == null ? Set.of() : Set.copyOf(editorIds);
        journalistIds = journalistIds == null ? Set.of() : Set.copyOf(journalistIds);
    }

    /**
     * Build a team from persisted membership rows.
     */
    public static PublisherTeam of(Long publisherId, Long ownerId, Collection<PublisherMember> members) {
        Set<Long> editors = new HashSet<>();
        Set<Long> journalists = new HashSet<>();
        for (PublisherMember member : members) {
            if (member.getMemberRole() == MemberRole.EDITOR) {
                editors.add(member.getUserId());
            } else if (member.getMemberRole() == MemberRole.JOURNALIST) {
                journalists.add(member.getUserId());
            }
        }
        return new PublisherTeam(publisherId, ownerId, editors, journalists);
    }

    public boolean isOwner(User user) {
        return user != null && user.getId() != null && user.getId().equals(ownerId);
    }

    public boolean isEditor(User user) {
        return user != null && editorIds.contains(user.getId());
    }

    public boolean isJournalist(User user) {
        return user != null && journalistIds.contains(user.getId());
    }

    public boolean hasMember(User user, MemberRole role) {
        return role == MemberRole.EDITOR ? isEditor(user) : isJournalist(user);
    }

    public Outcome<PublisherTeam> addEditor(User user) {
        return add(user, MemberRole.EDITOR);
    }

    public Outcome<PublisherTeam> addJournalist(User user) {
        return add(user, MemberRole.JOURNALIST);
    }

    /**
     * Add a member in the given capacity. The user's own role must match it.
     */
    public Outcome<PublisherTeam> add(User user, MemberRole role) {
        if (user == null) {
            return Outcome.failed(ErrorKind.NOT_FOUND);
        }
        UserRole required = role.requiredUserRole();
        if (!user.hasRole(required)) {
            return Outcome.failed(ErrorKind.ROLE_MISMATCH);
        }
        if (hasMember(user, role)) {
            return Outcome.unchanged(this);
        }
        if (role == MemberRole.EDITOR) {
            Set<Long> editors = new HashSet<>(editorIds);
            editors.add(user.getId());
            return Outcome.changed(new PublisherTeam(publisherId, ownerId, editors, journalistIds));
        }
        Set<Long> journalists = new HashSet<>(journalistIds);
        journalists.add(user.getId());
        return Outcome.changed(new PublisherTeam(publisherId, ownerId, editorIds, journalists));
    }
}
