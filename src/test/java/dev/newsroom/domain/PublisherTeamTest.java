package dev.newsroom.domain;

import dev.newsroom.entity.MemberRole;
import dev.newsroom.entity.PublisherMember;
import dev.newsroom.entity.User;
import dev.newsroom.entity.UserRole;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PublisherTeamTest {

    private final User owner = User.builder().id(1L).role(UserRole.PUBLISHER).build();
    private final User editor = User.builder().id(2L).role(UserRole.EDITOR).build();
    private final User journalist = User.builder().id(3L).role(UserRole.JOURNALIST).build();
    private final User reader = User.builder().id(4L).role(UserRole.READER).build();

    @Test
    @DisplayName("of() should split membership rows by role")
    void shouldBuildFromMembers() {
        PublisherTeam team = PublisherTeam.of(10L, 1L, List.of(
                PublisherMember.builder().publisherId(10L).userId(2L).memberRole(MemberRole.EDITOR).build(),
                PublisherMember.builder().publisherId(10L).userId(3L).memberRole(MemberRole.JOURNALIST).build()));

        assertThat(team.isOwner(owner)).isTrue();
        assertThat(team.isEditor(editor)).isTrue();
        assertThat(team.isJournalist(journalist)).isTrue();
        assertThat(team.isEditor(journalist)).isFalse();
        assertThat(team.isOwner(null)).isFalse();
    }

    @Test
    @DisplayName("adding an editor should return a new team and leave the old one intact")
    void shouldAddEditor() {
        PublisherTeam team = new PublisherTeam(10L, 1L, Set.of(), Set.of());

        Outcome<PublisherTeam> outcome = team.addEditor(editor);

        assertThat(outcome.isChanged()).isTrue();
        assertThat(outcome.value().editorIds()).containsExactly(2L);
        assertThat(team.editorIds()).isEmpty();
    }

    @Test
    @DisplayName("adding an existing member should be unchanged")
    void shouldBeIdempotent() {
        PublisherTeam team = new PublisherTeam(10L, 1L, Set.of(), Set.of(3L));

        Outcome<PublisherTeam> outcome = team.addJournalist(journalist);

        assertThat(outcome.isUnchanged()).isTrue();
        assertThat(outcome.value()).isSameAs(team);
    }

    @Test
    @DisplayName("the user's role must match the capacity")
    void shouldRejectRoleMismatch() {
        PublisherTeam team = new PublisherTeam(10L, 1L, Set.of(), Set.of());

        assertThat(team.addEditor(journalist).error()).isEqualTo(ErrorKind.ROLE_MISMATCH);
        assertThat(team.addJournalist(reader).error()).isEqualTo(ErrorKind.ROLE_MISMATCH);
        assertThat(team.add(null, MemberRole.EDITOR).error()).isEqualTo(ErrorKind.NOT_FOUND);
    }

    @Test
    @DisplayName("member sets should be immutable")
    void shouldExposeImmutableSets() {
        PublisherTeam team = new PublisherTeam(10L, 1L, null, Set.of(3L));

        assertThat(team.editorIds()).isEmpty();
        assertThatThrownBy(() -> team.journalistIds().add(5L)).isInstanceOf(UnsupportedOperationException.class);
    }
}
