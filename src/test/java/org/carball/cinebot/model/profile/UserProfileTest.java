package org.carball.cinebot.model.profile;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class UserProfileTest {

    @Test
    void shouldIgnoreDuplicatePreferencesRegardlessOfCase() {
        // Given
        UserProfile profile = UserProfile.empty();

        // When
        boolean first = profile.addPreference(PreferenceCategory.GENRE, "comedy");
        boolean second = profile.addPreference(PreferenceCategory.GENRE, " Comedy ");

        // Then
        assertThat(first).isTrue();
        assertThat(second).isFalse();
        assertThat(profile.getPreferences(PreferenceCategory.GENRE)).containsExactly("comedy");
    }

    @Test
    void shouldRejectBlankPreferences() {
        UserProfile profile = UserProfile.empty();

        assertThat(profile.addPreference(PreferenceCategory.ACTOR, "  ")).isFalse();
        assertThat(profile.addPreference(PreferenceCategory.ACTOR, null)).isFalse();
        assertThat(profile.isEmpty()).isTrue();
    }

    @Test
    void shouldDescribeOnlyFilledCategories() {
        // Given
        UserProfile profile = UserProfile.empty();
        profile.addPreference(PreferenceCategory.GENRE, "drama");
        profile.addPreference(PreferenceCategory.GENRE, "comedy");
        profile.addPreference(PreferenceCategory.ACTOR, "Jackie Chan");

        // Then
        assertThat(profile.describePreferences())
                .isEqualTo("The user's favorite genres: drama, comedy; favorite actors: Jackie Chan.");
    }

    @Test
    void shouldRenderSnapshotForEmptyProfile() {
        assertThat(UserProfile.empty().describePreferences()).isNull();
        assertThat(UserProfile.empty().toSnapshot())
                .isEqualTo("[User profile]\nName: unknown\nNo preferences recorded yet.");
    }

    @Test
    void shouldIncludeNameInSnapshot() {
        // Given
        UserProfile profile = UserProfile.empty();
        profile.setName("Anna");
        profile.addPreference(PreferenceCategory.DIRECTOR, "Christopher Nolan");

        // Then
        assertThat(profile.isEmpty()).isFalse();
        assertThat(profile.toSnapshot())
                .startsWith("[User profile]\nName: Anna\n")
                .endsWith("favorite directors: Christopher Nolan.");
    }
}
