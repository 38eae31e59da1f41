package org.carball.cinebot.memory;

import org.carball.cinebot.model.profile.PreferenceCategory;
import org.carball.cinebot.model.profile.UserProfile;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

public class PreferenceExtractorTest {

    @TempDir
    Path tempDir;

    private PreferenceExtractor extractor;
    private UserProfile profile;

    @BeforeEach
    void setUp() {
        extractor = new PreferenceExtractor(new PreferenceMemory(tempDir.resolve("memory.json")));
        profile = UserProfile.empty();
    }

    @Test
    void shouldLearnRussianNameAndGenres() {
        // When
        boolean changed = extractor.extract("Меня зовут Аня, я люблю боевики и комедии", profile);

        // Then
        assertThat(changed).isTrue();
        assertThat(profile.getName()).isEqualTo("Аня");
        assertThat(profile.getPreferences(PreferenceCategory.GENRE)).containsExactly("боевики", "комедии");
    }

    @Test
    void shouldLearnEnglishNameAndGenres() {
        // When
        extractor.extract("My name is Alex. I love thriller and horror movies", profile);

        // Then
        assertThat(profile.getName()).isEqualTo("Alex");
        assertThat(profile.getPreferences(PreferenceCategory.GENRE)).containsExactly("thriller", "horror");
    }

    @Test
    void shouldStopGenreListAtNextClause() {
        // When
        extractor.extract("я люблю боевики и комедии, меня зовут Анна", profile);

        // Then
        assertThat(profile.getName()).isEqualTo("Анна");
        assertThat(profile.getPreferences(PreferenceCategory.GENRE)).containsExactly("боевики", "комедии");
    }

    @Test
    void shouldKeepCommaSeparatedGenresTogether() {
        // When
        extractor.extract("я люблю драмы, триллеры и комедии", profile);

        // Then
        assertThat(profile.getPreferences(PreferenceCategory.GENRE)).containsExactly("драмы", "триллеры", "комедии");
    }

    @Test
    void shouldTreatLovedFilmAsMovieNotGenre() {
        // When
        extractor.extract("я люблю фильм Интерстеллар", profile);

        // Then
        assertThat(profile.getPreferences(PreferenceCategory.MOVIE)).containsExactly("Интерстеллар");
        assertThat(profile.getPreferences(PreferenceCategory.GENRE)).isEmpty();
    }

    @Test
    void shouldApplyCorrectionsBeforeMatching() {
        // When
        extractor.extract("я люлблю драмы тоже", profile);

        // Then
        assertThat(profile.getPreferences(PreferenceCategory.GENRE)).containsExactly("драмы");
    }

    @Test
    void shouldTreatFilmsOfSomeoneAsDirectorNotGenre() {
        // When
        extractor.extract("я люблю фильмы кристофера нолана", profile);

        // Then
        assertThat(profile.getPreferences(PreferenceCategory.DIRECTOR)).containsExactly("Кристофера Нолана");
        assertThat(profile.getPreferences(PreferenceCategory.GENRE)).isEmpty();
    }

    @Test
    void shouldLearnEnglishDirector() {
        // When
        extractor.extract("I love films by christopher nolan", profile);

        // Then
        assertThat(profile.getPreferences(PreferenceCategory.DIRECTOR)).containsExactly("Christopher Nolan");
        assertThat(profile.getPreferences(PreferenceCategory.GENRE)).isEmpty();
    }

    @Test
    void shouldLearnJackieChanFromAnyMention() {
        // When
        extractor.extract("Посоветуй что-нибудь с Джеки Чаном? Джеки Чан лучший", profile);

        // Then
        assertThat(profile.getPreferences(PreferenceCategory.ACTOR)).containsExactly("Джеки Чан");
    }

    @Test
    void shouldLearnFavoriteActorAndMovie() {
        // When
        extractor.extract("My favorite actor is Tom Hanks", profile);
        extractor.extract("My favourite movie is Interstellar", profile);

        // Then
        assertThat(profile.getPreferences(PreferenceCategory.ACTOR)).containsExactly("Tom Hanks");
        assertThat(profile.getPreferences(PreferenceCategory.MOVIE)).containsExactly("Interstellar");
    }

    @Test
    void shouldLearnRussianActorAndMovie() {
        // When
        extractor.extract("Мой любимый актёр — Том Хэнкс", profile);
        extractor.extract("Мне нравится фильм Интерстеллар", profile);

        // Then
        assertThat(profile.getPreferences(PreferenceCategory.ACTOR)).containsExactly("Том Хэнкс");
        assertThat(profile.getPreferences(PreferenceCategory.MOVIE)).containsExactly("Интерстеллар");
    }

    @Test
    void shouldNotMistakeMovieQuestionForFavoriteMovie() {
        // When
        boolean changed = extractor.extract("Какой фильм посмотреть вечером?", profile);

        // Then
        assertThat(changed).isFalse();
        assertThat(profile.isEmpty()).isTrue();
    }

    @Test
    void shouldReportNoChangeForRepeatedFacts() {
        // Given
        extractor.extract("I love drama movies", profile);

        // When
        boolean changed = extractor.extract("I love Drama movies", profile);

        // Then
        assertThat(changed).isFalse();
        assertThat(profile.getPreferences(PreferenceCategory.GENRE)).containsExactly("drama");
    }

    @Test
    void shouldIgnoreBlankText() {
        assertThat(extractor.extract("   ", profile)).isFalse();
        assertThat(extractor.extract(null, profile)).isFalse();
    }
}
