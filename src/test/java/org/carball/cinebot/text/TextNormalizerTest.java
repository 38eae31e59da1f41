package org.carball.cinebot.text;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class TextNormalizerTest {

    @Test
    void shouldLowercaseTrimAndCollapseWhitespace() {
        assertThat(TextNormalizer.normalize("  The   Dark\tKNIGHT \n")).isEqualTo("the dark knight");
    }

    @Test
    void shouldTreatNullAsEmpty() {
        assertThat(TextNormalizer.normalize(null)).isEmpty();
        assertThat(TextNormalizer.tokens(null)).isEmpty();
    }

    @Test
    void shouldDropStopWordsAndEdgePunctuation() {
        assertThat(TextNormalizer.tokens("The Lord of the Rings: The Return of the King"))
                .containsExactly("lord", "rings", "return", "king");
    }

    @Test
    void shouldKeepInnerPunctuation() {
        assertThat(TextNormalizer.tokens("Sci-Fi, dream-sharing!")).containsExactly("sci-fi", "dream-sharing");
    }

    @Test
    void shouldDropRussianStopWords() {
        assertThat(TextNormalizer.tokens("Фильм о войне и мире")).containsExactly("фильм", "войне", "мире");
    }

    @Test
    void shouldComputeLevenshteinDistance() {
        assertThat(TextNormalizer.levenshtein("kitten", "sitting")).isEqualTo(3);
        assertThat(TextNormalizer.levenshtein("intersellar", "interstellar")).isEqualTo(1);
        assertThat(TextNormalizer.levenshtein("", "abc")).isEqualTo(3);
        assertThat(TextNormalizer.levenshtein("same", "same")).isZero();
    }
}
