package dev.jobapplier.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class TextSimilarityTest {

    @Nested
    @DisplayName("Normalization")
    class NormalizeTests {

        @ParameterizedTest
        @CsvSource(delimiter = '|', quoteCharacter = '"', value = {
                "Years of experience?|years of experience",
                "  Why   do you want\tto work here?! |why do you want to work here",
                "What's your notice period?|whats your notice period",
                "years_of_experience|years of experience",
                "first-name|first name"
        })
        @DisplayName("Should lowercase, strip punctuation and collapse whitespace")
        void shouldNormalize(String input, String expected) {
            assertThat(TextSimilarity.normalize(input)).isEqualTo(expected);
        }

        @Test
        @DisplayName("Should return empty string for null or blank input")
        void shouldHandleNullAndBlank() {
            assertThat(TextSimilarity.normalize(null)).isEmpty();
            assertThat(TextSimilarity.normalize("   ")).isEmpty();
            assertThat(TextSimilarity.normalize("?!.")).isEmpty();
        }
    }

    @Nested
    @DisplayName("Jaccard similarity")
    class JaccardTests {

        @Test
        @DisplayName("Should score identical token sets as 1.0")
        void shouldScoreIdenticalAsOne() {
            assertThat(TextSimilarity.jaccard("Years of experience?", "years of experience")).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should score intersection over union")
        void shouldScoreIntersectionOverUnion() {
            // {years, of, experience} vs {years, experience, java}: 2 / 4
            assertThat(TextSimilarity.jaccard("years of experience", "java years experience"))
                    .isCloseTo(0.5, within(1e-9));
        }

        @Test
        @DisplayName("Should score disjoint texts as 0.0")
        void shouldScoreDisjointAsZero() {
            assertThat(TextSimilarity.jaccard("Totally unrelated text", "years of experience")).isZero();
        }

        @Test
        @DisplayName("Should score empty input as 0.0")
        void shouldScoreEmptyAsZero() {
            assertThat(TextSimilarity.jaccard("", "years")).isZero();
            assertThat(TextSimilarity.jaccard("years", null)).isZero();
        }
    }

    @Nested
    @DisplayName("Keyword test")
    class ContainsKeywordTests {

        @Test
        @DisplayName("Should match single keywords as whole tokens")
        void shouldMatchWholeTokens() {
            assertThat(TextSimilarity.containsKeyword("Upload your CV", "cv")).isTrue();
            assertThat(TextSimilarity.containsKeyword("Card CVV", "cv")).isFalse();
        }

        @Test
        @DisplayName("Should match phrases as contiguous words")
        void shouldMatchPhrases() {
            assertThat(TextSimilarity.containsKeyword("Attach curriculum vitae (PDF)", "curriculum vitae")).isTrue();
            assertThat(TextSimilarity.containsKeyword("vitae and curriculum", "curriculum vitae")).isFalse();
        }

        @Test
        @DisplayName("Should compare normalized forms")
        void shouldCompareNormalized() {
            assertThat(TextSimilarity.sameNormalized("Phone Number:", "phone_number")).isTrue();
            assertThat(TextSimilarity.sameNormalized("", "")).isFalse();
        }
    }
}
