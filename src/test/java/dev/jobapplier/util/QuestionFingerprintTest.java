package dev.jobapplier.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class QuestionFingerprintTest {

    @Test
    @DisplayName("Should produce a 16 character hex fingerprint")
    void shouldProduceHexFingerprint() {
        assertThat(QuestionFingerprint.of("Why do you want to work here?"))
                .hasSize(16)
                .matches("[0-9a-f]{16}");
    }

    @Test
    @DisplayName("Should ignore case, punctuation and word order")
    void shouldIgnoreFormattingAndShortWords() {
        assertThat(QuestionFingerprint.of("Why do you WANT to work here?"))
                .isEqualTo(QuestionFingerprint.of("Here: why do you want to work?"));
    }

    @Test
    @DisplayName("Should differ for different questions")
    void shouldDifferForDifferentQuestions() {
        assertThat(QuestionFingerprint.of("Expected salary"))
                .isNotEqualTo(QuestionFingerprint.of("Years of experience"));
    }

    @Test
    @DisplayName("Should fall back to the whole text when no word is significant")
    void shouldFallBackToWholeText() {
        assertThat(QuestionFingerprint.of("Do you?")).isEqualTo(QuestionFingerprint.sha256Hex("do you").substring(0, 16));
    }
}
