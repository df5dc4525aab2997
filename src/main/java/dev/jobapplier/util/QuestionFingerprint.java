package dev.jobapplier.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.List;
import java.util.stream.Collectors;

public final class QuestionFingerprint {

    private static final int SIGNIFICANT_WORD_MIN_LENGTH = 4;
    private static final int SIGNIFICANT_WORD_LIMIT = 4;
    private static final int HASH_LENGTH = 16;

    private QuestionFingerprint() {
    }

    /**
     * Hash of the first significant words of the normalized question, sorted so that light rewording
     * ("Why do you want to work here" / "Why would you want to work here") groups together.
     * Falls back to the whole normalized text when it has no significant word.
     */
    public static String of(String question) {
        String normalized = TextSimilarity.normalize(question);
        List<String> significant = List.of(normalized.split(" ")).stream()
                .filter(word -> word.length() >= SIGNIFICANT_WORD_MIN_LENGTH)
                .limit(SIGNIFICANT_WORD_LIMIT)
                .sorted()
                .collect(Collectors.toList());
        String input = significant.isEmpty() ? normalized : String.join(" ", significant);
        return sha256Hex(input).substring(0, HASH_LENGTH);
    }

    static String sha256Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(value.getBytes(StandardCharsets.UTF_8));
            StringBuilder out = new StringBuilder();
            for (byte b : hash) {
                out.append(String.format("%02x", b));
            }
            return out.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }
}
