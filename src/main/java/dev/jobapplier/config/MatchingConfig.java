package dev.jobapplier.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Thresholds for fuzzy matching of fields, questions and learned answers.
 * Loaded from application.yml under 'matching' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "matching")
public class MatchingConfig {

    /** A field is filled only when its best label score is above this value. */
    private double fieldMatchThreshold = 0.6;

    /** Answers below this confidence are skipped. */
    private double questionMinScore = 0.45;

    /** Learned entries at or above this similarity are reused without calling the generator. */
    private double learnedReuseThreshold = 0.8;

    /** New questions at or above this similarity to an existing entry update it instead of inserting. */
    private double learnedMergeThreshold = 0.8;

    private double generatedConfidence = 0.9;
    private long generatorTimeoutSeconds = 30;

    private List<String> resumeKeywords = new ArrayList<>(List.of(
            "resume", "cv", "curriculum vitae", "curriculum", "vitae", "document"));
}
