package dev.jobapplier.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Page indicators used to classify session errors. Phrases are matched case-insensitively as substrings of
 * the page source, URL markers as substrings of the current URL.
 * Loaded from application.yml under 'detection' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "detection")
public class DetectionConfig {

    private List<String> captchaPhrases = new ArrayList<>(List.of(
            "verify it's you", "verify it’s you", "are you human", "captcha",
            "let's do a quick security check", "verify you're not a robot", "solve this puzzle"));

    private List<String> captchaUrlMarkers = new ArrayList<>(List.of(
            "/checkpoint/challenge", "/challenge", "captcha"));

    private List<String> rateLimitPhrases = new ArrayList<>(List.of(
            "too many requests", "slow down", "try again later", "too many attempts",
            "rate limit", "temporarily restricted"));

    private List<String> sessionTimeoutPhrases = new ArrayList<>(List.of(
            "session expired", "session has expired", "session timed out", "session has timed out"));

    private List<String> loginRequiredPhrases = new ArrayList<>(List.of(
            "login required", "you must be logged in", "sign in to continue", "please log in"));

    private List<String> loginUrlMarkers = new ArrayList<>(List.of(
            "/login", "/uas/login", "/signin", "/authwall"));

    private List<String> networkPhrases = new ArrayList<>(List.of(
            "connection refused", "connection timeout", "connection timed out", "unable to connect",
            "no internet", "network error", "502 bad gateway", "503 service unavailable",
            "504 gateway timeout", "err_connection", "err_internet_disconnected", "err_name_not_resolved"));

    /**
     * Markers of the expected interactive element (apply button or form). FormNotFound is reported when none
     * of them is present; an empty list disables the check.
     */
    private List<String> formMarkers = new ArrayList<>(List.of("easy-apply", "apply"));
}
