package dev.jobapplier.service;

import dev.jobapplier.config.DetectionConfig;
import dev.jobapplier.model.ErrorClassification;
import dev.jobapplier.model.ErrorKind;
import dev.jobapplier.session.SessionContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.function.BiPredicate;

/**
 * Classifies the current page of a session into an {@link ErrorKind}.
 * <p>
 * Rules are evaluated in priority order and the first match wins:
 * CAPTCHA, rate limit, session timeout, login required, network error, form not found.
 */
@Slf4j
@Service
public class ErrorDetector {

    /**
     * One entry of the dispatch table: a predicate over (lowercased page source, lowercased URL).
     */
    public record DetectionRule(ErrorKind kind, String message, BiPredicate<String, String> predicate) {
    }

    private final List<DetectionRule> rules;

    public ErrorDetector(DetectionConfig config) {
        this.rules = List.of(
                new DetectionRule(ErrorKind.CAPTCHA, "CAPTCHA detected on page",
                        (page, url) -> containsAny(page, config.getCaptchaPhrases())
                                || containsAny(url, config.getCaptchaUrlMarkers())),
                new DetectionRule(ErrorKind.RATE_LIMIT, "Rate limit or throttling detected",
                        (page, url) -> containsAny(page, config.getRateLimitPhrases())),
                new DetectionRule(ErrorKind.SESSION_TIMEOUT, "Session expired - re-login required",
                        (page, url) -> containsAny(page, config.getSessionTimeoutPhrases())),
                new DetectionRule(ErrorKind.LOGIN_REQUIRED, "Login required - re-login required",
                        (page, url) -> containsAny(page, config.getLoginRequiredPhrases())
                                || containsAny(url, config.getLoginUrlMarkers())),
                new DetectionRule(ErrorKind.NETWORK_ERROR, "Network error detected",
                        (page, url) -> containsAny(page, config.getNetworkPhrases())),
                new DetectionRule(ErrorKind.FORM_NOT_FOUND, "Application form not found",
                        (page, url) -> !config.getFormMarkers().isEmpty()
                                && !containsAny(page, config.getFormMarkers())));
    }

    /**
     * Classify page content and URL. Never throws: unreadable input maps to {@link ErrorKind#UNKNOWN}.
     *
     * @param pageSource current page HTML
     * @param currentUrl current URL
     * @return the highest-priority matching classification, or {@link ErrorKind#NONE}
     */
    public ErrorClassification detectError(String pageSource, String currentUrl) {
        if (pageSource == null) {
            return ErrorClassification.of(ErrorKind.UNKNOWN, "Page source unavailable");
        }
        try {
            String page = pageSource.toLowerCase(Locale.ROOT);
            String url = currentUrl == null ? "" : currentUrl.toLowerCase(Locale.ROOT);
            for (DetectionRule rule : rules) {
                if (rule.predicate().test(page, url)) {
                    log.debug("Detected {} on {}", rule.kind(), currentUrl);
                    return ErrorClassification.of(rule.kind(), rule.message());
                }
            }
            return ErrorClassification.none();
        } catch (RuntimeException e) {
            log.error("Error during detection: {}", e.getMessage());
            return ErrorClassification.of(ErrorKind.UNKNOWN, "Error detection failed: " + e.getMessage());
        }
    }

    /**
     * Classify the session's current page.
     */
    public ErrorClassification detectError(SessionContext session) {
        String pageSource;
        String currentUrl;
        try {
            pageSource = session.pageSource();
            currentUrl = session.currentUrl();
        } catch (RuntimeException e) {
            log.error("Could not read page state: {}", e.getMessage());
            return ErrorClassification.of(ErrorKind.UNKNOWN, "Could not read page state: " + e.getMessage());
        }
        return detectError(pageSource, currentUrl);
    }

    /**
     * Error kinds in the order they are checked.
     */
    public List<ErrorKind> priorityOrder() {
        return rules.stream().map(DetectionRule::kind).toList();
    }

    private static boolean containsAny(String haystack, List<String> needles) {
        for (String needle : needles) {
            if (needle == null || needle.isBlank()) {
                continue;
            }
            if (haystack.contains(needle.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }
}
