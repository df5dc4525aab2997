package dev.jobapplier.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Retry and backoff settings for error recovery.
 * Loaded from application.yml under 'recovery' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "recovery")
public class RecoveryConfig {

    private int maxRetries = 3;
    private double initialBackoffSeconds = 5;
    private double maxBackoffSeconds = 300;
    private double backoffMultiplier = 2.0;
    private int rateLimitMaxConsecutive = 3;
    private int unknownMaxRetries = 1;

    /**
     * Block and wait for a manual resume when a CAPTCHA shows up instead of returning control at once.
     */
    private boolean captchaBlockingWait = false;
    private long captchaMaxWaitSeconds = 300;
}
