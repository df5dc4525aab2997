package dev.jobapplier.session;

import java.time.Duration;

/**
 * Blocking wait between retries.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
