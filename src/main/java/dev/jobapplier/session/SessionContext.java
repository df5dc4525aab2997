package dev.jobapplier.session;

import org.openqa.selenium.WebDriver;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Page access and cancellation for one browser session. Passed explicitly to every component that needs to
 * look at the page; one instance per session.
 */
public final class SessionContext {

    private final Supplier<String> pageSourceProvider;
    private final Supplier<String> currentUrlProvider;
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);

    public SessionContext(Supplier<String> pageSourceProvider, Supplier<String> currentUrlProvider) {
        this.pageSourceProvider = Objects.requireNonNull(pageSourceProvider, "pageSourceProvider must not be null");
        this.currentUrlProvider = Objects.requireNonNull(currentUrlProvider, "currentUrlProvider must not be null");
    }

    /**
     * Adapts a Selenium driver.
     *
     * @param driver live WebDriver
     * @return context reading page source and URL from the driver
     */
    public static SessionContext of(WebDriver driver) {
        Objects.requireNonNull(driver, "driver must not be null");
        return new SessionContext(driver::getPageSource, driver::getCurrentUrl);
    }

    public String pageSource() {
        return pageSourceProvider.get();
    }

    public String currentUrl() {
        return currentUrlProvider.get();
    }

    /**
     * Asks the automation to stop. Checked between attempts and right after each backoff sleep.
     */
    public void requestStop() {
        stopRequested.set(true);
    }

    public void clearStop() {
        stopRequested.set(false);
    }

    public boolean isStopRequested() {
        return stopRequested.get();
    }
}
