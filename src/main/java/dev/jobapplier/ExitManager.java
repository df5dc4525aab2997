package dev.jobapplier;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Ends the question-bank run with its status code. The JVM is left running under a test runner, or when
 * {@code app.exit-on-finish} is false (e.g. when the engine is embedded in a longer automation session).
 */
@Slf4j
@Component
public class ExitManager {

    private final boolean exitOnFinish;

    public ExitManager(@Value("${app.exit-on-finish:true}") boolean exitOnFinish) {
        this.exitOnFinish = exitOnFinish;
    }

    public void exit(int status) {
        if (!shouldTerminate()) {
            log.debug("Run finished with status {}, leaving the JVM running", status);
            return;
        }
        log.info("Exiting with status {}", status);
        System.exit(status);
    }

    boolean shouldTerminate() {
        return exitOnFinish && !isRunningUnderTest();
    }

    boolean isRunningUnderTest() {
        String classPath = System.getProperty("java.class.path", "");
        return classPath.contains("junit") || classPath.contains("surefire");
    }
}
