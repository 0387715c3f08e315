package slackauth.domain.timeout;

import io.smallrye.config.inject.ConfigExtension;
import jakarta.inject.Inject;
import org.jboss.weld.junit5.auto.AddBeanClasses;
import org.jboss.weld.junit5.auto.AddExtensions;
import org.jboss.weld.junit5.auto.EnableAutoWeld;
import org.junit.jupiter.api.Test;
import slackauth.domain.logger.Loggers;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@EnableAutoWeld
@AddExtensions(ConfigExtension.class)
@AddBeanClasses(CompletableFutureTimeoutService.class)
@AddBeanClasses(Loggers.class)
class CompletableFutureTimeoutServiceTest {
    @Inject
    private CompletableFutureTimeoutService timeoutService;

    @Test
    void returnsTheResultOfTheCallback() {
        assertEquals("done", timeoutService.executeWithTimeout(() -> "done", () -> "timeout", 5));
    }

    @Test
    void returnsTheTimeoutValueWhenTheCallbackIsTooSlow() {
        final String result = timeoutService.executeWithTimeout(() -> {
            sleep(3000);
            return "done";
        }, () -> "timeout", 1);

        assertEquals("timeout", result);
    }

    @Test
    void rethrowsTheExceptionFromTheCallback() {
        final IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> timeoutService.executeWithTimeout(() -> {
                    throw new IllegalStateException("boom");
                }, () -> "timeout", 5));

        assertEquals("boom", ex.getMessage());
    }

    @Test
    void keepsTheInterruptFlagWhenTheCallerIsInterrupted() {
        Thread.currentThread().interrupt();
        try {
            final Throwable thrown = assertThrows(Throwable.class,
                    () -> timeoutService.executeWithTimeout(() -> {
                        sleep(2000);
                        return "done";
                    }, () -> "timeout", 5));

            assertTrue(thrown instanceof InterruptedException || thrown.getCause() instanceof InterruptedException);
            assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            // clear the flag so later tests run normally
            Thread.interrupted();
        }
    }

    @Test
    void rejectsANonPositiveTimeout() {
        assertThrows(IllegalArgumentException.class,
                () -> timeoutService.executeWithTimeout(() -> "done", () -> "timeout", 0));
    }

    private static void sleep(final long millis) {
        try {
            Thread.sleep(millis);
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
