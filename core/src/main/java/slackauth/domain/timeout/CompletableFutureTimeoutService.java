package slackauth.domain.timeout;

import io.vavr.control.Try;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Logger;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

@ApplicationScoped
public class CompletableFutureTimeoutService implements TimeoutService {
    @Inject
    private Logger logger;

    @Override
    public <T> T executeWithTimeout(final TimeoutFunctionCallback<T> callback, final TimeoutFunctionCallback<T> onTimeout, final long timeoutSeconds) {
        checkNotNull(callback, "callback must not be null");
        checkNotNull(onTimeout, "onTimeout must not be null");
        checkArgument(timeoutSeconds > 0, "timeoutSeconds must be positive");

        return Try.of(() -> await(CompletableFuture
                        .supplyAsync(callback::apply)
                        .orTimeout(timeoutSeconds, TimeUnit.SECONDS)))
                // get() wraps everything, including the timeout, in an ExecutionException
                .recoverWith(ExecutionException.class, e -> Try.failure(Objects.requireNonNullElse(e.getCause(), e)))
                .onFailure(TimeoutException.class, e -> logger.warning("Operation timed out after " + timeoutSeconds + " seconds"))
                .recover(TimeoutException.class, e -> onTimeout.apply())
                .get();
    }

    private static <T> T await(final CompletableFuture<T> future) throws InterruptedException, ExecutionException {
        try {
            return future.get();
        } catch (final InterruptedException e) {
            // get() clears the flag, the caller still needs to see it
            Thread.currentThread().interrupt();
            throw e;
        }
    }
}
