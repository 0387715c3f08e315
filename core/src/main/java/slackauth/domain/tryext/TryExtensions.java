package slackauth.domain.tryext;

import io.vavr.CheckedFunction0;
import io.vavr.CheckedFunction1;
import io.vavr.control.Try;

public final class TryExtensions {
    private TryExtensions() {
    }

    /**
     * Opens an outer resource, opens an inner resource from it, and applies the callback to the inner one.
     * Both are closed in reverse order whatever the outcome, which is how an HTTP client and the response
     * it produced are released.
     */
    public static <O extends AutoCloseable, I extends AutoCloseable, R> Try<R> withResources(
            final CheckedFunction0<O> openOuter,
            final CheckedFunction1<O, I> openInner,
            final CheckedFunction1<I, R> useInner) {
        return Try.withResources(openOuter)
                .of(outer -> Try.withResources(() -> openInner.apply(outer)).of(useInner))
                .flatMap(inner -> inner);
    }
}
