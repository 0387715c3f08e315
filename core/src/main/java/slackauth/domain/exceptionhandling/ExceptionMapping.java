package slackauth.domain.exceptionhandling;

import io.vavr.control.Try;

/**
 * Normalizes the failure carried by a {@link Try} into the exception taxonomy.
 */
public interface ExceptionMapping {
    <T> Try<T> map(Try<T> result);
}
