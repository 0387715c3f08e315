package slackauth.domain.exceptions;

/**
 * Wraps an unexpected error raised inside the middleware. Used by {@code StandardExceptionMapping}
 * for anything that is not already part of the taxonomy.
 */
public class InternalFailure extends RuntimeException implements InternalException {
    public InternalFailure(final String message) {
        super(message);
    }

    public InternalFailure(final Throwable cause) {
        super(cause);
    }
}
