package slackauth.domain.exceptions;

/**
 * Slack could not be reached, or the connection broke while reading the answer. vavr's
 * {@code Try.recover} needs a concrete class to match on, so this sits next to {@link ExternalException}.
 */
public class ExternalFailure extends RuntimeException implements ExternalException {
    public ExternalFailure(final String message, final Throwable cause) {
        super(message, cause);
    }

    public ExternalFailure(final Throwable cause) {
        super(cause);
    }
}
