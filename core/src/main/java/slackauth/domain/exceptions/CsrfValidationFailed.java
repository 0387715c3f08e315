package slackauth.domain.exceptions;

/**
 * The correlation id in the state parameter did not match the correlation cookie set by the challenge.
 */
public class CsrfValidationFailed extends RuntimeException implements InternalException {
    public CsrfValidationFailed(final String message) {
        super(message);
    }
}
