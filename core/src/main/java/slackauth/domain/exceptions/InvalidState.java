package slackauth.domain.exceptions;

/**
 * The OAuth state parameter was missing, failed its signature check, or did not describe a login attempt.
 */
public class InvalidState extends RuntimeException implements InternalException {
    public InvalidState(final String message) {
        super(message);
    }

    public InvalidState(final String message, final Throwable cause) {
        super(message, cause);
    }
}
