package slackauth.domain.exceptions;

/**
 * A call to Slack did not finish within the configured backchannel timeout.
 */
public class Timeout extends RuntimeException implements ExternalException {
    public Timeout(final String message) {
        super(message);
    }

    public Timeout(final String message, final Throwable cause) {
        super(message, cause);
    }
}
