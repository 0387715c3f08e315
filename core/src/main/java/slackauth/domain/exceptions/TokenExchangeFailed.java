package slackauth.domain.exceptions;

/**
 * Slack did not return an access token for the authorization code, either with a non-success HTTP status or an <code>ok: false</code> body.
 */
public class TokenExchangeFailed extends RuntimeException implements ExternalException {
    public TokenExchangeFailed(final String message) {
        super(message);
    }

    public TokenExchangeFailed(final String message, final Throwable cause) {
        super(message, cause);
    }
}
