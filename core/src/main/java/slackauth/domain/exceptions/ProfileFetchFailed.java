package slackauth.domain.exceptions;

/**
 * The users.info call failed. Sign-in continues with the fields returned by the token exchange.
 */
public class ProfileFetchFailed extends RuntimeException implements ExternalException {
    public ProfileFetchFailed(final String message) {
        super(message);
    }

    public ProfileFetchFailed(final String message, final Throwable cause) {
        super(message, cause);
    }
}
