package slackauth.domain.exceptions;

/**
 * Slack redirected back with an error parameter, usually because the user declined consent.
 */
public class ProviderDenied extends RuntimeException implements InternalException {
    public ProviderDenied(final String message) {
        super(message);
    }
}
