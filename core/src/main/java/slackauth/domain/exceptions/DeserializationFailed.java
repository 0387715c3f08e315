package slackauth.domain.exceptions;

/**
 * JSON could not be mapped to the requested type. For Slack responses this means the body was not
 * JSON at all, since unknown and missing fields are tolerated.
 */
public class DeserializationFailed extends RuntimeException implements InternalException {
    public DeserializationFailed(final String message, final Throwable cause) {
        super(message, cause);
    }

    public DeserializationFailed(final Throwable cause) {
        super(cause);
    }
}
