package slackauth.domain.exceptions;

/**
 * An object, such as the login properties or a signed in identity, could not be written as JSON.
 */
public class SerializationFailed extends RuntimeException implements InternalException {
    public SerializationFailed(final String message, final Throwable cause) {
        super(message, cause);
    }

    public SerializationFailed(final Throwable cause) {
        super(cause);
    }
}
