package slackauth.domain.exceptions;

/**
 * Tags failures caused by the request or the configuration, like a forged state or a consent the user
 * declined. Trying the same login again fails the same way.
 */
public interface InternalException {
}
