package slackauth.domain.exceptions;

/**
 * Tags failures in talking to Slack. A fresh login attempt may well succeed.
 */
public interface ExternalException {
}
