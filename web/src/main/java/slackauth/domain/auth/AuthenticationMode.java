package slackauth.domain.auth;

/**
 * ACTIVE turns every 401 response into a Slack challenge. PASSIVE only challenges when the
 * login resource is called explicitly.
 */
public enum AuthenticationMode {
    ACTIVE,
    PASSIVE
}
