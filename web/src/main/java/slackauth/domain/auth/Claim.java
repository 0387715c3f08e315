package slackauth.domain.auth;

/**
 * A single statement about the signed in user.
 *
 * @param issuer the authentication type that produced the claim
 */
public record Claim(String type, String value, String valueType, String issuer) {
}
