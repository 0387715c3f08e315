package slackauth.domain.auth;

import org.jspecify.annotations.Nullable;

/**
 * The outcome of processing a callback. A null identity means the login failed, while the
 * properties are still available to redirect the user back to where they came from.
 */
public record AuthenticationTicket(@Nullable ClaimsIdentity identity, AuthProperties properties) {
}
