package slackauth.domain.auth.state;

import org.jspecify.annotations.Nullable;
import slackauth.domain.auth.AuthProperties;

/**
 * Turns login properties into the opaque, tamper evident state parameter and back again.
 */
public interface StateProtector {
    String protect(AuthProperties properties);

    /**
     * @throws slackauth.domain.exceptions.InvalidState if the state is missing or can not be verified
     */
    AuthProperties unprotect(@Nullable String state);
}
