package slackauth.domain.auth.provider;

import slackauth.domain.auth.AuthProperties;
import slackauth.domain.auth.AuthRequest;
import slackauth.domain.auth.ClaimsIdentity;
import slackauth.domain.auth.slack.SlackIdentity;

/**
 * Passed to {@link SlackAuthenticationProvider#authenticated} once Slack has returned the user.
 * The hook returns the context to continue with, so replacing the claims or properties is done
 * with the {@code with} methods.
 */
public record SlackAuthenticatedContext(
        AuthRequest request,
        SlackIdentity slackIdentity,
        ClaimsIdentity identity,
        AuthProperties properties) {

    public SlackAuthenticatedContext withIdentity(final ClaimsIdentity newIdentity) {
        return new SlackAuthenticatedContext(request, slackIdentity, newIdentity, properties);
    }

    public SlackAuthenticatedContext withProperties(final AuthProperties newProperties) {
        return new SlackAuthenticatedContext(request, slackIdentity, identity, newProperties);
    }
}
