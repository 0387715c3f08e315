package slackauth.domain.auth.provider;

import jakarta.ws.rs.core.Response;
import slackauth.domain.auth.AuthProperties;
import slackauth.domain.auth.AuthRequest;

/**
 * Passed to {@link SlackAuthenticationProvider#applyRedirect} with the Slack authorize URL.
 *
 * @param response already carries the correlation cookie
 */
public record SlackApplyRedirectContext(
        AuthRequest request,
        AuthProperties properties,
        String redirectUri,
        Response.ResponseBuilder response) {
}
