package slackauth.domain.auth.provider;

import jakarta.ws.rs.core.Response;

/**
 * The points where an application can take part in the Slack login.
 */
public interface SlackAuthenticationProvider {
    /**
     * Invoked whenever Slack successfully authenticates a user.
     */
    SlackAuthenticatedContext authenticated(SlackAuthenticatedContext context);

    /**
     * Invoked before the identity is signed in and the browser is sent back to the originally requested URL.
     */
    SlackReturnEndpointContext returnEndpoint(SlackReturnEndpointContext context);

    /**
     * Invoked when a challenge sends the browser to the Slack authorize endpoint.
     */
    Response.ResponseBuilder applyRedirect(SlackApplyRedirectContext context);
}
