package slackauth.domain.auth.signin;

import jakarta.ws.rs.core.Response;
import slackauth.domain.auth.AuthProperties;
import slackauth.domain.auth.AuthRequest;
import slackauth.domain.auth.ClaimsIdentity;

/**
 * Establishes the local session once Slack has vouched for the user. Applications that keep
 * sessions elsewhere replace the default bean with a CDI alternative.
 */
public interface SignInManager {
    /**
     * @param request the callback request, used for cookie attributes such as Secure
     */
    void signIn(AuthRequest request, AuthProperties properties, ClaimsIdentity identity, Response.ResponseBuilder response);
}
