package slackauth.domain.auth.provider;

import jakarta.ws.rs.core.Response;
import org.jspecify.annotations.Nullable;
import slackauth.domain.auth.AuthProperties;
import slackauth.domain.auth.AuthRequest;
import slackauth.domain.auth.ClaimsIdentity;

/**
 * Passed to {@link SlackAuthenticationProvider#returnEndpoint} before the user is signed in and
 * redirected. A hook that writes its own response into {@code response} should return
 * {@link #completed()} so no redirect is added.
 *
 * @param identity                   null when the login failed
 * @param signInAsAuthenticationType the authentication type the identity is signed in under, or null to skip sign-in
 */
public record SlackReturnEndpointContext(
        AuthRequest request,
        @Nullable ClaimsIdentity identity,
        AuthProperties properties,
        @Nullable String signInAsAuthenticationType,
        @Nullable String redirectUri,
        boolean requestCompleted,
        Response.ResponseBuilder response) {

    public SlackReturnEndpointContext withIdentity(@Nullable final ClaimsIdentity newIdentity) {
        return new SlackReturnEndpointContext(request, newIdentity, properties, signInAsAuthenticationType, redirectUri, requestCompleted, response);
    }

    public SlackReturnEndpointContext withSignInAsAuthenticationType(@Nullable final String newSignInAsAuthenticationType) {
        return new SlackReturnEndpointContext(request, identity, properties, newSignInAsAuthenticationType, redirectUri, requestCompleted, response);
    }

    public SlackReturnEndpointContext withRedirectUri(@Nullable final String newRedirectUri) {
        return new SlackReturnEndpointContext(request, identity, properties, signInAsAuthenticationType, newRedirectUri, requestCompleted, response);
    }

    public SlackReturnEndpointContext completed() {
        return new SlackReturnEndpointContext(request, identity, properties, signInAsAuthenticationType, redirectUri, true, response);
    }
}
