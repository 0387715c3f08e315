package slackauth.application.web;

import io.vavr.control.Try;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;
import org.apache.commons.lang3.StringUtils;
import org.jspecify.annotations.Nullable;
import slackauth.domain.auth.AuthProperties;
import slackauth.domain.auth.AuthRequest;
import slackauth.domain.auth.slack.SlackChallengeBuilder;

import java.net.URI;

/**
 * Starts a Slack login explicitly, which is the only way to log in when the middleware runs in
 * passive mode.
 */
@ApplicationScoped
@Path("/slack_login")
public class SlackLoginResource {

    @Inject
    private SlackChallengeBuilder challengeBuilder;

    @GET
    public Response get(@Context final UriInfo uriInfo,
                        @Context final HttpHeaders headers,
                        @QueryParam("redirect_uri") final String redirectUri) {
        final AuthRequest request = AuthRequest.fromUriInfo(uriInfo, headers.getCookies());

        final AuthProperties properties = new AuthProperties();
        properties.setRedirectUri(getSafeRedirectUri(request, redirectUri));

        return challengeBuilder.challenge(request, properties);
    }

    /**
     * Only relative paths and absolute URLs on the application's own host are honored, anything else
     * returns the user to the application root.
     */
    static String getSafeRedirectUri(final AuthRequest request, @Nullable final String redirectUri) {
        final String root = request.baseUri() + "/";

        if (StringUtils.isBlank(redirectUri)) {
            return root;
        }

        if (redirectUri.startsWith("/") && !redirectUri.startsWith("//") && !redirectUri.startsWith("/\\")) {
            return request.scheme() + "://" + request.host() + redirectUri;
        }

        return Try.of(() -> URI.create(redirectUri))
                .filter(uri -> request.scheme().equalsIgnoreCase(uri.getScheme()))
                .filter(uri -> request.host().equalsIgnoreCase(uri.getRawAuthority()))
                .map(uri -> redirectUri)
                .getOrElse(root);
    }
}
