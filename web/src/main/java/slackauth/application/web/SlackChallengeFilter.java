package slackauth.application.web;

import jakarta.annotation.Priority;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerResponseContext;
import jakarta.ws.rs.container.ContainerResponseFilter;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.Provider;
import slackauth.domain.auth.AuthProperties;
import slackauth.domain.auth.AuthRequest;
import slackauth.domain.auth.AuthenticationMode;
import slackauth.domain.auth.config.SlackAuthConfig;
import slackauth.domain.auth.slack.SlackChallengeBuilder;

/**
 * In active mode, turns every 401 leaving the application into a redirect to Slack.
 */
@ApplicationScoped
@Provider
@Priority(Priorities.AUTHENTICATION)
public class SlackChallengeFilter implements ContainerResponseFilter {

    @Inject
    private SlackAuthConfig config;

    @Inject
    private SlackChallengeBuilder challengeBuilder;

    @Override
    public void filter(final ContainerRequestContext requestContext, final ContainerResponseContext responseContext) {
        if (responseContext.getStatus() != Response.Status.UNAUTHORIZED.getStatusCode()
                || config.getOptions().authenticationMode() != AuthenticationMode.ACTIVE) {
            return;
        }

        final Response challenge = challengeBuilder.challenge(
                AuthRequest.fromContext(requestContext),
                new AuthProperties());

        responseContext.setStatus(challenge.getStatus());
        responseContext.setEntity(null);
        challenge.getHeaders().forEach((name, values) -> responseContext.getHeaders().put(name, values));
    }
}
