package slackauth.application.web;

import jakarta.annotation.Priority;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerRequestFilter;
import jakarta.ws.rs.container.PreMatching;
import jakarta.ws.rs.ext.Provider;
import slackauth.domain.auth.AuthRequest;
import slackauth.domain.auth.slack.SlackCallbackHandler;

/**
 * Intercepts requests to the configured callback path before resource matching, so the
 * callback does not need a resource of its own.
 */
@ApplicationScoped
@Provider
@PreMatching
@Priority(Priorities.AUTHENTICATION)
public class SlackCallbackFilter implements ContainerRequestFilter {

    @Inject
    private SlackCallbackHandler callbackHandler;

    @Override
    public void filter(final ContainerRequestContext requestContext) {
        final AuthRequest request = AuthRequest.fromContext(requestContext);
        if (!callbackHandler.isCallbackRequest(request)) {
            return;
        }

        callbackHandler.invokeReturnPath(request).ifPresent(requestContext::abortWith);
    }
}
