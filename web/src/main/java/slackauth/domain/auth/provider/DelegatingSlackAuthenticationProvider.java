package slackauth.domain.auth.provider;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.Response;

import java.util.Objects;
import java.util.function.Function;
import java.util.function.UnaryOperator;

/**
 * Default {@link SlackAuthenticationProvider}. Each hook is a plain function that can be swapped at
 * startup; out of the box the first two pass the context through and the redirect hook answers
 * with a 302 to the Slack authorize URL.
 */
@ApplicationScoped
public class DelegatingSlackAuthenticationProvider implements SlackAuthenticationProvider {
    private UnaryOperator<SlackAuthenticatedContext> onAuthenticated = UnaryOperator.identity();
    private UnaryOperator<SlackReturnEndpointContext> onReturnEndpoint = UnaryOperator.identity();
    private Function<SlackApplyRedirectContext, Response.ResponseBuilder> onApplyRedirect =
            DelegatingSlackAuthenticationProvider::redirect;

    public static Response.ResponseBuilder redirect(final SlackApplyRedirectContext context) {
        return context.response()
                .status(Response.Status.FOUND)
                .header(HttpHeaders.LOCATION, context.redirectUri());
    }

    @Override
    public SlackAuthenticatedContext authenticated(final SlackAuthenticatedContext context) {
        return onAuthenticated.apply(context);
    }

    @Override
    public SlackReturnEndpointContext returnEndpoint(final SlackReturnEndpointContext context) {
        return onReturnEndpoint.apply(context);
    }

    @Override
    public Response.ResponseBuilder applyRedirect(final SlackApplyRedirectContext context) {
        return onApplyRedirect.apply(context);
    }

    public void setOnAuthenticated(final UnaryOperator<SlackAuthenticatedContext> onAuthenticated) {
        this.onAuthenticated = Objects.requireNonNull(onAuthenticated);
    }

    public void setOnReturnEndpoint(final UnaryOperator<SlackReturnEndpointContext> onReturnEndpoint) {
        this.onReturnEndpoint = Objects.requireNonNull(onReturnEndpoint);
    }

    public void setOnApplyRedirect(final Function<SlackApplyRedirectContext, Response.ResponseBuilder> onApplyRedirect) {
        this.onApplyRedirect = Objects.requireNonNull(onApplyRedirect);
    }
}
