package slackauth.domain.auth.slack;

import io.vavr.control.Try;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.NewCookie;
import jakarta.ws.rs.core.Response;
import org.jspecify.annotations.Nullable;
import slackauth.domain.auth.AuthOptions;
import slackauth.domain.auth.AuthProperties;
import slackauth.domain.auth.AuthRequest;
import slackauth.domain.auth.AuthenticationTicket;
import slackauth.domain.auth.ClaimsIdentity;
import slackauth.domain.auth.QueryStrings;
import slackauth.domain.auth.config.SlackAuthConfig;
import slackauth.domain.auth.correlation.CorrelationMarker;
import slackauth.domain.auth.provider.SlackAuthenticatedContext;
import slackauth.domain.auth.provider.SlackAuthenticationProvider;
import slackauth.domain.auth.provider.SlackReturnEndpointContext;
import slackauth.domain.auth.signin.SignInManager;
import slackauth.domain.auth.state.StateProtector;
import slackauth.domain.exceptionhandling.ExceptionHandler;
import slackauth.domain.exceptionhandling.ExceptionMapping;
import slackauth.domain.exceptions.CsrfValidationFailed;
import slackauth.domain.exceptions.ProfileFetchFailed;
import slackauth.domain.exceptions.ProviderDenied;
import slackauth.infrastructure.oauth.slack.SlackOauthClient;
import slackauth.infrastructure.oauth.slack.api.SlackTokenResponse;
import slackauth.infrastructure.oauth.slack.api.SlackUser;
import slackauth.infrastructure.oauth.slack.api.SlackUserInfoResponse;

import java.util.Optional;
import java.util.logging.Logger;

/**
 * Handles the browser coming back from Slack on the callback path.
 */
@ApplicationScoped
public class SlackCallbackHandler {
    @Inject
    private SlackAuthConfig config;

    @Inject
    private StateProtector stateProtector;

    @Inject
    private CorrelationMarker correlationMarker;

    @Inject
    private SlackOauthClient slackOauthClient;

    @Inject
    private SlackClaimsMapper claimsMapper;

    @Inject
    private SlackAuthenticationProvider provider;

    @Inject
    private SignInManager signInManager;

    @Inject
    private ExceptionHandler exceptionHandler;

    @Inject
    private ExceptionMapping exceptionMapping;

    @Inject
    private Logger logger;

    public boolean isCallbackRequest(final AuthRequest request) {
        return config.getOptions().callbackPath().equalsIgnoreCase(request.path());
    }

    /**
     * Turns the callback into a ticket. Returns null when the state can not be recovered, and a ticket
     * without an identity for every other failure. Never throws.
     */
    @Nullable
    public AuthenticationTicket authenticate(final AuthRequest request) {
        final Try<AuthProperties> properties = Try.of(() -> stateProtector.unprotect(
                request.getSingleQueryValue("state").orElse(null)));

        if (properties.isFailure()) {
            logger.warning("Rejecting Slack callback: " + exceptionHandler.getExceptionMessage(properties.getCause()));
            return null;
        }

        return exceptionMapping.map(Try.of(() -> authenticate(request, properties.get())))
                .onFailure(this::logFailure)
                .recover(ex -> new AuthenticationTicket(null, properties.get()))
                .get();
    }

    private AuthenticationTicket authenticate(final AuthRequest request, final AuthProperties properties) {
        final AuthOptions options = config.getOptions();

        final Optional<String> error = request.getSingleQueryValue("error");
        if (error.isPresent()) {
            throw new ProviderDenied("Slack returned the error " + error.get());
        }

        // OAuth2 10.12 CSRF
        if (!correlationMarker.validate(request, properties)) {
            throw new CsrfValidationFailed("The correlation cookie did not match the state parameter");
        }

        final String code = request.getSingleQueryValue("code").orElse("");
        final String redirectUri = request.baseUri() + options.callbackPath();

        final SlackTokenResponse token = slackOauthClient.exchangeCode(code, redirectUri);

        final SlackUser user = Try.of(() -> slackOauthClient.getUser(token.getAccessToken(), token.getAuthedUserId()))
                .onFailure(ProfileFetchFailed.class, ex -> logger.warning(
                        "Continuing without the Slack profile: " + exceptionHandler.getExceptionMessage(ex)))
                .recover(ProfileFetchFailed.class, ex -> new SlackUserInfoResponse(null, null, null))
                .map(response -> response.findUser().orElse(null))
                .get();

        final SlackIdentity slackIdentity = claimsMapper.toIdentity(token, user);
        final ClaimsIdentity identity = new ClaimsIdentity(
                options.authenticationType(),
                claimsMapper.toClaims(slackIdentity, options.authenticationType()));

        final SlackAuthenticatedContext context = provider.authenticated(
                new SlackAuthenticatedContext(request, slackIdentity, identity, properties));

        return new AuthenticationTicket(context.identity(), context.properties());
    }

    /**
     * Authenticates the callback, signs the user in and builds the redirect back to the application.
     * Returns empty when a hook neither completed the request nor left a redirect target, in which
     * case the request continues down the pipeline.
     */
    public Optional<Response> invokeReturnPath(final AuthRequest request) {
        final AuthOptions options = config.getOptions();
        final NewCookie clearCorrelation = correlationMarker.clear(request);

        final AuthenticationTicket ticket = authenticate(request);
        if (ticket == null) {
            logger.warning("Invalid return state, unable to redirect.");
            return Optional.of(Response.serverError().cookie(clearCorrelation).build());
        }

        final SlackReturnEndpointContext context = provider.returnEndpoint(new SlackReturnEndpointContext(
                request,
                ticket.identity(),
                ticket.properties(),
                options.signInAsAuthenticationType(),
                ticket.properties().getRedirectUri(),
                false,
                Response.ok().cookie(clearCorrelation)));

        final ClaimsIdentity identity = context.identity();
        final String signInAs = context.signInAsAuthenticationType();
        if (signInAs != null && identity != null) {
            final ClaimsIdentity grantIdentity = signInAs.equals(identity.authenticationType())
                    ? identity
                    : identity.withAuthenticationType(signInAs);
            signInManager.signIn(request, context.properties(), grantIdentity, context.response());
        }

        final String redirectUri = context.redirectUri();
        if (!context.requestCompleted() && redirectUri != null) {
            // add a redirect hint that sign-in failed in some way
            final String location = identity == null
                    ? QueryStrings.addQueryString(redirectUri, "error", "access_denied")
                    : redirectUri;
            return Optional.of(context.response()
                    .status(Response.Status.FOUND)
                    .header(HttpHeaders.LOCATION, location)
                    .build());
        }

        return context.requestCompleted()
                ? Optional.of(context.response().build())
                : Optional.empty();
    }

    private void logFailure(final Throwable ex) {
        if (ex instanceof ProviderDenied) {
            logger.info("Slack login was not granted: " + ex.getMessage());
        } else if (ex instanceof CsrfValidationFailed) {
            logger.warning("Slack login failed correlation: " + ex.getMessage());
        } else {
            logger.severe("Authentication failed: " + exceptionHandler.getExceptionMessage(ex));
        }
    }
}
