package slackauth.domain.auth.slack;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.core.NewCookie;
import jakarta.ws.rs.core.Response;
import org.apache.commons.lang3.StringUtils;
import org.jspecify.annotations.Nullable;
import slackauth.domain.auth.AuthOptions;
import slackauth.domain.auth.AuthProperties;
import slackauth.domain.auth.AuthRequest;
import slackauth.domain.auth.QueryStrings;
import slackauth.domain.auth.config.SlackAuthConfig;
import slackauth.domain.auth.correlation.CorrelationMarker;
import slackauth.domain.auth.provider.SlackApplyRedirectContext;
import slackauth.domain.auth.provider.SlackAuthenticationProvider;
import slackauth.domain.auth.state.StateProtector;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Sends the browser to the Slack authorize endpoint (https://api.slack.com/authentication/oauth-v2).
 * No network calls are made here.
 */
@ApplicationScoped
public class SlackChallengeBuilder {
    public static final String SCOPE_KEY = "scope";
    public static final String TEAM_KEY = "team";

    @Inject
    private SlackAuthConfig config;

    @Inject
    private StateProtector stateProtector;

    @Inject
    private CorrelationMarker correlationMarker;

    @Inject
    private SlackAuthenticationProvider provider;

    @Inject
    private Logger logger;

    /**
     * Builds the challenge response. The properties are modified: the redirect target is defaulted,
     * the correlation id is added, and any scope or team items are moved into the query string.
     */
    public Response challenge(final AuthRequest request, final AuthProperties properties) {
        final NewCookie correlationCookie = correlationMarker.generate(request, properties);
        final String authorizationUrl = buildAuthorizationUrl(request, properties);

        logger.fine("Challenging " + request.path() + " with a redirect to Slack");

        final SlackApplyRedirectContext context = new SlackApplyRedirectContext(
                request,
                properties,
                authorizationUrl,
                Response.status(Response.Status.UNAUTHORIZED).cookie(correlationCookie));

        return provider.applyRedirect(context).build();
    }

    /**
     * The authorize URL for properties that already hold a correlation id.
     */
    public String buildAuthorizationUrl(final AuthRequest request, final AuthProperties properties) {
        final AuthOptions options = config.getOptions();

        if (StringUtils.isEmpty(properties.getRedirectUri())) {
            properties.setRedirectUri(request.currentUri());
        }

        final Map<String, String> queryStrings = new LinkedHashMap<>();
        queryStrings.put("response_type", "code");
        queryStrings.put("client_id", options.clientId());
        queryStrings.put("redirect_uri", request.baseUri() + options.callbackPath());

        final String scope = consumeItem(properties, SCOPE_KEY);
        queryStrings.put(SCOPE_KEY, scope == null
                ? options.scopeString()
                : String.join(" ", AuthOptions.ensureIdentify(AuthOptions.parseScopes(scope))));

        // team is specific to Slack, and works like login_hint
        final String team = StringUtils.defaultIfEmpty(consumeItem(properties, TEAM_KEY), options.team());
        if (StringUtils.isNotEmpty(team)) {
            queryStrings.put(TEAM_KEY, team);
        }

        queryStrings.put("state", stateProtector.protect(properties));

        return QueryStrings.addQueryString(options.authorizeEndpoint(), queryStrings);
    }

    /**
     * Removes the item so it is sent in the query string rather than inside the state.
     */
    @Nullable
    private static String consumeItem(final AuthProperties properties, final String name) {
        return properties.getItems().remove(name);
    }
}
