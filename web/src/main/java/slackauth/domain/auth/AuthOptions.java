package slackauth.domain.auth;

import org.apache.commons.lang3.StringUtils;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Immutable configuration of the Slack middleware, built once at startup.
 *
 * @param scopes always contains {@link #IDENTIFY_SCOPE} exactly once
 * @param team   the Slack workspace hint sent as the team parameter, or an empty string
 */
public record AuthOptions(
        String clientId,
        String clientSecret,
        List<String> scopes,
        String team,
        String callbackPath,
        String authenticationType,
        String signInAsAuthenticationType,
        AuthenticationMode authenticationMode,
        long timeoutSeconds,
        String authorizeEndpoint,
        String tokenEndpoint,
        String userInfoEndpoint) {

    public static final String IDENTIFY_SCOPE = "identify";
    public static final String AUTHORIZE_ENDPOINT = "https://slack.com/oauth/v2/authorize";
    public static final String TOKEN_ENDPOINT = "https://slack.com/api/oauth.v2.access";
    public static final String USER_INFO_ENDPOINT = "https://slack.com/api/users.info";

    public AuthOptions {
        checkArgument(StringUtils.isNotBlank(clientId), "The Slack client id must be provided");
        checkArgument(StringUtils.isNotBlank(clientSecret), "The Slack client secret must be provided");
        checkArgument(StringUtils.startsWith(callbackPath, "/"), "The callback path must start with a slash");
        checkArgument(timeoutSeconds > 0, "The timeout must be positive");
        scopes = ensureIdentify(scopes);
        team = StringUtils.defaultString(team);
        Objects.requireNonNull(authenticationType);
        Objects.requireNonNull(signInAsAuthenticationType);
        Objects.requireNonNull(authenticationMode);
    }

    /**
     * Removes blanks and duplicates, keeping the original order, and appends "identify" if it is missing.
     */
    public static List<String> ensureIdentify(final List<String> scopes) {
        final LinkedHashSet<String> normalized = new LinkedHashSet<>();
        for (final String scope : Objects.requireNonNullElse(scopes, List.<String>of())) {
            if (StringUtils.isNotBlank(scope)) {
                normalized.add(scope.trim());
            }
        }
        normalized.add(IDENTIFY_SCOPE);
        return List.copyOf(normalized);
    }

    /**
     * Splits a scope string on commas and whitespace, the two separators Slack accepts.
     */
    public static List<String> parseScopes(final String scopes) {
        return List.of(StringUtils.split(StringUtils.defaultString(scopes), ", "));
    }

    public String scopeString() {
        return String.join(" ", scopes);
    }
}
