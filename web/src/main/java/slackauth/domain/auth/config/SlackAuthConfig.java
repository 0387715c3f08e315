package slackauth.domain.auth.config;

import io.vavr.Lazy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import slackauth.domain.auth.AuthOptions;
import slackauth.domain.auth.AuthenticationMode;

import java.util.Locale;
import java.util.Optional;

/**
 * Reads the Slack middleware settings from MicroProfile Config. The options are validated the first
 * time they are requested, so a missing client id fails the first login rather than the deployment.
 */
@ApplicationScoped
public class SlackAuthConfig {
    @Inject
    @ConfigProperty(name = "slackauth.slack.clientid")
    private Optional<String> clientId;

    @Inject
    @ConfigProperty(name = "slackauth.slack.clientsecret")
    private Optional<String> clientSecret;

    @Inject
    @ConfigProperty(name = "slackauth.slack.scopes", defaultValue = AuthOptions.IDENTIFY_SCOPE)
    private String scopes;

    @Inject
    @ConfigProperty(name = "slackauth.slack.team")
    private Optional<String> team;

    @Inject
    @ConfigProperty(name = "slackauth.slack.callbackpath", defaultValue = "/signin-slack")
    private String callbackPath;

    @Inject
    @ConfigProperty(name = "slackauth.slack.authenticationtype", defaultValue = "Slack")
    private String authenticationType;

    @Inject
    @ConfigProperty(name = "slackauth.slack.signinastype", defaultValue = "ExternalCookie")
    private String signInAsAuthenticationType;

    @Inject
    @ConfigProperty(name = "slackauth.slack.authenticationmode", defaultValue = "active")
    private String authenticationMode;

    @Inject
    @ConfigProperty(name = "slackauth.slack.timeoutseconds", defaultValue = "60")
    private String timeoutSeconds;

    @Inject
    @ConfigProperty(name = "slackauth.slack.authorizeendpoint", defaultValue = AuthOptions.AUTHORIZE_ENDPOINT)
    private String authorizeEndpoint;

    @Inject
    @ConfigProperty(name = "slackauth.slack.tokenendpoint", defaultValue = AuthOptions.TOKEN_ENDPOINT)
    private String tokenEndpoint;

    @Inject
    @ConfigProperty(name = "slackauth.slack.userinfoendpoint", defaultValue = AuthOptions.USER_INFO_ENDPOINT)
    private String userInfoEndpoint;

    private final Lazy<AuthOptions> options = Lazy.of(this::buildOptions);

    public AuthOptions getOptions() {
        return options.get();
    }

    private AuthOptions buildOptions() {
        return new AuthOptions(
                clientId.orElse(""),
                clientSecret.orElse(""),
                AuthOptions.parseScopes(scopes),
                team.orElse(""),
                callbackPath,
                authenticationType,
                signInAsAuthenticationType,
                AuthenticationMode.valueOf(authenticationMode.trim().toUpperCase(Locale.ROOT)),
                Long.parseLong(timeoutSeconds),
                authorizeEndpoint,
                tokenEndpoint,
                userInfoEndpoint);
    }
}
