package slackauth.infrastructure.oauth.slack;

import io.vavr.control.Try;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.client.Client;
import jakarta.ws.rs.client.ClientBuilder;
import jakarta.ws.rs.client.Entity;
import jakarta.ws.rs.core.Form;
import jakarta.ws.rs.core.MediaType;
import org.apache.commons.lang3.StringUtils;
import slackauth.domain.auth.AuthOptions;
import slackauth.domain.auth.config.SlackAuthConfig;
import slackauth.domain.exceptions.ExternalFailure;
import slackauth.domain.exceptions.InvalidResponse;
import slackauth.domain.exceptions.ProfileFetchFailed;
import slackauth.domain.exceptions.Timeout;
import slackauth.domain.exceptions.TokenExchangeFailed;
import slackauth.domain.httpclient.TimeoutHttpClientCaller;
import slackauth.domain.json.JsonDeserializer;
import slackauth.domain.response.ResponseValidation;
import slackauth.infrastructure.oauth.slack.api.SlackTokenResponse;
import slackauth.infrastructure.oauth.slack.api.SlackUserInfoResponse;

import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * Talks to the Slack Web API. Both calls are form encoded POSTs, and the responses are read as
 * strings and decoded explicitly, so a missing field shows up as a null record component instead
 * of a provider error.
 */
@ApplicationScoped
public class SlackOauthClientLive implements SlackOauthClient {
    private static final long API_CONNECTION_TIMEOUT_SECONDS_DEFAULT = 10;
    private static final long CLIENT_TIMEOUT_BUFFER_SECONDS = 5;

    @Inject
    private SlackAuthConfig config;

    @Inject
    private TimeoutHttpClientCaller httpClientCaller;

    @Inject
    private ResponseValidation responseValidation;

    @Inject
    private JsonDeserializer jsonDeserializer;

    @Inject
    private Logger logger;

    private Client getClient() {
        final long timeoutSeconds = config.getOptions().timeoutSeconds();
        final ClientBuilder clientBuilder = ClientBuilder.newBuilder();
        clientBuilder.connectTimeout(Math.min(API_CONNECTION_TIMEOUT_SECONDS_DEFAULT, timeoutSeconds), TimeUnit.SECONDS);
        // We want to use the timeoutService to handle timeouts, so we set the client timeout slightly longer.
        clientBuilder.readTimeout(timeoutSeconds + CLIENT_TIMEOUT_BUFFER_SECONDS, TimeUnit.SECONDS);
        return clientBuilder.build();
    }

    @Override
    public SlackTokenResponse exchangeCode(final String code, final String redirectUri) {
        final AuthOptions options = config.getOptions();
        final String target = options.tokenEndpoint();

        logger.fine("Exchanging authorization code at " + target);

        final Form form = new Form()
                .param("grant_type", "authorization_code")
                .param("code", StringUtils.defaultString(code))
                .param("redirect_uri", redirectUri)
                .param("client_id", options.clientId())
                .param("client_secret", options.clientSecret());

        final SlackTokenResponse response = post(
                target,
                form,
                SlackTokenResponse.class,
                e -> new TokenExchangeFailed("Slack token endpoint returned HTTP " + e.getCode(), e),
                options.timeoutSeconds());

        if (response.isRejected()) {
            throw new TokenExchangeFailed("Slack rejected the authorization code: " + response.error());
        }

        if (StringUtils.isEmpty(response.access_token())) {
            throw new TokenExchangeFailed("Slack did not return an access token");
        }

        return response;
    }

    @Override
    public SlackUserInfoResponse getUser(final String accessToken, final String userId) {
        final AuthOptions options = config.getOptions();
        final String target = options.userInfoEndpoint();

        logger.fine("Getting Slack user " + userId);

        final Form form = new Form()
                .param("token", accessToken)
                .param("user", userId);

        final SlackUserInfoResponse response = post(
                target,
                form,
                SlackUserInfoResponse.class,
                e -> new ProfileFetchFailed("Slack user info endpoint returned HTTP " + e.getCode(), e),
                options.timeoutSeconds());

        if (response.isRejected()) {
            throw new ProfileFetchFailed("Slack rejected the user info request: " + response.error());
        }

        return response;
    }

    private <T> T post(
            final String target,
            final Form form,
            final Class<T> responseClass,
            final Function<InvalidResponse, RuntimeException> statusException,
            final long timeoutSeconds) {
        return httpClientCaller.call(
                this::getClient,
                client -> client.target(target)
                        .request()
                        .accept(MediaType.APPLICATION_JSON_TYPE)
                        .post(Entity.form(form)),
                response -> Try.of(() -> responseValidation.validate(response, target))
                        .map(r -> r.readEntity(String.class))
                        .map(body -> jsonDeserializer.deserialize(body, responseClass))
                        .get(),
                e -> buildException(e, target, statusException),
                () -> {
                    throw new Timeout("Call to " + target + " timed out after " + timeoutSeconds + " seconds");
                },
                timeoutSeconds);
    }

    private static RuntimeException buildException(
            final Throwable e,
            final String target,
            final Function<InvalidResponse, RuntimeException> statusException) {
        if (e instanceof InvalidResponse) {
            return statusException.apply((InvalidResponse) e);
        }
        if (e instanceof RuntimeException) {
            return (RuntimeException) e;
        }
        return new ExternalFailure("Failed to call " + target, e);
    }
}
