package slackauth.domain.auth.slack;

import jakarta.enterprise.context.ApplicationScoped;
import slackauth.infrastructure.oauth.slack.SlackOauthClient;
import slackauth.infrastructure.oauth.slack.api.SlackAuthedUser;
import slackauth.infrastructure.oauth.slack.api.SlackTeam;
import slackauth.infrastructure.oauth.slack.api.SlackTokenResponse;
import slackauth.infrastructure.oauth.slack.api.SlackUser;
import slackauth.infrastructure.oauth.slack.api.SlackUserInfoResponse;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Supplier;

/**
 * Stands in for the Slack Web API, recording every call.
 */
@ApplicationScoped
public class FakeSlackOauthClient implements SlackOauthClient {
    public static final SlackTokenResponse USER_TOKEN = new SlackTokenResponse(
            true, null, "xoxp-5678", "user", "identify", null, "A1",
            new SlackAuthedUser("U1", "identify", null, "user"),
            null,
            new SlackTeam("T1", "Slack Softball Team"));

    public static final SlackUserInfoResponse USER_INFO = new SlackUserInfoResponse(
            true, null, new SlackUser("U1", "spengler"));

    private final List<String> exchangedCodes = new CopyOnWriteArrayList<>();
    private final List<String> redirectUris = new CopyOnWriteArrayList<>();
    private final List<String> fetchedUsers = new CopyOnWriteArrayList<>();

    private Supplier<SlackTokenResponse> tokenResponse = () -> USER_TOKEN;
    private Supplier<SlackUserInfoResponse> userInfoResponse = () -> USER_INFO;

    @Override
    public SlackTokenResponse exchangeCode(final String code, final String redirectUri) {
        exchangedCodes.add(code);
        redirectUris.add(redirectUri);
        return tokenResponse.get();
    }

    @Override
    public SlackUserInfoResponse getUser(final String accessToken, final String userId) {
        fetchedUsers.add(accessToken + "/" + userId);
        return userInfoResponse.get();
    }

    public void setTokenResponse(final Supplier<SlackTokenResponse> tokenResponse) {
        this.tokenResponse = tokenResponse;
    }

    public void setUserInfoResponse(final Supplier<SlackUserInfoResponse> userInfoResponse) {
        this.userInfoResponse = userInfoResponse;
    }

    public List<String> getExchangedCodes() {
        return exchangedCodes;
    }

    public List<String> getRedirectUris() {
        return redirectUris;
    }

    public List<String> getFetchedUsers() {
        return fetchedUsers;
    }
}
