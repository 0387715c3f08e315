package slackauth.infrastructure.oauth.slack;

import slackauth.infrastructure.oauth.slack.api.SlackTokenResponse;
import slackauth.infrastructure.oauth.slack.api.SlackUserInfoResponse;

public interface SlackOauthClient {
    /**
     * Calls oauth.v2.access.
     *
     * @throws slackauth.domain.exceptions.TokenExchangeFailed if Slack does not issue a token
     */
    SlackTokenResponse exchangeCode(String code, String redirectUri);

    /**
     * Calls users.info.
     *
     * @throws slackauth.domain.exceptions.ProfileFetchFailed if Slack does not return the profile
     */
    SlackUserInfoResponse getUser(String accessToken, String userId);
}
