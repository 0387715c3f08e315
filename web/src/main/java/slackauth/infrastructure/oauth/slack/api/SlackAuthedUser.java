package slackauth.infrastructure.oauth.slack.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * The user who approved the installation. access_token is only present when user scopes were requested.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SlackAuthedUser(String id, String scope, String access_token, String token_type) {
}
