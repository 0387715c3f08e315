package slackauth.infrastructure.oauth.slack.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SlackTeam(String id, String name) {
}
