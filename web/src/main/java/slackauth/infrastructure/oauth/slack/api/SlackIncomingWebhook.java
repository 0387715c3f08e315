package slackauth.infrastructure.oauth.slack.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SlackIncomingWebhook(String channel, String channel_id, String configuration_url, String url) {
}
