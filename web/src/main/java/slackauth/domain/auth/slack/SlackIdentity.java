package slackauth.domain.auth.slack;

import org.apache.commons.lang3.StringUtils;

/**
 * Everything Slack told us about the login, normalized so absent values are empty strings.
 *
 * @param accessToken     the token issued by oauth.v2.access. For bot installs this is the bot token.
 * @param botAccessToken  the bot token, set only when the install created a bot user
 * @param userAccessToken the user token from authed_user, set only when user scopes were requested
 */
public record SlackIdentity(
        String accessToken,
        String teamId,
        String teamName,
        String userId,
        String userName,
        String botUserId,
        String botAccessToken,
        String userAccessToken,
        String incomingWebhookChannel,
        String incomingWebhookChannelId,
        String incomingWebhookConfigUrl,
        String incomingWebhookUrl) {

    public SlackIdentity {
        accessToken = StringUtils.defaultString(accessToken);
        teamId = StringUtils.defaultString(teamId);
        teamName = StringUtils.defaultString(teamName);
        userId = StringUtils.defaultString(userId);
        userName = StringUtils.defaultString(userName);
        botUserId = StringUtils.defaultString(botUserId);
        botAccessToken = StringUtils.defaultString(botAccessToken);
        userAccessToken = StringUtils.defaultString(userAccessToken);
        incomingWebhookChannel = StringUtils.defaultString(incomingWebhookChannel);
        incomingWebhookChannelId = StringUtils.defaultString(incomingWebhookChannelId);
        incomingWebhookConfigUrl = StringUtils.defaultString(incomingWebhookConfigUrl);
        incomingWebhookUrl = StringUtils.defaultString(incomingWebhookUrl);
    }

    /**
     * Slack user ids are only unique within a team, so this is the stable id of the user.
     */
    public String userSub() {
        return teamId + "_" + userId;
    }

    /**
     * The stable id of the bot user, or an empty string for installs without a bot.
     */
    public String botUserSub() {
        return botUserId.isEmpty() ? "" : teamId + "_" + botUserId;
    }

    public boolean hasBotUser() {
        return !botUserId.isEmpty();
    }
}
