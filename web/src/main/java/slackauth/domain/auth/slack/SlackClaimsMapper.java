package slackauth.domain.auth.slack;

import jakarta.enterprise.context.ApplicationScoped;
import org.jspecify.annotations.Nullable;
import slackauth.domain.auth.Claim;
import slackauth.domain.auth.ClaimTypes;
import slackauth.infrastructure.oauth.slack.api.SlackIncomingWebhook;
import slackauth.infrastructure.oauth.slack.api.SlackTokenResponse;
import slackauth.infrastructure.oauth.slack.api.SlackUser;

import java.util.ArrayList;
import java.util.List;

import static org.apache.commons.lang3.StringUtils.defaultIfEmpty;
import static org.apache.commons.lang3.StringUtils.isNotEmpty;

@ApplicationScoped
public class SlackClaimsMapper {

    /**
     * Combines the token response with the profile, if one was fetched. The profile only refines the
     * user id and name; team details come from the token response.
     */
    public SlackIdentity toIdentity(final SlackTokenResponse token, @Nullable final SlackUser user) {
        final SlackIncomingWebhook webhook = token.getIncomingWebhook();

        return new SlackIdentity(
                token.getAccessToken(),
                token.getTeamId(),
                token.getTeamName(),
                user == null ? token.getAuthedUserId() : defaultIfEmpty(user.id(), token.getAuthedUserId()),
                user == null ? "" : user.name(),
                token.getBotUserId(),
                token.getBotUserId().isEmpty() ? "" : token.getAccessToken(),
                token.getAuthedUserAccessToken(),
                webhook.channel(),
                webhook.channel_id(),
                webhook.configuration_url(),
                webhook.url());
    }

    /**
     * Name identifier, name, team id and team name, in that order. Claims without a value are left out.
     */
    public List<Claim> toClaims(final SlackIdentity identity, final String authenticationType) {
        final List<Claim> claims = new ArrayList<>();
        addClaim(claims, ClaimTypes.NAME_IDENTIFIER,
                identity.hasBotUser() ? identity.botUserId() : identity.userId(), authenticationType);
        addClaim(claims, ClaimTypes.NAME,
                identity.hasBotUser() ? identity.botUserId() : identity.userName(), authenticationType);
        addClaim(claims, ClaimTypes.SLACK_TEAM_ID, identity.teamId(), authenticationType);
        addClaim(claims, ClaimTypes.SLACK_TEAM_NAME, identity.teamName(), authenticationType);
        return List.copyOf(claims);
    }

    private static void addClaim(final List<Claim> claims, final String type, final String value, final String issuer) {
        if (isNotEmpty(value)) {
            claims.add(new Claim(type, value, ClaimTypes.XML_SCHEMA_STRING, issuer));
        }
    }
}
