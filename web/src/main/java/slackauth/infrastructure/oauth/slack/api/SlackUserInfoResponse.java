package slackauth.infrastructure.oauth.slack.api;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.jspecify.annotations.Nullable;

import java.util.Optional;

/*
The parts of https://api.slack.com/methods/users.info we use:
{
  "ok": true,
  "user": {
    "id": "W012A3CDE",
    "team_id": "T012AB3C4",
    "name": "spengler",
    "real_name": "Egon Spengler"
  }
}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SlackUserInfoResponse(@Nullable Boolean ok, @Nullable String error, @Nullable SlackUser user) {
    @JsonIgnore
    public boolean isRejected() {
        return Boolean.FALSE.equals(ok);
    }

    public Optional<SlackUser> findUser() {
        return Optional.ofNullable(user);
    }
}
