package slackauth.domain.auth;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

class QueryStringsTest {

    @Test
    void startsANewQueryString() {
        assertEquals("https://example.com/home?error=access_denied",
                QueryStrings.addQueryString("https://example.com/home", "error", "access_denied"));
    }

    @Test
    void appendsToAnExistingQueryString() {
        assertEquals("https://example.com/home?tab=1&error=access_denied",
                QueryStrings.addQueryString("https://example.com/home?tab=1", "error", "access_denied"));
    }

    @Test
    void keepsTheFragmentLast() {
        assertEquals("https://example.com/home?error=access_denied#top",
                QueryStrings.addQueryString("https://example.com/home#top", "error", "access_denied"));
    }

    @Test
    void encodesNamesAndValuesInOrder() {
        final Map<String, String> parameters = new LinkedHashMap<>();
        parameters.put("redirect_uri", "https://example.com/signin-slack");
        parameters.put("scope", "users:read identify");

        assertEquals("https://slack.com/oauth/v2/authorize"
                        + "?redirect_uri=https%3A%2F%2Fexample.com%2Fsignin-slack"
                        + "&scope=users%3Aread+identify",
                QueryStrings.addQueryString("https://slack.com/oauth/v2/authorize", parameters));
    }
}
