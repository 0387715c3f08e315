package slackauth.domain.auth;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class AuthOptionsTest {

    @Test
    void identifyIsAppended() {
        assertEquals(List.of("users:read", "identify"), AuthOptions.ensureIdentify(List.of("users:read")));
    }

    @Test
    void identifyIsNotDuplicated() {
        assertEquals(List.of("identify", "users:read"),
                AuthOptions.ensureIdentify(List.of("identify", "users:read", "identify", " ", "users:read")));
    }

    @Test
    void emptyScopesBecomeIdentify() {
        assertEquals(List.of("identify"), AuthOptions.ensureIdentify(List.of()));
        assertEquals(List.of("identify"), AuthOptions.ensureIdentify(null));
    }

    @Test
    void scopesAreSplitOnCommasAndSpaces() {
        assertEquals(List.of("users:read", "chat:write", "identify"),
                AuthOptions.parseScopes("users:read, chat:write identify"));
    }

    @Test
    void scopeStringIsSpaceSeparated() {
        final AuthOptions options = options("client", "secret", List.of("users:read", "identify", "users:read"));

        assertEquals("users:read identify", options.scopeString());
        assertEquals("", options.team());
    }

    @Test
    void clientIdIsRequired() {
        assertThrows(IllegalArgumentException.class, () -> options("", "secret", List.of()));
    }

    @Test
    void clientSecretIsRequired() {
        assertThrows(IllegalArgumentException.class, () -> options("client", " ", List.of()));
    }

    private static AuthOptions options(final String clientId, final String clientSecret, final List<String> scopes) {
        return new AuthOptions(
                clientId,
                clientSecret,
                scopes,
                null,
                "/signin-slack",
                "Slack",
                "ExternalCookie",
                AuthenticationMode.ACTIVE,
                60,
                AuthOptions.AUTHORIZE_ENDPOINT,
                AuthOptions.TOKEN_ENDPOINT,
                AuthOptions.USER_INFO_ENDPOINT);
    }
}
