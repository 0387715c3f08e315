package slackauth.domain.auth.correlation;

import io.smallrye.config.PropertiesConfigSource;
import io.smallrye.config.SmallRyeConfigBuilder;
import io.smallrye.config.inject.ConfigExtension;
import jakarta.inject.Inject;
import jakarta.ws.rs.core.Cookie;
import jakarta.ws.rs.core.MultivaluedHashMap;
import jakarta.ws.rs.core.NewCookie;
import org.eclipse.microprofile.config.Config;
import org.eclipse.microprofile.config.spi.ConfigProviderResolver;
import org.jboss.weld.junit5.auto.AddBeanClasses;
import org.jboss.weld.junit5.auto.AddExtensions;
import org.jboss.weld.junit5.auto.EnableAutoWeld;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import slackauth.domain.auth.AuthProperties;
import slackauth.domain.auth.AuthRequest;
import slackauth.domain.auth.config.SlackAuthConfig;
import slackauth.domain.logger.Loggers;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@EnableAutoWeld
@AddExtensions(ConfigExtension.class)
@AddBeanClasses(CookieCorrelationMarker.class)
@AddBeanClasses(SlackAuthConfig.class)
@AddBeanClasses(Loggers.class)
class CookieCorrelationMarkerTest {
    @Inject
    private CookieCorrelationMarker correlationMarker;

    @BeforeEach
    void updateConfig() {
        final var configSource = new PropertiesConfigSource(
                Map.of(
                        "slackauth.slack.clientid", "client-id",
                        "slackauth.slack.clientsecret", "client-secret"),
                "TestConfig",
                Integer.MAX_VALUE
        );
        final Config newConfig = new SmallRyeConfigBuilder()
                .withSources(configSource)
                .build();

        final var configProviderResolver = ConfigProviderResolver.instance();
        final var oldConfig = configProviderResolver.getConfig();

        configProviderResolver.releaseConfig(oldConfig);
        configProviderResolver.registerConfig(
                newConfig,
                Thread.currentThread().getContextClassLoader()
        );
    }

    @Test
    void generateStoresTheSameIdInTheCookieAndProperties() {
        final AuthProperties properties = new AuthProperties();

        final NewCookie cookie = correlationMarker.generate(request("https", "", Map.of()), properties);

        assertEquals(".Slack.Correlation.Slack", cookie.getName());
        assertEquals(cookie.getValue(), properties.getItems().get(CorrelationMarker.CORRELATION_KEY));
        // 32 bytes, base64url without padding
        assertEquals(43, cookie.getValue().length());
        assertTrue(cookie.isHttpOnly());
        assertTrue(cookie.isSecure());
        assertEquals("/", cookie.getPath());
    }

    @Test
    void cookieFollowsThePathBaseAndScheme() {
        final NewCookie cookie = correlationMarker.generate(request("http", "/app", Map.of()), new AuthProperties());

        assertFalse(cookie.isSecure());
        assertEquals("/app", cookie.getPath());
    }

    @Test
    void everyAttemptGetsANewId() {
        final AuthRequest request = request("https", "", Map.of());

        assertNotEquals(
                correlationMarker.generate(request, new AuthProperties()).getValue(),
                correlationMarker.generate(request, new AuthProperties()).getValue());
    }

    @Test
    void matchingCookieValidates() {
        final AuthProperties properties = new AuthProperties();
        final NewCookie cookie = correlationMarker.generate(request("https", "", Map.of()), properties);

        assertTrue(correlationMarker.validate(request("https", "", Map.of(cookie.getName(), cookie)), properties));
        assertFalse(properties.getItems().containsKey(CorrelationMarker.CORRELATION_KEY));
    }

    @Test
    void mismatchedCookieFails() {
        final AuthProperties properties = new AuthProperties();
        final NewCookie cookie = correlationMarker.generate(request("https", "", Map.of()), properties);
        final Cookie forged = new Cookie.Builder(cookie.getName()).value("forged").build();

        assertFalse(correlationMarker.validate(request("https", "", Map.of(cookie.getName(), forged)), properties));
        assertFalse(properties.getItems().containsKey(CorrelationMarker.CORRELATION_KEY));
    }

    @Test
    void missingCookieFails() {
        final AuthProperties properties = new AuthProperties();
        correlationMarker.generate(request("https", "", Map.of()), properties);

        assertFalse(correlationMarker.validate(request("https", "", Map.of()), properties));
        assertFalse(properties.getItems().containsKey(CorrelationMarker.CORRELATION_KEY));
    }

    @Test
    void missingPropertyFails() {
        final AuthProperties properties = new AuthProperties();
        final NewCookie cookie = correlationMarker.generate(request("https", "", Map.of()), properties);
        properties.getItems().clear();

        assertFalse(correlationMarker.validate(request("https", "", Map.of(cookie.getName(), cookie)), properties));
    }

    @Test
    void clearExpiresTheCookie() {
        final NewCookie cookie = correlationMarker.clear(request("https", "", Map.of()));

        assertEquals(".Slack.Correlation.Slack", cookie.getName());
        assertEquals("", cookie.getValue());
        assertEquals(0, cookie.getMaxAge());
    }

    private static AuthRequest request(final String scheme, final String pathBase, final Map<String, Cookie> cookies) {
        return new AuthRequest(scheme, "app.example.com", pathBase, "/signin-slack", "", new MultivaluedHashMap<>(), cookies);
    }
}
