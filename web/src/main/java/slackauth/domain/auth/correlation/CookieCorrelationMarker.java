package slackauth.domain.auth.correlation;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.core.Cookie;
import jakarta.ws.rs.core.NewCookie;
import org.apache.commons.lang3.StringUtils;
import slackauth.domain.auth.AuthProperties;
import slackauth.domain.auth.AuthRequest;
import slackauth.domain.auth.config.SlackAuthConfig;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.Date;
import java.util.logging.Logger;

@ApplicationScoped
public class CookieCorrelationMarker implements CorrelationMarker {
    private static final SecureRandom RANDOM = new SecureRandom();
    private static final int CORRELATION_BYTES = 32;
    private static final String COOKIE_PREFIX = ".Slack.Correlation.";

    @Inject
    private SlackAuthConfig config;

    @Inject
    private Logger logger;

    @Override
    public NewCookie generate(final AuthRequest request, final AuthProperties properties) {
        final byte[] nonce = new byte[CORRELATION_BYTES];
        RANDOM.nextBytes(nonce);
        final String correlationId = Base64.getUrlEncoder().withoutPadding().encodeToString(nonce);

        properties.getItems().put(CORRELATION_KEY, correlationId);

        return cookieBuilder(request)
                .value(correlationId)
                .build();
    }

    @Override
    public boolean validate(final AuthRequest request, final AuthProperties properties) {
        final String cookieValue = request.getCookie(getCookieName())
                .map(Cookie::getValue)
                .orElse(null);
        final String correlationId = properties.getItems().remove(CORRELATION_KEY);

        if (StringUtils.isEmpty(cookieValue)) {
            logger.warning(getCookieName() + " cookie not found.");
            return false;
        }

        if (StringUtils.isEmpty(correlationId)
                || !MessageDigest.isEqual(
                cookieValue.getBytes(StandardCharsets.UTF_8),
                correlationId.getBytes(StandardCharsets.UTF_8))) {
            logger.warning(getCookieName() + " state property not found or did not match the cookie.");
            return false;
        }

        return true;
    }

    @Override
    public NewCookie clear(final AuthRequest request) {
        return cookieBuilder(request)
                .value("")
                .maxAge(0)
                .expiry(new Date(0))
                .build();
    }

    public String getCookieName() {
        return COOKIE_PREFIX + config.getOptions().authenticationType();
    }

    private NewCookie.Builder cookieBuilder(final AuthRequest request) {
        return new NewCookie.Builder(getCookieName())
                .path(StringUtils.defaultIfEmpty(request.pathBase(), "/"))
                .httpOnly(true)
                .secure(request.isHttps());
    }
}
