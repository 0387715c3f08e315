package slackauth.domain.auth.correlation;

import jakarta.ws.rs.core.NewCookie;
import slackauth.domain.auth.AuthProperties;
import slackauth.domain.auth.AuthRequest;

/**
 * Binds a login attempt to the browser that started it (OAuth 2.0 RFC 6749 section 10.12).
 */
public interface CorrelationMarker {
    /**
     * The item key holding the correlation id inside {@link AuthProperties}.
     */
    String CORRELATION_KEY = ".xsrf";

    /**
     * Stores a new random correlation id in the properties and returns the cookie that carries the same id.
     */
    NewCookie generate(AuthRequest request, AuthProperties properties);

    /**
     * Checks the id in the properties against the cookie sent with the request. The id is removed from
     * the properties either way.
     */
    boolean validate(AuthRequest request, AuthProperties properties);

    /**
     * An expired cookie that removes the correlation cookie from the browser.
     */
    NewCookie clear(AuthRequest request);
}
