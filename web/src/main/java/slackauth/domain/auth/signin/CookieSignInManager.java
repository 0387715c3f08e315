package slackauth.domain.auth.signin;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.core.NewCookie;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import slackauth.domain.auth.AuthProperties;
import slackauth.domain.auth.AuthRequest;
import slackauth.domain.auth.ClaimsIdentity;
import slackauth.domain.encryption.Encryptor;
import slackauth.domain.json.JsonDeserializer;

import java.util.logging.Logger;

/**
 * Writes the identity into an encrypted, HttpOnly session cookie. The cookie is Secure whenever the
 * callback arrived over https.
 */
@ApplicationScoped
public class CookieSignInManager implements SignInManager {
    @Inject
    @ConfigProperty(name = "slackauth.session.cookiename", defaultValue = "slackauth.session")
    private String cookieName;

    @Inject
    private Encryptor encryptor;

    @Inject
    private JsonDeserializer jsonDeserializer;

    @Inject
    private Logger logger;

    @Override
    public void signIn(final AuthRequest request, final AuthProperties properties, final ClaimsIdentity identity, final Response.ResponseBuilder response) {
        final String session = encryptor.encrypt(jsonDeserializer.serialize(identity));

        logger.fine("Signing in " + identity.getName().orElse("unnamed identity") + " as " + identity.authenticationType());

        response.cookie(new NewCookie.Builder(cookieName)
                .value(session)
                .path("/")
                .httpOnly(true)
                .secure(request.isHttps())
                .build());
    }

    /**
     * Reads back an identity written by {@link #signIn}.
     */
    public ClaimsIdentity readSession(final String cookieValue) {
        return jsonDeserializer.deserialize(encryptor.decrypt(cookieValue), ClaimsIdentity.class);
    }

    public String getCookieName() {
        return cookieName;
    }
}
