package slackauth.domain.auth.state;

import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;
import com.google.common.io.BaseEncoding;
import io.vavr.Lazy;
import io.vavr.control.Try;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.apache.commons.lang3.StringUtils;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jspecify.annotations.Nullable;
import slackauth.domain.auth.AuthProperties;
import slackauth.domain.encryption.Encryptor;
import slackauth.domain.exceptions.InvalidState;
import slackauth.domain.json.JsonDeserializer;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Objects;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkState;

/**
 * Serializes the property map to JSON, encrypts it, and appends an HMAC-SHA256 of the ciphertext.
 * The state looks like {@code <ciphertext>.<tag>}. The tag is checked before anything is decrypted,
 * since the cipher alone does not detect modified bytes.
 * <p>
 * The MAC key is derived from slackauth.encryption.password.
 */
@ApplicationScoped
public class EncryptedStateProtector implements StateProtector {
    private static final char TAG_SEPARATOR = '.';
    private static final String KEY_CONTEXT = "slackauth.state.mac|";
    private static final BaseEncoding TAG_ENCODING = BaseEncoding.base64Url().omitPadding();

    @Inject
    private Encryptor encryptor;

    @Inject
    private JsonDeserializer jsonDeserializer;

    @Inject
    @ConfigProperty(name = "slackauth.encryption.password")
    private Optional<String> password;

    private final Lazy<HashFunction> mac = Lazy.of(this::buildMac);

    @Override
    public String protect(final AuthProperties properties) {
        return seal(encryptor.encrypt(jsonDeserializer.serialize(properties.getItems())));
    }

    @Override
    public AuthProperties unprotect(@Nullable final String state) {
        if (StringUtils.isBlank(state)) {
            throw new InvalidState("The state parameter was missing");
        }

        final String cipherText = open(state);

        return Try.of(() -> encryptor.decrypt(cipherText))
                .map(json -> jsonDeserializer.deserializeMap(json, String.class, String.class))
                .filter(Objects::nonNull)
                .map(AuthProperties::new)
                .getOrElseThrow(ex -> new InvalidState("The state parameter could not be read", ex));
    }

    String seal(final String cipherText) {
        return cipherText + TAG_SEPARATOR + TAG_ENCODING.encode(tag(cipherText));
    }

    /**
     * Returns the ciphertext of a sealed state, or throws {@link InvalidState} if the tag does not match.
     */
    private String open(final String state) {
        final int separator = state.lastIndexOf(TAG_SEPARATOR);
        if (separator <= 0) {
            throw new InvalidState("The state parameter was not signed");
        }

        final String cipherText = state.substring(0, separator);
        final byte[] supplied = Try.of(() -> TAG_ENCODING.decode(state.substring(separator + 1)))
                .getOrElseThrow(ex -> new InvalidState("The state signature was malformed", ex));

        if (!MessageDigest.isEqual(tag(cipherText), supplied)) {
            throw new InvalidState("The state parameter could not be verified");
        }

        return cipherText;
    }

    private byte[] tag(final String cipherText) {
        return mac.get().hashString(cipherText, StandardCharsets.UTF_8).asBytes();
    }

    private HashFunction buildMac() {
        final String configured = password.filter(StringUtils::isNotBlank).orElse(null);
        checkState(configured != null, "slackauth.encryption.password must be set");

        final byte[] key = Hashing.sha256()
                .hashString(KEY_CONTEXT + configured, StandardCharsets.UTF_8)
                .asBytes();
        return Hashing.hmacSha256(key);
    }
}
