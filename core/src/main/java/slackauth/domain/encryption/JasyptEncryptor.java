package slackauth.domain.encryption;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jasypt.util.text.StrongTextEncryptor;

import java.util.Optional;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

/**
 * Password based encryption with a random salt, so the same state never encrypts to the same string twice.
 * Every node that handles callbacks must share slackauth.encryption.password.
 */
@ApplicationScoped
public class JasyptEncryptor implements Encryptor {
    private final StrongTextEncryptor textEncryptor = new StrongTextEncryptor();

    @Inject
    @ConfigProperty(name = "slackauth.encryption.password")
    private Optional<String> password;

    @PostConstruct
    public void construct() {
        final String configured = password.filter(value -> !value.isBlank()).orElse(null);
        checkState(configured != null, "slackauth.encryption.password must be set");
        textEncryptor.setPassword(configured);
    }

    @Override
    public String encrypt(final String plainText) {
        checkNotNull(plainText);
        return textEncryptor.encrypt(plainText);
    }

    @Override
    public String decrypt(final String encryptedText) {
        checkNotNull(encryptedText);
        return textEncryptor.decrypt(encryptedText);
    }
}
