package slackauth.domain.encryption;

/**
 * Symmetric encryption of the values the browser carries for us: the OAuth state and the session.
 */
public interface Encryptor {
    String encrypt(String plainText);

    /**
     * @throws RuntimeException if the text was not produced by {@link #encrypt} with the same password
     */
    String decrypt(String encryptedText);
}
