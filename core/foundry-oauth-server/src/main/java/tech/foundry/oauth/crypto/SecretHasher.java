package tech.foundry.oauth.crypto;

import de.mkammerer.argon2.Argon2;
import de.mkammerer.argon2.Argon2Factory;
import org.jboss.logging.Logger;
import tech.foundry.oauth.config.AuthorizationServerSettings.SecretHashing;

/**
 * Hashes and verifies client secrets with Argon2id.
 *
 * Hashes are PHC strings ({@code $argon2id$v=19$m=65536,t=3,p=4$<salt>$<hash>}) so the
 * parameters travel with the hash and {@link #needsRehash(String)} can detect stale ones.
 */
public class SecretHasher {

    private static final Logger LOG = Logger.getLogger(SecretHasher.class);

    private static final int HASH_LENGTH = 32;     // Output length in bytes
    private static final int SALT_LENGTH = 16;     // Salt length in bytes

    private final Argon2 argon2;
    private final SecretHashing parameters;

    public SecretHasher(SecretHashing parameters) {
        this.parameters = parameters;
        this.argon2 = Argon2Factory.create(
            Argon2Factory.Argon2Types.ARGON2id,
            SALT_LENGTH,
            HASH_LENGTH
        );
    }

    /**
     * Hash a secret using Argon2id.
     *
     * @param secret the plain text secret
     * @return the hash in PHC format
     */
    public String hash(String secret) {
        if (secret == null || secret.isEmpty()) {
            throw new IllegalArgumentException("Secret cannot be null or empty");
        }
        char[] chars = secret.toCharArray();
        try {
            return argon2.hash(parameters.iterations(), parameters.memoryKib(), parameters.parallelism(), chars);
        } finally {
            argon2.wipeArray(chars);
        }
    }

    /**
     * Verify a secret against a PHC hash. The comparison inside Argon2 is constant-time.
     *
     * @return true if the secret matches; false on mismatch or on an unreadable hash
     */
    public boolean verify(String secret, String hash) {
        if (secret == null || hash == null) {
            return false;
        }
        char[] chars = secret.toCharArray();
        try {
            return argon2.verify(hash, chars);
        } catch (RuntimeException e) {
            LOG.debugf("Secret hash could not be verified: %s", e.getMessage());
            return false;
        } finally {
            argon2.wipeArray(chars);
        }
    }

    /**
     * Check if a hash was produced with other parameters than the current ones.
     */
    public boolean needsRehash(String hash) {
        if (hash == null || !hash.startsWith("$argon2id$")) {
            return true;
        }
        // $argon2id$v=19$m=65536,t=3,p=4$<salt>$<hash>
        String[] parts = hash.split("\\$");
        if (parts.length < 4) {
            return true;
        }
        String expected = "m=" + parameters.memoryKib() + ",t=" + parameters.iterations() + ",p=" + parameters.parallelism();
        return !expected.equals(parts[3]);
    }
}
