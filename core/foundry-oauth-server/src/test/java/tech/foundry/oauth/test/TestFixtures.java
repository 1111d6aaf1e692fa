package tech.foundry.oauth.test;

import tech.foundry.oauth.config.AuthorizationServerSettings;
import tech.foundry.oauth.token.JwtKeyService;

/**
 * Shared, expensive test fixtures.
 */
public final class TestFixtures {

    /**
     * One RSA key pair for the whole test run; generating 2048-bit keys per test is slow.
     */
    public static final JwtKeyService KEYS = JwtKeyService.generate();

    /**
     * Cheapest Argon2id parameters the library accepts. Production costs make tests crawl.
     */
    public static final AuthorizationServerSettings.SecretHashing FAST_HASHING =
        new AuthorizationServerSettings.SecretHashing(1024, 1, 1);

    public static AuthorizationServerSettings.Builder settings() {
        return AuthorizationServerSettings.builder().secretHashing(FAST_HASHING);
    }

    private TestFixtures() {
    }
}
