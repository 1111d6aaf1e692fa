package tech.foundry.oauth.token;

import java.util.Optional;

/**
 * Capability for self-contained access tokens: sign claims and verify a presented token
 * without a storage lookup.
 */
public interface TokenSigner {

    String sign(AccessTokenClaims claims);

    /**
     * Verify signature and issuer and return the claims.
     *
     * Expiry is NOT authoritative here; callers check {@link AccessTokenClaims#isExpired}
     * against the server clock.
     *
     * @return the claims, or empty when the token is malformed, forged or from another issuer
     */
    Optional<AccessTokenClaims> verify(String token);
}
