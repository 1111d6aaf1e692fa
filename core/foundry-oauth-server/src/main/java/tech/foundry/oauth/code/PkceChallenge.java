package tech.foundry.oauth.code;

/**
 * PKCE parameters of an authorization request, as received.
 *
 * @param method raw {@code code_challenge_method}; null means "plain" (RFC 7636 section 4.3)
 */
public record PkceChallenge(String challenge, String method) {

    public static PkceChallenge s256(String challenge) {
        return new PkceChallenge(challenge, "S256");
    }

    public static PkceChallenge plain(String challenge) {
        return new PkceChallenge(challenge, "plain");
    }
}
