package tech.foundry.oauth.crypto;

import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.regex.Pattern;

/**
 * PKCE (Proof Key for Code Exchange) implementation.
 *
 * PKCE protects the authorization code flow against interception attacks,
 * especially important for public clients (SPAs, mobile apps) that cannot
 * securely store a client secret.
 *
 * Flow:
 * 1. Client generates random code_verifier
 * 2. Client computes code_challenge = BASE64URL(SHA256(code_verifier))
 * 3. Client sends code_challenge in authorization request
 * 4. Server stores code_challenge with authorization code
 * 5. Client sends code_verifier in token request
 * 6. Server verifies the transformed code_verifier equals the stored code_challenge
 *
 * @see <a href="https://datatracker.ietf.org/doc/html/rfc7636">RFC 7636 - PKCE</a>
 */
public class PkceService {

    private static final SecureRandom SECURE_RANDOM = new SecureRandom();

    // Unreserved URI characters, 43-128 long (RFC 7636 section 4.1)
    private static final Pattern VERIFIER_PATTERN = Pattern.compile("^[A-Za-z0-9\\-._~]{43,128}$");

    /**
     * Generate a cryptographically random code verifier.
     *
     * We generate 48 random bytes which encode to 64 base64url characters.
     */
    public String generateCodeVerifier() {
        byte[] bytes = new byte[48];
        SECURE_RANDOM.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    /**
     * Generate a code challenge from a verifier using the S256 method.
     *
     * @param codeVerifier the code verifier to hash
     * @return BASE64URL(SHA256(ASCII(code_verifier)))
     */
    public String generateCodeChallenge(String codeVerifier) {
        byte[] hash = TokenCodec.sha256(codeVerifier.getBytes(StandardCharsets.US_ASCII));
        return Base64.getUrlEncoder().withoutPadding().encodeToString(hash);
    }

    /**
     * Verify that a code verifier matches the stored code challenge.
     *
     * @param codeVerifier  the verifier provided in the token request
     * @param codeChallenge the challenge stored with the authorization code
     * @param method        the method bound at issuance
     * @return true if the verifier matches the challenge
     */
    public boolean verifyCodeChallenge(String codeVerifier, String codeChallenge, CodeChallengeMethod method) {
        if (codeVerifier == null || codeChallenge == null || method == null) {
            return false;
        }
        String transformed = switch (method) {
            case S256 -> generateCodeChallenge(codeVerifier);
            case PLAIN -> codeVerifier;
        };
        return TokenCodec.constantTimeEquals(transformed, codeChallenge);
    }

    /**
     * Validate code challenge format. An S256 challenge is always 43 characters
     * (32 bytes base64url encoded); a plain challenge follows the verifier rules.
     */
    public boolean isValidCodeChallenge(String codeChallenge, CodeChallengeMethod method) {
        if (codeChallenge == null || method == null) {
            return false;
        }
        if (method == CodeChallengeMethod.S256 && codeChallenge.length() != 43) {
            return false;
        }
        return VERIFIER_PATTERN.matcher(codeChallenge).matches();
    }

    /**
     * Validate code verifier format.
     */
    public boolean isValidCodeVerifier(String codeVerifier) {
        return codeVerifier != null && VERIFIER_PATTERN.matcher(codeVerifier).matches();
    }
}
