package tech.foundry.oauth.crypto;

import java.util.Optional;

/**
 * PKCE code challenge transformations (RFC 7636 section 4.2).
 */
public enum CodeChallengeMethod {

    PLAIN("plain"),
    S256("S256");

    private final String value;

    CodeChallengeMethod(String value) {
        this.value = value;
    }

    /**
     * The wire value of {@code code_challenge_method}.
     */
    public String value() {
        return value;
    }

    /**
     * Parse a wire value. Matching is exact, as the RFC defines the values case-sensitively.
     */
    public static Optional<CodeChallengeMethod> fromValue(String value) {
        for (CodeChallengeMethod method : values()) {
            if (method.value.equals(value)) {
                return Optional.of(method);
            }
        }
        return Optional.empty();
    }
}
