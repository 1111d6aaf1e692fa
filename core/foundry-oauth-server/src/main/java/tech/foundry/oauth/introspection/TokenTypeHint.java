package tech.foundry.oauth.introspection;

/**
 * Values of the {@code token_type_hint} parameter (RFC 7009 section 2.1, RFC 7662 section 2.1).
 *
 * The hint only decides which lookup runs first; an unknown or wrong hint never fails a request.
 */
public enum TokenTypeHint {

    ACCESS_TOKEN("access_token"),
    REFRESH_TOKEN("refresh_token"),
    PERSONAL_ACCESS_TOKEN("personal_access_token");

    private final String value;

    TokenTypeHint(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * @return the hint, or null for an absent or unrecognised value
     */
    public static TokenTypeHint fromValue(String value) {
        for (TokenTypeHint hint : values()) {
            if (hint.value.equals(value)) {
                return hint;
            }
        }
        return null;
    }
}
