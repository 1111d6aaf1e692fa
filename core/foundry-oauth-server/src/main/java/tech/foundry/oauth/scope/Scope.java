package tech.foundry.oauth.scope;

/**
 * A named permission unit a token can carry.
 *
 * @param id          the scope string as it appears on the wire (e.g., "users:read")
 * @param description human readable description, shown on consent screens
 * @param dangerous   whether the scope warrants elevated consent; callers enforce what that means
 */
public record Scope(String id, String description, boolean dangerous) {

    public Scope {
        if (id == null || id.isBlank() || id.chars().anyMatch(Character::isWhitespace)) {
            throw new IllegalArgumentException("Scope id must be non-blank and contain no whitespace");
        }
    }

    public static Scope of(String id, String description) {
        return new Scope(id, description, false);
    }

    public static Scope dangerous(String id, String description) {
        return new Scope(id, description, true);
    }
}
