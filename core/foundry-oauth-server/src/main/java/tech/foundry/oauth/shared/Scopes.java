package tech.foundry.oauth.shared;

import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Conversions between the space-delimited wire form of a scope parameter and scope lists.
 */
public final class Scopes {

    public static final String WILDCARD = "*";

    /**
     * Parse a space-delimited scope string. Blank input yields an empty list, duplicates are dropped,
     * order of first appearance is kept.
     */
    public static List<String> parse(String scope) {
        if (scope == null || scope.isBlank()) {
            return List.of();
        }
        return List.copyOf(new LinkedHashSet<>(Arrays.asList(scope.trim().split("\\s+"))));
    }

    /**
     * Join scopes into the space-delimited wire form, or null when there are none.
     */
    public static String join(Collection<String> scopes) {
        if (scopes == null || scopes.isEmpty()) {
            return null;
        }
        return String.join(" ", scopes);
    }

    /**
     * De-duplicated immutable copy of a scope collection, in first-seen order.
     */
    public static List<String> normalize(Collection<String> scopes) {
        if (scopes == null || scopes.isEmpty()) {
            return List.of();
        }
        return List.copyOf(new LinkedHashSet<>(scopes));
    }

    private Scopes() {
    }
}
