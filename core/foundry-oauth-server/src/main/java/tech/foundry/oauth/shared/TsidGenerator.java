package tech.foundry.oauth.shared;

import com.github.f4b6a3.tsid.TsidCreator;

import java.util.Objects;

/**
 * Centralized TSID generation for clients, codes and tokens.
 *
 * IDs are typed with a 3-character prefix: "{prefix}_{tsid}" (e.g., "atk_0HZXEQ5Y8JY5Z").
 * They are time-sortable, URL-safe and safe to log. They are never secrets:
 * token values are generated separately by {@link tech.foundry.oauth.crypto.TokenCodec}.
 */
public final class TsidGenerator {

    /**
     * Separator between prefix and TSID.
     */
    public static final String SEPARATOR = "_";

    /**
     * Generate a new typed ID for the given entity type.
     *
     * @param type the entity type
     * @return the ID with prefix (e.g., "oac_0HZXEQ5Y8JY5Z")
     */
    public static String generate(EntityType type) {
        Objects.requireNonNull(type, "EntityType must not be null");
        return type.prefix() + SEPARATOR + TsidCreator.getTsid().toString();
    }

    /**
     * Extract the prefix from a typed ID.
     *
     * @param typedId the typed ID (e.g., "oac_0HZXEQ5Y8JY5Z")
     * @return the entity type, or null when the prefix is unknown
     * @throws IllegalArgumentException if the ID format is invalid
     */
    public static EntityType typeOf(String typedId) {
        if (typedId == null || typedId.isBlank()) {
            throw new IllegalArgumentException("Typed ID cannot be null or blank");
        }
        int separatorIndex = typedId.indexOf(SEPARATOR);
        if (separatorIndex == -1) {
            throw new IllegalArgumentException("Invalid typed ID format: missing separator");
        }
        return EntityType.fromPrefix(typedId.substring(0, separatorIndex));
    }

    private TsidGenerator() {
        // Utility class
    }
}
