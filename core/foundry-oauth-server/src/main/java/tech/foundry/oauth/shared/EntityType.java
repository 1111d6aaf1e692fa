package tech.foundry.oauth.shared;

import java.util.HashMap;
import java.util.Map;

/**
 * Entity types issued by the authorization server with their 3-character ID prefixes.
 *
 * IDs are stored WITH the prefix:
 * - Format: "{prefix}_{tsid}" (e.g., "oac_0HZXEQ5Y8JY5Z")
 * - Total length: 17 characters (3-char prefix + underscore + 13-char TSID)
 *
 * Usage:
 * <pre>
 * String id = TsidGenerator.generate(EntityType.OAUTH_CLIENT);  // "oac_0HZXEQ5Y8JY5Z"
 * </pre>
 */
public enum EntityType {

    // Clients
    OAUTH_CLIENT("oac"),

    // Grants
    AUTH_CODE("acd"),
    TOKEN_FAMILY("tfm"),

    // Tokens
    ACCESS_TOKEN("atk"),
    REFRESH_TOKEN("rtk"),
    PERSONAL_ACCESS_TOKEN("pat");

    private final String prefix;

    private static final Map<String, EntityType> BY_PREFIX = new HashMap<>();

    static {
        for (EntityType type : values()) {
            BY_PREFIX.put(type.prefix, type);
        }
    }

    EntityType(String prefix) {
        this.prefix = prefix;
    }

    /**
     * Get the 3-character prefix for this entity type.
     */
    public String prefix() {
        return prefix;
    }

    /**
     * Look up an entity type by its prefix.
     *
     * @param prefix the 3-character prefix
     * @return the entity type, or null if not found
     */
    public static EntityType fromPrefix(String prefix) {
        return BY_PREFIX.get(prefix);
    }
}
