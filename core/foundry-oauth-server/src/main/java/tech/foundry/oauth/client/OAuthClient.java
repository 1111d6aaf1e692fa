package tech.foundry.oauth.client;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * OAuth2 client registration.
 *
 * A client is never hard-deleted. Revocation is soft so the audit trail of the
 * tokens it was issued stays intact.
 */
public class OAuthClient {

    /**
     * Redaction marker replacing the secret hash on every copy that leaves the registry.
     */
    public static final String REDACTED = "***REDACTED***";

    /**
     * Public client identifier used in OAuth flows (TSID, "oac_" prefix).
     */
    public String clientId;

    /**
     * Human-readable name shown on consent screens.
     */
    public String name;

    public ClientType clientType = ClientType.PUBLIC;

    /**
     * Argon2id hash of the client secret. Always null for public clients.
     */
    public String secretHash;

    /**
     * Redirect URIs, matched exactly.
     */
    public List<String> redirectUris = new ArrayList<>();

    public Set<GrantType> grantTypes = EnumSet.noneOf(GrantType.class);

    /**
     * Scopes this client may request. "*" allows every registered scope.
     */
    public List<String> allowedScopes = new ArrayList<>();

    /**
     * Require PKCE for this client even when it is confidential.
     */
    public boolean pkceRequired;

    public boolean revoked;

    public Instant revokedAt;

    public Instant createdAt;

    public Instant updatedAt;

    public boolean isPublic() {
        return clientType == ClientType.PUBLIC;
    }

    public boolean isConfidential() {
        return clientType == ClientType.CONFIDENTIAL;
    }

    public boolean isRedirectUriAllowed(String redirectUri) {
        return redirectUri != null && redirectUris.contains(redirectUri);
    }

    public boolean isGrantTypeAllowed(GrantType grantType) {
        return grantType != null && grantTypes.contains(grantType);
    }

    /**
     * Deep copy, used by stores to keep their state out of callers' hands.
     */
    public OAuthClient copy() {
        OAuthClient copy = new OAuthClient();
        copy.clientId = clientId;
        copy.name = name;
        copy.clientType = clientType;
        copy.secretHash = secretHash;
        copy.redirectUris = new ArrayList<>(redirectUris);
        copy.grantTypes = grantTypes.isEmpty() ? EnumSet.noneOf(GrantType.class) : EnumSet.copyOf(grantTypes);
        copy.allowedScopes = new ArrayList<>(allowedScopes);
        copy.pkceRequired = pkceRequired;
        copy.revoked = revoked;
        copy.revokedAt = revokedAt;
        copy.createdAt = createdAt;
        copy.updatedAt = updatedAt;
        return copy;
    }

    /**
     * Copy with the secret hash replaced by {@link #REDACTED}.
     */
    public OAuthClient redacted() {
        OAuthClient copy = copy();
        if (copy.secretHash != null) {
            copy.secretHash = REDACTED;
        }
        return copy;
    }
}
