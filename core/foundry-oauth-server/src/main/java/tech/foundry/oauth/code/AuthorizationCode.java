package tech.foundry.oauth.code;

import tech.foundry.oauth.crypto.CodeChallengeMethod;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * OAuth2 authorization code.
 *
 * Codes are short-lived (10 minutes by default) and single-use. Only the hash of the
 * code is stored. The record id doubles as the token family of every token minted
 * from the code.
 */
public class AuthorizationCode {

    /**
     * Record id (TSID, "acd_" prefix). Not the code value.
     */
    public String id;

    /**
     * SHA-256 hash of the code value (base64url).
     */
    public String codeHash;

    public String clientId;

    /**
     * Authenticated resource owner the code was issued for.
     */
    public String subject;

    /**
     * Redirect URI bound at issuance. The exchange must present the same value.
     */
    public String redirectUri;

    public List<String> scopes = new ArrayList<>();

    /**
     * PKCE code challenge, null when the authorization request carried none.
     */
    public String codeChallenge;

    public CodeChallengeMethod codeChallengeMethod;

    public Instant createdAt;

    public Instant expiresAt;

    public boolean consumed;

    public Instant consumedAt;

    public AuthorizationCodeState state(Instant now) {
        if (consumed) {
            return AuthorizationCodeState.CONSUMED;
        }
        return isExpired(now) ? AuthorizationCodeState.EXPIRED : AuthorizationCodeState.ISSUED;
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    public boolean hasCodeChallenge() {
        return codeChallenge != null;
    }

    public AuthorizationCode copy() {
        AuthorizationCode copy = new AuthorizationCode();
        copy.id = id;
        copy.codeHash = codeHash;
        copy.clientId = clientId;
        copy.subject = subject;
        copy.redirectUri = redirectUri;
        copy.scopes = new ArrayList<>(scopes);
        copy.codeChallenge = codeChallenge;
        copy.codeChallengeMethod = codeChallengeMethod;
        copy.createdAt = createdAt;
        copy.expiresAt = expiresAt;
        copy.consumed = consumed;
        copy.consumedAt = consumedAt;
        return copy;
    }
}
