package tech.foundry.oauth.token;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.foundry.oauth.test.TestFixtures;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Base64;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

class JwtTokenSignerTest {

    private static final String ISSUER = "https://auth.example.com";

    private final JwtTokenSigner signer = new JwtTokenSigner(TestFixtures.KEYS, ISSUER);

    private static AccessTokenClaims claims(String subject, List<String> scopes, Instant issuedAt) {
        return new AccessTokenClaims("atk_0ABCDEF123456", ISSUER, subject, "oac_CLIENT000001", scopes,
            issuedAt, issuedAt.plus(Duration.ofHours(1)));
    }

    private static Instant now() {
        return Instant.now().truncatedTo(ChronoUnit.SECONDS);
    }

    @Test
    @DisplayName("verify should return the claims that were signed")
    void verify_shouldReturnSignedClaims() {
        // Arrange
        AccessTokenClaims original = claims("usr_alice", List.of("read", "write"), now());

        // Act
        Optional<AccessTokenClaims> verified = signer.verify(signer.sign(original));

        // Assert
        assertThat(verified).contains(original);
    }

    @Test
    @DisplayName("sign should omit sub for client-only tokens")
    void sign_shouldOmitSubject_whenNoResourceOwner() {
        String token = signer.sign(claims(null, List.of("read"), now()));

        String payload = new String(Base64.getUrlDecoder().decode(token.split("\\.")[1]), StandardCharsets.UTF_8);
        assertThat(payload).doesNotContain("\"sub\"").contains("\"client_id\":\"oac_CLIENT000001\"");
        assertThat(signer.verify(token)).hasValueSatisfying(verified -> assertThat(verified.subject()).isNull());
    }

    @Test
    @DisplayName("sign should carry the key id and RS256 in the header")
    void sign_shouldSetKeyIdHeader() {
        String token = signer.sign(claims("usr_alice", List.of(), now()));

        String header = new String(Base64.getUrlDecoder().decode(token.split("\\.")[0]), StandardCharsets.UTF_8);
        assertThat(header).contains("\"kid\":\"" + TestFixtures.KEYS.getKeyId() + "\"").contains("RS256");
        assertThat(signer.verify(token)).hasValueSatisfying(verified -> assertThat(verified.scopes()).isEmpty());
    }

    @Test
    @DisplayName("verify should reject tokens signed with another key")
    void verify_shouldRejectForeignSignature() {
        JwtTokenSigner foreign = new JwtTokenSigner(JwtKeyService.generate(), ISSUER);

        assertThat(signer.verify(foreign.sign(claims("usr_alice", List.of("read"), now())))).isEmpty();
    }

    @Test
    @DisplayName("verify should reject tokens from another issuer")
    void verify_shouldRejectOtherIssuer() {
        JwtTokenSigner other = new JwtTokenSigner(TestFixtures.KEYS, "https://other.example.com");
        AccessTokenClaims foreignClaims = new AccessTokenClaims("atk_0ABCDEF123456", "https://other.example.com",
            "usr_alice", "oac_CLIENT000001", List.of(), now(), now().plus(Duration.ofHours(1)));

        assertThat(signer.verify(other.sign(foreignClaims))).isEmpty();
    }

    @Test
    @DisplayName("verify should reject tampered and malformed tokens")
    void verify_shouldRejectInvalidTokens() {
        String valid = signer.sign(claims("usr_alice", List.of("read"), now()));
        String tampered = valid.substring(0, valid.length() - 4) + (valid.endsWith("AAAA") ? "BBBB" : "AAAA");

        assertThat(signer.verify(tampered)).isEmpty();
        assertThat(signer.verify("not.a.jwt")).isEmpty();
        assertThat(signer.verify("")).isEmpty();
        assertThat(signer.verify(null)).isEmpty();
    }

    @Test
    @DisplayName("verify should leave expiry to the caller's clock")
    void verify_shouldNotApplyWallClock_whenTokenExpiredOrFromTheFuture() {
        // Arrange: one token expired hours ago, one issued days ahead of wall time
        String expired = signer.sign(claims("usr_alice", List.of("read"), now().minus(Duration.ofHours(3))));
        Instant ahead = now().plus(Duration.ofDays(3));
        String future = signer.sign(claims("usr_alice", List.of("read"), ahead));

        // Act & Assert
        assertThat(signer.verify(expired))
            .hasValueSatisfying(verified -> assertThat(verified.isExpired(now())).isTrue());
        assertThat(signer.verify(future))
            .hasValueSatisfying(verified -> assertThat(verified.issuedAt()).isEqualTo(ahead));
    }
}
