package tech.foundry.oauth.token;

import jakarta.json.Json;
import jakarta.json.JsonObject;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.security.interfaces.RSAPrivateKey;
import java.security.interfaces.RSAPublicKey;
import java.security.spec.PKCS8EncodedKeySpec;
import java.security.spec.X509EncodedKeySpec;
import java.util.Base64;

/**
 * Holds the RSA key pair access tokens are signed with.
 *
 * Supports two modes:
 * 1. File-based keys (production) - loads PEM keys from configured paths
 * 2. Ephemeral keys (development, tests) - generates a key pair in memory
 *
 * Provides the JWKS (JSON Web Key Set) resource servers use to verify tokens.
 */
public class JwtKeyService {

    private static final Logger LOG = Logger.getLogger(JwtKeyService.class);
    public static final String ALGORITHM = "RS256";
    private static final int KEY_SIZE = 2048;

    private final RSAPrivateKey privateKey;
    private final RSAPublicKey publicKey;
    private final String keyId;

    public JwtKeyService(RSAPrivateKey privateKey, RSAPublicKey publicKey) {
        this.privateKey = privateKey;
        this.publicKey = publicKey;
        // Stable key ID based on the public key
        this.keyId = generateKeyId(publicKey);
        LOG.infof("JWT key service initialized with key ID: %s", keyId);
    }

    /**
     * Load a key pair from PKCS#8 (private) and X.509 (public) PEM files.
     */
    public static JwtKeyService fromPemFiles(Path privateKeyFile, Path publicKeyFile) {
        LOG.infof("Loading JWT keys from %s and %s", privateKeyFile, publicKeyFile);
        try {
            byte[] privateKeyBytes = parsePemKey(Files.readString(privateKeyFile, StandardCharsets.US_ASCII), "PRIVATE KEY");
            byte[] publicKeyBytes = parsePemKey(Files.readString(publicKeyFile, StandardCharsets.US_ASCII), "PUBLIC KEY");

            KeyFactory keyFactory = KeyFactory.getInstance("RSA");
            return new JwtKeyService(
                (RSAPrivateKey) keyFactory.generatePrivate(new PKCS8EncodedKeySpec(privateKeyBytes)),
                (RSAPublicKey) keyFactory.generatePublic(new X509EncodedKeySpec(publicKeyBytes)));
        } catch (IOException | GeneralSecurityException | IllegalArgumentException e) {
            throw new IllegalStateException("Failed to load JWT keys", e);
        }
    }

    /**
     * Generate an in-memory key pair. Tokens signed with it do not survive a restart.
     */
    public static JwtKeyService generate() {
        try {
            KeyPairGenerator keyGen = KeyPairGenerator.getInstance("RSA");
            keyGen.initialize(KEY_SIZE, new SecureRandom());
            KeyPair keyPair = keyGen.generateKeyPair();
            return new JwtKeyService((RSAPrivateKey) keyPair.getPrivate(), (RSAPublicKey) keyPair.getPublic());
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("RSA not available", e);
        }
    }

    private static byte[] parsePemKey(String pem, String type) {
        String base64 = pem
                .replace("-----BEGIN " + type + "-----", "")
                .replace("-----END " + type + "-----", "")
                .replaceAll("\\s", "");
        return Base64.getDecoder().decode(base64);
    }

    private static String generateKeyId(RSAPublicKey key) {
        try {
            byte[] hash = MessageDigest.getInstance("SHA-256").digest(key.getEncoded());
            return Base64.getUrlEncoder().withoutPadding().encodeToString(hash).substring(0, 8);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public RSAPrivateKey getPrivateKey() {
        return privateKey;
    }

    public RSAPublicKey getPublicKey() {
        return publicKey;
    }

    public String getKeyId() {
        return keyId;
    }

    /**
     * Get the JWKS (JSON Web Key Set) containing the public key.
     */
    public JsonObject getJwks() {
        return Json.createObjectBuilder()
                .add("keys", Json.createArrayBuilder().add(getJwk()))
                .build();
    }

    /**
     * Get the JWK (JSON Web Key) for the current public key.
     */
    public JsonObject getJwk() {
        return Json.createObjectBuilder()
                .add("kty", "RSA")
                .add("alg", ALGORITHM)
                .add("use", "sig")
                .add("kid", keyId)
                .add("n", base64UrlUnsigned(publicKey.getModulus().toByteArray()))
                .add("e", base64UrlUnsigned(publicKey.getPublicExponent().toByteArray()))
                .build();
    }

    // Remove leading zero byte if present (BigInteger sign bit)
    private static String base64UrlUnsigned(byte[] bytes) {
        if (bytes.length > 1 && bytes[0] == 0) {
            byte[] tmp = new byte[bytes.length - 1];
            System.arraycopy(bytes, 1, tmp, 0, tmp.length);
            bytes = tmp;
        }
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}
