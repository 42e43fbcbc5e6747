package com.shlokmestry.gateway.crypto;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.HexFormat;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;

/**
 * Full-featured provider: JCA for randomness, HMAC and digests, bcrypt from
 * spring-security-crypto for password hashing.
 */
public class JcaCryptoProvider implements CryptoProvider {

    public static final int DEFAULT_BCRYPT_STRENGTH = 12;

    private static final String HMAC_ALGORITHM = "HmacSHA256";
    private static final int NONCE_BYTES = 16;

    private final SecureRandom random;
    private final BCryptPasswordEncoder passwordEncoder;

    public JcaCryptoProvider() {
        this(DEFAULT_BCRYPT_STRENGTH);
    }

    public JcaCryptoProvider(int bcryptStrength) {
        this.random = new SecureRandom();
        this.passwordEncoder = new BCryptPasswordEncoder(bcryptStrength, random);
    }

    @Override
    public String generateNonce() {
        byte[] bytes = new byte[NONCE_BYTES];
        random.nextBytes(bytes);
        return Base64.getEncoder().withoutPadding().encodeToString(bytes);
    }

    @Override
    public String hmacSha256Hex(String secret, byte[] data) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM));
            return HexFormat.of().formatHex(mac.doFinal(data));
        } catch (GeneralSecurityException e) {
            throw new CryptoUnavailableException(HMAC_ALGORITHM + " unavailable", e);
        }
    }

    @Override
    public boolean constantTimeEquals(String expected, String actual) {
        if (expected == null || actual == null) {
            return false;
        }
        // Digest first so the comparison does not leak the length of the expected value either.
        return MessageDigest.isEqual(sha256(expected), sha256(actual));
    }

    @Override
    public String hashPassword(String rawPassword) {
        if (rawPassword == null) {
            throw new CryptoUnavailableException("password must not be null");
        }
        return passwordEncoder.encode(rawPassword);
    }

    @Override
    public boolean matchesPassword(String rawPassword, String passwordHash) {
        if (rawPassword == null || passwordHash == null || passwordHash.isBlank()) {
            return false;
        }
        try {
            return passwordEncoder.matches(rawPassword, passwordHash);
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    private static byte[] sha256(String value) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(value.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            throw new CryptoUnavailableException("SHA-256 unavailable", e);
        }
    }
}
