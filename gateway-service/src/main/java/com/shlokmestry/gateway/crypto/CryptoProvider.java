package com.shlokmestry.gateway.crypto;

/**
 * The cryptographic primitives the gateway needs, behind one seam so that callers do not
 * care whether they run on an instance that can do adaptive hashing itself or on one that
 * has to ask another instance for it.
 */
public interface CryptoProvider {

    /**
     * Returns a fresh, unpredictable token suitable for a content-security-policy nonce.
     * The value only contains base64 characters, so it can be placed inside a
     * {@code 'nonce-...'} source expression as is.
     */
    String generateNonce();

    /**
     * HMAC-SHA256 of {@code data} under {@code secret}, lower-case hex encoded.
     */
    String hmacSha256Hex(String secret, byte[] data);

    /**
     * Equality check whose running time does not depend on where the inputs differ.
     * {@code null} never equals anything.
     */
    boolean constantTimeEquals(String expected, String actual);

    /**
     * Salted adaptive (bcrypt) hash of {@code rawPassword}.
     *
     * @throws CryptoUnavailableException if the hash cannot be produced
     */
    String hashPassword(String rawPassword);

    /**
     * Whether {@code rawPassword} matches the adaptive {@code passwordHash}. Malformed
     * hashes and unavailable primitives both yield {@code false}.
     */
    boolean matchesPassword(String rawPassword, String passwordHash);
}
