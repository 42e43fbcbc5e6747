package com.shlokmestry.gateway.crypto;

/**
 * Wire contract between a {@link DelegatingCryptoProvider} and the full-featured instance
 * it delegates password hashing to. Request bodies are signed with the shared form secret
 * and carried in the signature header.
 */
public final class CryptoDelegation {

    public static final String BASE_PATH = "/internal/crypto";
    public static final String PASSWORD_MATCH_PATH = BASE_PATH + "/password-match";
    public static final String PASSWORD_HASH_PATH = BASE_PATH + "/password-hash";

    private CryptoDelegation() {
    }

    public record PasswordMatchRequest(String password, String hash) {}

    public record PasswordMatchResponse(boolean matches) {}

    public record PasswordHashRequest(String password) {}

    public record PasswordHashResponse(String hash) {}
}
