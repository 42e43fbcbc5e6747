package com.shlokmestry.gateway.auth;

import com.shlokmestry.gateway.crypto.CryptoProvider;

/**
 * Bootstrap fallback until a hash is configured. Compared in constant time.
 */
public record PlaintextCredential(String password) implements AdminCredential {

    @Override
    public boolean matches(String candidate, CryptoProvider crypto) {
        return crypto.constantTimeEquals(password, candidate);
    }

    @Override
    public String mode() {
        return "plaintext";
    }

    @Override
    public String toString() {
        return "PlaintextCredential[****]";
    }
}
