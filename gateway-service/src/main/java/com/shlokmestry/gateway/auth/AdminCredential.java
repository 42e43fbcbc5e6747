package com.shlokmestry.gateway.auth;

import com.shlokmestry.gateway.crypto.CryptoProvider;

/**
 * The configured admin secret, in exactly one of two forms. Callers only ever ask
 * {@link #matches}; they never branch on the form.
 */
public sealed interface AdminCredential permits HashedCredential, PlaintextCredential {

    boolean matches(String candidate, CryptoProvider crypto);

    /**
     * {@code "hash"} or {@code "plaintext"}, for diagnostics.
     */
    String mode();
}
