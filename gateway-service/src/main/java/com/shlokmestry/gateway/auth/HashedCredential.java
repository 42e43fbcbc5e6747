package com.shlokmestry.gateway.auth;

import java.util.regex.Pattern;

import com.shlokmestry.gateway.crypto.CryptoProvider;

public record HashedCredential(String hash) implements AdminCredential {

    private static final Pattern BCRYPT = Pattern.compile("^\\$2[abxy]?\\$\\d{2}\\$[./A-Za-z0-9]{53}$");

    public static boolean isWellFormed(String hash) {
        return hash != null && BCRYPT.matcher(hash).matches();
    }

    @Override
    public boolean matches(String candidate, CryptoProvider crypto) {
        return crypto.matchesPassword(candidate, hash);
    }

    @Override
    public String mode() {
        return "hash";
    }

    @Override
    public String toString() {
        return "HashedCredential[hash=" + hash.substring(0, 7) + "...]";
    }
}
