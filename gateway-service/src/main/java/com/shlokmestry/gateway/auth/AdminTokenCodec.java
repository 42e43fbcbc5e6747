package com.shlokmestry.gateway.auth;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Base64;
import java.util.Optional;

/**
 * Token layout: URL-safe base64 of {@code admin:<expiresAtEpochMillis>:<password>}.
 *
 * <p>The token is a recoverable password assertion, not a signed claim: every
 * verification re-checks the embedded password against the current credential, so a
 * credential rotation invalidates all outstanding tokens.
 */
public final class AdminTokenCodec {

    private static final String PREFIX = "admin:";

    private AdminTokenCodec() {
    }

    public static String encode(String password, Instant expiresAt) {
        String raw = PREFIX + expiresAt.toEpochMilli() + ":" + password;
        return Base64.getUrlEncoder().withoutPadding().encodeToString(raw.getBytes(StandardCharsets.UTF_8));
    }

    public static Optional<Decoded> decode(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }

        final String raw;
        try {
            raw = new String(Base64.getUrlDecoder().decode(token.trim()), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }

        if (!raw.startsWith(PREFIX)) {
            return Optional.empty();
        }
        int sep = raw.indexOf(':', PREFIX.length());
        if (sep < 0) {
            return Optional.empty();
        }

        try {
            long expiresAt = Long.parseLong(raw.substring(PREFIX.length(), sep));
            return Optional.of(new Decoded(raw.substring(sep + 1), Instant.ofEpochMilli(expiresAt)));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    public record Decoded(String password, Instant expiresAt) {

        @Override
        public String toString() {
            return "Decoded[expiresAt=" + expiresAt + "]";
        }
    }
}
