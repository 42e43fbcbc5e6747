package com.shlokmestry.gateway.auth;

import java.time.Instant;

public record AdminToken(String value, Instant expiresAt) {

    @Override
    public String toString() {
        return "AdminToken[expiresAt=" + expiresAt + "]";
    }
}
