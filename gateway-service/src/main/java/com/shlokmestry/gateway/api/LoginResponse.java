package com.shlokmestry.gateway.api;

import java.time.Instant;

public record LoginResponse(boolean ok, String token, Instant expiresAt) {

    @Override
    public String toString() {
        return "LoginResponse[ok=" + ok + ", expiresAt=" + expiresAt + "]";
    }
}
