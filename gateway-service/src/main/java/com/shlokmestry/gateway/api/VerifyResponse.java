package com.shlokmestry.gateway.api;

import java.time.Instant;

public record VerifyResponse(boolean authenticated, Instant expiresAt) {}
