package com.shlokmestry.gateway.auth;

/**
 * What a caller may learn about a failed authentication. Deliberately coarse: a wrong
 * password, a malformed or expired token and a missing credential are all
 * {@link #UNAUTHORIZED}.
 */
public enum AuthError {
    RATE_LIMITED,
    UNAUTHORIZED
}
