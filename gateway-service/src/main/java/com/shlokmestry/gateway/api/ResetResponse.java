package com.shlokmestry.gateway.api;

/**
 * @param keysCleared buckets removed; for {@code all} the number of keys that existed
 *                    before the reset
 */
public record ResetResponse(boolean success, String action, String message, long keysCleared) {}
