package com.shlokmestry.gateway.events;

public enum SecurityEventType {
    RATE_LIMIT_EXCEEDED("rate_limit"),
    SIGNATURE_INVALID("hmac_validation_failed"),
    AUTH_FAILURE("auth_failure"),
    CSP_VIOLATION("csp_violation"),
    SUSPICIOUS_REQUEST("suspicious_request"),
    MIDDLEWARE_ERROR("middleware_error");

    private final String code;

    SecurityEventType(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
