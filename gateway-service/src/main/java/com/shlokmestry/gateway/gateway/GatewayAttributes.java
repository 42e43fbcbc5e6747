package com.shlokmestry.gateway.gateway;

public final class GatewayAttributes {

    public static final String CORRELATION_ID = "gateway.correlationId";
    public static final String CSP_NONCE = "gateway.cspNonce";
    public static final String CLIENT_IDENTITY = "gateway.clientIdentity";
    public static final String ADMIN_TOKEN_EXPIRES_AT = "gateway.adminTokenExpiresAt";

    public static final String CORRELATION_HEADER = "X-Correlation-Id";
    public static final String NONCE_HEADER = "X-Nonce";

    private GatewayAttributes() {
    }
}
