package com.shlokmestry.gateway.gateway;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record GatewayError(boolean ok, String cid, String error, String message) {

    public static GatewayError of(String cid, String error) {
        return new GatewayError(false, cid, error, null);
    }

    public static GatewayError of(String cid, String error, String message) {
        return new GatewayError(false, cid, error, message);
    }
}
