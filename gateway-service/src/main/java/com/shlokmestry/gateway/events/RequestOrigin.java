package com.shlokmestry.gateway.events;

import jakarta.servlet.http.HttpServletRequest;

public record RequestOrigin(String clientIdentity, String method, String route) {

    public static RequestOrigin of(String clientIdentity, HttpServletRequest request) {
        return new RequestOrigin(clientIdentity, request.getMethod(), request.getRequestURI());
    }
}
