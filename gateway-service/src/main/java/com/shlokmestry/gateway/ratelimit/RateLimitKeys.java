package com.shlokmestry.gateway.ratelimit;

import java.util.List;

public final class RateLimitKeys {

    public static final String GENERAL = "ip";
    public static final String FORM = "contact";
    public static final String ADMIN_LOGIN = "admin_auth";
    public static final String ADMIN_API = "admin_api";

    public static final List<String> CLASSES = List.of(GENERAL, FORM, ADMIN_LOGIN, ADMIN_API);

    private RateLimitKeys() {
    }

    // <class>:<clientIdentity>
    public static String of(String routeClass, String clientIdentity) {
        return routeClass + ":" + clientIdentity;
    }
}
