package com.shlokmestry.gateway.csp;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.shlokmestry.gateway.config.GatewayProperties;

/**
 * Builds the per-request content-security policy from a fixed template, the request's
 * nonce and the environment. Pure: no state beyond the configured origin lists.
 */
public class CspPolicyBuilder {

    public static final String HEADER = "Content-Security-Policy";
    public static final String REPORT_ONLY_HEADER = "Content-Security-Policy-Report-Only";

    private static final String SELF = "'self'";
    private static final String NONE = "'none'";
    private static final String UNSAFE_INLINE = "'unsafe-inline'";

    private final List<String> analyticsOrigins;
    private final List<String> connectOrigins;

    public CspPolicyBuilder(GatewayProperties.Csp props) {
        this(props.analyticsOrigins(), props.connectOrigins());
    }

    public CspPolicyBuilder(List<String> analyticsOrigins, List<String> connectOrigins) {
        this.analyticsOrigins = List.copyOf(analyticsOrigins);
        this.connectOrigins = List.copyOf(connectOrigins);
    }

    public CspDirectives build(String nonce, boolean isDevelopment) {
        String nonceSource = "'nonce-" + nonce + "'";
        Map<String, List<String>> d = new LinkedHashMap<>();

        d.put("default-src", List.of(SELF));

        List<String> script = new ArrayList<>(List.of(SELF, nonceSource));
        if (isDevelopment) {
            // live reload
            script.addAll(List.of("'unsafe-eval'", "localhost:*", "ws:", "wss:"));
        } else {
            script.addAll(analyticsOrigins);
        }
        d.put("script-src", script);

        d.put("style-src", List.of(SELF, nonceSource, UNSAFE_INLINE, "https://fonts.googleapis.com"));
        d.put("style-src-attr", List.of(UNSAFE_INLINE));

        List<String> img = new ArrayList<>(List.of(SELF, "data:", "blob:", "https:"));
        if (isDevelopment) {
            img.add("http:");
        }
        d.put("img-src", img);

        d.put("font-src", List.of(SELF, "https://fonts.gstatic.com", "data:"));

        List<String> connect = new ArrayList<>(List.of(SELF));
        if (isDevelopment) {
            connect.addAll(List.of("ws:", "wss:", "http:", "localhost:*"));
        }
        connect.addAll(analyticsOrigins);
        connect.addAll(connectOrigins);
        d.put("connect-src", connect.stream().distinct().toList());

        d.put("object-src", List.of(NONE));
        d.put("base-uri", List.of(SELF));
        d.put("form-action", List.of(SELF));
        d.put("frame-ancestors", List.of(NONE));

        return new CspDirectives(d, !isDevelopment);
    }

    /**
     * Serialises to a header value: {@code name src src; name src; ...}, empty directives
     * skipped, {@code upgrade-insecure-requests} when set, {@code report-uri} last when
     * {@code reportUri} is non-blank.
     */
    public String serialize(CspDirectives directives, String reportUri) {
        List<String> parts = new ArrayList<>();
        directives.directives().forEach((name, sources) -> {
            if (!sources.isEmpty()) {
                parts.add(name + " " + String.join(" ", sources));
            }
        });
        if (directives.upgradeInsecureRequests()) {
            parts.add("upgrade-insecure-requests");
        }
        if (reportUri != null && !reportUri.isBlank()) {
            parts.add("report-uri " + reportUri);
        }
        return String.join("; ", parts);
    }

    public String headerName(boolean isDevelopment) {
        return isDevelopment ? REPORT_ONLY_HEADER : HEADER;
    }
}
