package com.shlokmestry.gateway.hmac;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.shlokmestry.gateway.config.DeploymentEnvironment;
import com.shlokmestry.gateway.config.GatewayProperties;
import com.shlokmestry.gateway.crypto.CryptoProvider;

/**
 * Integrity check for public form submissions: the raw request body must carry an
 * HMAC-SHA256 (hex) made with the shared secret.
 *
 * <p>Without a configured secret the gate fails open outside production and closed in
 * production.
 */
public class HmacGate {

    private static final Logger log = LoggerFactory.getLogger(HmacGate.class);

    private static final String ADMIN_PREFIX = "/api/admin";

    private final CryptoProvider crypto;
    private final DeploymentEnvironment environment;
    private final String secret;
    private final String signatureHeader;
    private final List<String> protectedRoutes;

    public HmacGate(CryptoProvider crypto, DeploymentEnvironment environment, GatewayProperties.Hmac props) {
        this.crypto = crypto;
        this.environment = environment;
        this.secret = props.secret();
        this.signatureHeader = props.signatureHeader();
        this.protectedRoutes = props.protectedRoutes();

        if (!props.hasSecret()) {
            if (environment.isProduction()) {
                log.warn("hmac secret not configured; protected form posts will be rejected (fail-closed)");
            } else {
                log.info("hmac secret not configured; protected form posts are accepted unsigned (fail-open, {})",
                        environment);
            }
        }
    }

    /**
     * Only POSTs to a protected route prefix are gated; admin routes never are.
     */
    public boolean appliesTo(String method, String path) {
        if (!"POST".equalsIgnoreCase(method) || path == null || path.startsWith(ADMIN_PREFIX)) {
            return false;
        }
        for (String route : protectedRoutes) {
            if (path.startsWith(route)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Checks against the configured secret.
     */
    public boolean verify(byte[] rawBody, String providedSignature) {
        return verify(rawBody, providedSignature, secret);
    }

    public boolean verify(byte[] rawBody, String providedSignature, String secret) {
        if (secret == null || secret.isBlank()) {
            return !environment.isProduction();
        }
        if (providedSignature == null || providedSignature.isBlank()) {
            return false;
        }
        String expected = crypto.hmacSha256Hex(secret, rawBody);
        return crypto.constantTimeEquals(expected, providedSignature.trim().toLowerCase(Locale.ROOT));
    }

    public String sign(byte[] rawBody, String secret) {
        return crypto.hmacSha256Hex(secret, rawBody);
    }

    public String sign(String body, String secret) {
        return sign(body.getBytes(StandardCharsets.UTF_8), secret);
    }

    public String signatureHeader() {
        return signatureHeader;
    }

    public boolean hasSecret() {
        return secret != null && !secret.isBlank();
    }
}
