package com.shlokmestry.gateway.api;

import java.time.Clock;
import java.time.Instant;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.shlokmestry.gateway.auth.AdminAuthService;
import com.shlokmestry.gateway.auth.AdminToken;
import com.shlokmestry.gateway.auth.AuthError;
import com.shlokmestry.gateway.auth.AuthResult;
import com.shlokmestry.gateway.events.RequestOrigin;
import com.shlokmestry.gateway.gateway.ClientIdentityResolver;
import com.shlokmestry.gateway.gateway.GatewayAttributes;
import com.shlokmestry.gateway.gateway.GatewayError;
import com.shlokmestry.gateway.gateway.GatewayResponses;
import com.shlokmestry.gateway.ratelimit.RateLimitHeaders;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;

/**
 * Login, token check and logout. Everything except login sits behind the admin filter,
 * so verify and logout only run with a valid token.
 */
@RestController
@RequestMapping("/api/admin/auth")
public class AdminAuthController {

    private static final Logger log = LoggerFactory.getLogger(AdminAuthController.class);

    static final String CLEAR_SITE_DATA = "Clear-Site-Data";

    private final AdminAuthService auth;
    private final ClientIdentityResolver identities;
    private final Clock clock;

    public AdminAuthController(AdminAuthService auth, ClientIdentityResolver identities, Clock clock) {
        this.auth = auth;
        this.identities = identities;
        this.clock = clock;
    }

    @PostMapping("/login")
    public ResponseEntity<?> login(@Valid @RequestBody LoginRequest req, HttpServletRequest request) {
        RequestOrigin origin = RequestOrigin.of(identities.resolve(request), request);
        String cid = GatewayResponses.correlationId(request);

        AuthResult<AdminToken> result = auth.login(req.password(), origin);
        HttpHeaders h = result.rateLimit() == null
                ? new HttpHeaders()
                : RateLimitHeaders.toHttpHeaders(result.rateLimit(), Instant.now(clock));

        if (result.error() == AuthError.RATE_LIMITED) {
            return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                    .headers(h)
                    .body(GatewayError.of(cid, "rate_limited", "Too many login attempts. Please try again later."));
        }
        if (!result.isSuccess()) {
            log.info("admin login rejected cid={} client={} reason={}", cid, origin.clientIdentity(), result.reason());
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                    .headers(h)
                    .body(GatewayError.of(cid, "unauthorized", "Invalid credentials"));
        }

        h.setCacheControl("no-store");
        AdminToken token = result.value();
        return ResponseEntity.ok()
                .headers(h)
                .body(new LoginResponse(true, token.value(), token.expiresAt()));
    }

    @PostMapping("/verify")
    public VerifyResponse verify(HttpServletRequest request) {
        Object expiresAt = request.getAttribute(GatewayAttributes.ADMIN_TOKEN_EXPIRES_AT);
        return new VerifyResponse(true, expiresAt instanceof Instant i ? i : null);
    }

    @PostMapping("/logout")
    public ResponseEntity<Void> logout(HttpServletRequest request) {
        log.info("admin logout client={}", identities.resolve(request));
        return ResponseEntity.noContent()
                .header(CLEAR_SITE_DATA, "\"storage\"")
                .build();
    }
}
