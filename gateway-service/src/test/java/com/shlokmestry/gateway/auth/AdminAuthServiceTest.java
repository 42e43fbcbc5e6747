package com.shlokmestry.gateway.auth;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.shlokmestry.gateway.config.DeploymentEnvironment;
import com.shlokmestry.gateway.crypto.JcaCryptoProvider;
import com.shlokmestry.gateway.events.RequestOrigin;
import com.shlokmestry.gateway.events.SecurityEventLogger;
import com.shlokmestry.gateway.events.SecurityEventType;
import com.shlokmestry.gateway.observability.RateLimitMetrics;
import com.shlokmestry.gateway.ratelimit.FixedWindowRateLimiter;
import com.shlokmestry.gateway.ratelimit.InMemoryBucketStore;
import com.shlokmestry.gateway.ratelimit.RateLimitPolicy;
import com.shlokmestry.gateway.ratelimit.RateLimiter;
import com.shlokmestry.gateway.support.MutableClock;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

class AdminAuthServiceTest {

    private static final RequestOrigin ORIGIN = new RequestOrigin("203.0.113.7", "POST", "/api/admin/auth/login");
    private static final RateLimitPolicy LOGIN = new RateLimitPolicy("admin_login", 5, Duration.ofMinutes(15));

    private final JcaCryptoProvider crypto = new JcaCryptoProvider(4);

    private MutableClock clock;
    private RateLimiter limiter;
    private SecurityEventLogger events;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-03-01T10:00:00Z");
        limiter = new FixedWindowRateLimiter(new InMemoryBucketStore(), clock, 1000);
        events = new SecurityEventLogger(DeploymentEnvironment.PRODUCTION, clock, new SimpleMeterRegistry());
    }

    private AdminAuthService service(AdminCredentials credentials) {
        return new AdminAuthService(credentials, crypto, limiter, LOGIN,
                new RateLimitMetrics(new SimpleMeterRegistry()), events, clock, Duration.ofHours(24));
    }

    @Test
    void loginThenVerifyAndWrongPasswordDoesNotDisturbIssuedToken() {
        AdminAuthService auth = service(AdminCredentials.of(new PlaintextCredential("admin123")));

        AuthResult<AdminToken> ok = auth.login("admin123", ORIGIN);
        assertThat(ok.isSuccess()).isTrue();
        assertThat(ok.value().expiresAt()).isEqualTo(Instant.parse("2024-03-02T10:00:00Z"));
        assertThat(auth.verify(ok.value().value()).isSuccess()).isTrue();

        AuthResult<AdminToken> wrong = auth.login("wrong", ORIGIN);
        assertThat(wrong.error()).isEqualTo(AuthError.UNAUTHORIZED);
        assertThat(wrong.value()).isNull();
        assertThat(events.byType(SecurityEventType.AUTH_FAILURE, 10)).hasSize(1);

        assertThat(auth.verify(ok.value().value()).isSuccess()).isTrue();
    }

    @Test
    void tokenForWrongPasswordNeverVerifies() {
        AdminAuthService auth = service(AdminCredentials.of(new PlaintextCredential("admin123")));
        String forged = AdminTokenCodec.encode("guess", Instant.parse("2030-01-01T00:00:00Z"));

        AuthResult<Instant> result = auth.verify(forged);
        assertThat(result.isSuccess()).isFalse();
        assertThat(result.reason()).isEqualTo("invalid_password");
    }

    @Test
    void rotatingTheCredentialRevokesOldTokens() {
        String token = service(AdminCredentials.of(new PlaintextCredential("old-secret")))
                .login("old-secret", ORIGIN).value().value();

        AdminAuthService rotated = service(AdminCredentials.resolve(crypto.hashPassword("new-secret"), null));

        assertThat(rotated.verify(token).isSuccess()).isFalse();
        AuthResult<AdminToken> fresh = rotated.login("new-secret", ORIGIN);
        assertThat(rotated.verify(fresh.value().value()).isSuccess()).isTrue();
    }

    @Test
    void expiredTokenIsRejected() {
        AdminAuthService auth = service(AdminCredentials.of(new PlaintextCredential("admin123")));
        String token = auth.login("admin123", ORIGIN).value().value();

        clock.advance(Duration.ofHours(24));
        AuthResult<Instant> result = auth.verify(token);
        assertThat(result.isSuccess()).isFalse();
        assertThat(result.reason()).isEqualTo("token_expired");
    }

    @Test
    void sixthAttemptInWindowIsRateLimitedEvenWithRightPassword() {
        AdminAuthService auth = service(AdminCredentials.of(new PlaintextCredential("admin123")));
        for (int i = 0; i < 5; i++) {
            auth.login("wrong", ORIGIN);
        }

        AuthResult<AdminToken> sixth = auth.login("admin123", ORIGIN);
        assertThat(sixth.error()).isEqualTo(AuthError.RATE_LIMITED);
        assertThat(sixth.rateLimit().allowed()).isFalse();
        assertThat(events.byType(SecurityEventType.RATE_LIMIT_EXCEEDED, 10)).hasSize(1);

        clock.advance(Duration.ofMinutes(16));
        assertThat(auth.login("admin123", ORIGIN).isSuccess()).isTrue();
    }

    @Test
    void notConfiguredRefusesEveryone() {
        AdminAuthService auth = service(AdminCredentials.resolve(null, null));

        assertThat(auth.isConfigured()).isFalse();
        AuthResult<AdminToken> result = auth.login("anything", ORIGIN);
        assertThat(result.error()).isEqualTo(AuthError.UNAUTHORIZED);
        assertThat(result.reason()).isEqualTo("not_configured");
        assertThat(auth.verify(AdminTokenCodec.encode("anything", Instant.parse("2030-01-01T00:00:00Z")))
                .isSuccess()).isFalse();
    }

    @Test
    void verifyReportsMissingAndMalformedTokens() {
        AdminAuthService auth = service(AdminCredentials.of(new PlaintextCredential("admin123")));

        assertThat(auth.verify(null).reason()).isEqualTo("missing_token");
        assertThat(auth.verify("garbage!").reason()).isEqualTo("invalid_token_format");
    }
}
