package com.shlokmestry.gateway.config;

import java.time.Duration;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Typed view of the {@code gateway.*} configuration tree. Values are resolved once at
 * startup (mostly from environment variables, see {@code application.yml}) and are
 * read-only afterwards.
 */
@Validated
@ConfigurationProperties(prefix = "gateway")
public record GatewayProperties(
        @NotNull @DefaultValue("production") DeploymentEnvironment environment,
        @Valid @NotNull RateLimit rateLimit,
        @Valid @NotNull Hmac hmac,
        @Valid @NotNull Admin admin,
        @Valid @NotNull Csp csp,
        @Valid @NotNull @DefaultValue Crypto crypto
) {

    public record RateLimit(
            @Min(1) int requestsPerMinute,
            @Valid @NotNull Policy form,
            @Valid @NotNull Policy adminLogin,
            @Valid @NotNull Policy adminApi,
            @Min(1) int maxBuckets,
            @NotNull Duration sweepInterval,
            List<String> bypassPaths
    ) {

        public RateLimit {
            bypassPaths = bypassPaths == null ? List.of() : List.copyOf(bypassPaths);
        }
    }

    public record Policy(
            @Min(1) int maxRequests,
            @NotNull Duration window
    ) {}

    public record Hmac(
            String secret,
            @NotBlank String signatureHeader,
            List<String> protectedRoutes,
            @Min(1) int maxBodyBytes
    ) {

        public Hmac {
            protectedRoutes = protectedRoutes == null ? List.of() : List.copyOf(protectedRoutes);
        }

        public boolean hasSecret() {
            return secret != null && !secret.isBlank();
        }
    }

    public record Admin(
            String password,
            String passwordHash,
            @NotNull Duration tokenTtl
    ) {}

    public record Csp(
            String reportUri,
            List<String> analyticsOrigins,
            List<String> connectOrigins
    ) {

        public Csp {
            analyticsOrigins = analyticsOrigins == null ? List.of() : List.copyOf(analyticsOrigins);
            connectOrigins = connectOrigins == null ? List.of() : List.copyOf(connectOrigins);
        }
    }

    public record Crypto(
            @NotNull @DefaultValue("full") Mode mode,
            String delegateUrl,
            @NotNull @DefaultValue("PT5S") Duration delegateTimeout,
            @DefaultValue("false") boolean exposeEndpoint
    ) {

        public enum Mode {
            FULL,
            DELEGATING
        }
    }
}
