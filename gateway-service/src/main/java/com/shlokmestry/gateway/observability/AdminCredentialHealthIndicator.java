package com.shlokmestry.gateway.observability;

import org.springframework.boot.actuate.health.AbstractHealthIndicator;
import org.springframework.boot.actuate.health.Health;
import org.springframework.stereotype.Component;

import com.shlokmestry.gateway.auth.AdminCredential;
import com.shlokmestry.gateway.auth.AdminCredentials;

/**
 * DOWN when no admin credential could be resolved at startup; admin logins are refused
 * in that state.
 */
@Component("adminCredential")
public class AdminCredentialHealthIndicator extends AbstractHealthIndicator {

    private final AdminCredentials credentials;

    public AdminCredentialHealthIndicator(AdminCredentials credentials) {
        super("admin credential health check failed");
        this.credentials = credentials;
    }

    @Override
    protected void doHealthCheck(Health.Builder builder) {
        if (!credentials.isConfigured()) {
            builder.down()
                    .withDetail("configured", false)
                    .withDetail("problems", credentials.problems());
            return;
        }

        AdminCredential active = credentials.active().orElseThrow();
        builder.up()
                .withDetail("configured", true)
                .withDetail("mode", active.mode());
        if (!credentials.problems().isEmpty()) {
            builder.withDetail("problems", credentials.problems());
        }
    }
}
