package com.shlokmestry.gateway.observability;

import org.springframework.boot.actuate.health.AbstractHealthIndicator;
import org.springframework.boot.actuate.health.Health;
import org.springframework.stereotype.Component;

import com.shlokmestry.gateway.config.DeploymentEnvironment;
import com.shlokmestry.gateway.hmac.HmacGate;

/**
 * Always UP; reports whether form signatures are enforced, or failing open or closed
 * for want of a secret.
 */
@Component("formSignature")
public class FormSignatureHealthIndicator extends AbstractHealthIndicator {

    private final HmacGate hmac;
    private final DeploymentEnvironment environment;

    public FormSignatureHealthIndicator(HmacGate hmac, DeploymentEnvironment environment) {
        this.hmac = hmac;
        this.environment = environment;
    }

    @Override
    protected void doHealthCheck(Health.Builder builder) {
        String mode;
        if (hmac.hasSecret()) {
            mode = "enforced";
        } else {
            mode = environment.isProduction() ? "fail_closed" : "fail_open";
        }
        builder.up()
                .withDetail("mode", mode)
                .withDetail("environment", environment.name().toLowerCase());
    }
}
