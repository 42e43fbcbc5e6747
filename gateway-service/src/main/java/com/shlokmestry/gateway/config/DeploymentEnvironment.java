package com.shlokmestry.gateway.config;

/**
 * Deployment flavour. Development relaxes the content-security policy, emits it in
 * report-only form, skips HSTS and lets the form signature gate fail open when no
 * secret is configured.
 */
public enum DeploymentEnvironment {
    DEVELOPMENT,
    PRODUCTION;

    public boolean isDevelopment() {
        return this == DEVELOPMENT;
    }

    public boolean isProduction() {
        return this == PRODUCTION;
    }
}
