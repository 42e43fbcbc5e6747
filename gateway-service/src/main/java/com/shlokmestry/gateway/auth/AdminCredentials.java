package com.shlokmestry.gateway.auth;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The admin credential resolved once at startup.
 *
 * <p>A well-formed bcrypt hash wins over a plaintext password. A malformed hash is
 * ignored (and reported). With neither, nothing is active and every login is refused.
 */
public final class AdminCredentials {

    private static final Logger log = LoggerFactory.getLogger(AdminCredentials.class);

    private final AdminCredential active;
    private final List<String> problems;

    private AdminCredentials(AdminCredential active, List<String> problems) {
        this.active = active;
        this.problems = List.copyOf(problems);
    }

    public static AdminCredentials resolve(String passwordHash, String plaintextPassword) {
        List<String> problems = new ArrayList<>();
        boolean hasHash = passwordHash != null && !passwordHash.isBlank();
        boolean hasPlaintext = plaintextPassword != null && !plaintextPassword.isEmpty();

        if (hasHash) {
            String hash = passwordHash.trim();
            if (HashedCredential.isWellFormed(hash)) {
                log.info("admin credential mode=hash");
                return new AdminCredentials(new HashedCredential(hash), problems);
            }
            problems.add("ADMIN_PASSWORD_HASH is not a valid bcrypt hash and was ignored");
            log.error("admin credential: configured password hash is malformed (length={}), ignoring it", hash.length());
        }

        if (hasPlaintext) {
            log.warn("admin credential mode=plaintext; configure ADMIN_PASSWORD_HASH for steady state");
            return new AdminCredentials(new PlaintextCredential(plaintextPassword), problems);
        }

        problems.add("no admin credential configured; all admin logins are refused");
        log.error("admin credential not configured; admin authentication is disabled (fail-closed)");
        return new AdminCredentials(null, problems);
    }

    public static AdminCredentials of(AdminCredential credential) {
        return new AdminCredentials(credential, List.of());
    }

    public Optional<AdminCredential> active() {
        return Optional.ofNullable(active);
    }

    public boolean isConfigured() {
        return active != null;
    }

    public List<String> problems() {
        return problems;
    }
}
