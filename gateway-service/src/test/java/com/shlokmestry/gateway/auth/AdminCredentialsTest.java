package com.shlokmestry.gateway.auth;

import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.Test;

import com.shlokmestry.gateway.crypto.JcaCryptoProvider;

class AdminCredentialsTest {

    private final JcaCryptoProvider crypto = new JcaCryptoProvider(4);

    @Test
    void wellFormedHashWinsOverPlaintext() {
        String hash = crypto.hashPassword("from-hash");
        AdminCredentials creds = AdminCredentials.resolve(hash, "from-plaintext");

        AdminCredential active = creds.active().orElseThrow();
        assertThat(active).isInstanceOf(HashedCredential.class);
        assertThat(active.matches("from-hash", crypto)).isTrue();
        assertThat(active.matches("from-plaintext", crypto)).isFalse();
        assertThat(creds.problems()).isEmpty();
    }

    @Test
    void malformedHashFallsBackToPlaintextAndIsReported() {
        AdminCredentials creds = AdminCredentials.resolve("$2a$12$tooShort", "admin123");

        assertThat(creds.active()).containsInstanceOf(PlaintextCredential.class);
        assertThat(creds.active().orElseThrow().matches("admin123", crypto)).isTrue();
        assertThat(creds.problems()).hasSize(1);
    }

    @Test
    void nothingConfiguredFailsClosed() {
        AdminCredentials creds = AdminCredentials.resolve("  ", "");

        assertThat(creds.isConfigured()).isFalse();
        assertThat(creds.active()).isEmpty();
        assertThat(creds.problems()).isNotEmpty();
    }

    @Test
    void toStringNeverRevealsSecrets() {
        assertThat(new PlaintextCredential("admin123").toString()).doesNotContain("admin123");
        String hash = crypto.hashPassword("x");
        assertThat(new HashedCredential(hash).toString()).doesNotContain(hash.substring(10));
    }
}
