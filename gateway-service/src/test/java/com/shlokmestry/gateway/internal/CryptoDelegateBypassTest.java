package com.shlokmestry.gateway.internal;

import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.test.context.TestPropertySource;
import org.springframework.web.client.RestClient;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.shlokmestry.gateway.crypto.CryptoProvider;
import com.shlokmestry.gateway.crypto.DelegatingCryptoProvider;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@TestPropertySource(properties = {
        "gateway.environment=production",
        "gateway.hmac.secret=delegate-secret",
        "gateway.admin.password=admin123",
        "gateway.crypto.expose-endpoint=true",
        "gateway.rate-limit.requests-per-minute=2"
})
class CryptoDelegateBypassTest {

    @LocalServerPort
    int port;

    @Autowired
    CryptoProvider crypto;

    @Autowired
    ObjectMapper objectMapper;

    @Test
    void delegatedCallsAreNotCountedAgainstTheGeneralLimit() {
        RestClient client = RestClient.builder().baseUrl("http://localhost:" + port).build();
        DelegatingCryptoProvider delegating = new DelegatingCryptoProvider(
                crypto, client, objectMapper, "delegate-secret", "X-Signature", new SimpleMeterRegistry());
        String hash = crypto.hashPassword("correct horse");

        for (int i = 0; i < 5; i++) {
            assertThat(delegating.matchesPassword("correct horse", hash)).isTrue();
        }
    }
}
