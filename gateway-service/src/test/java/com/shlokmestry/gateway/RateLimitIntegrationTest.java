package com.shlokmestry.gateway;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;

import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.HttpHeaders;
import org.springframework.test.context.TestPropertySource;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@TestPropertySource(properties = {
        "gateway.environment=development",
        "gateway.rate-limit.requests-per-minute=3",
        "gateway.hmac.secret="
})
class RateLimitIntegrationTest {

    @LocalServerPort
    int port;

    private final HttpClient http = HttpClient.newHttpClient();

    private HttpResponse<String> get(String path, String client) throws Exception {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create("http://localhost:" + port + path))
                .header("X-Forwarded-For", client)
                .GET()
                .build();
        return http.send(req, HttpResponse.BodyHandlers.ofString());
    }

    @Test
    void fourthRequestInAMinuteIsRejectedWithHeaders() throws Exception {
        for (int i = 0; i < 3; i++) {
            assertThat(get("/api/echo", "192.0.2.1").statusCode()).isEqualTo(200);
        }

        HttpResponse<String> resp = get("/api/echo", "192.0.2.1");

        assertThat(resp.statusCode()).isEqualTo(429);
        assertThat(resp.body()).contains("\"error\":\"rate_limited\"").contains("\"ok\":false");
        assertThat(resp.headers().firstValue(HttpHeaders.RETRY_AFTER)).isPresent();
        assertThat(resp.headers().firstValue("X-RateLimit-Remaining")).contains("0");
        assertThat(resp.headers().firstValue("Content-Security-Policy-Report-Only")).isPresent();
        assertThat(resp.headers().firstValue("X-Frame-Options")).contains("DENY");
        assertThat(resp.headers().firstValue("Strict-Transport-Security")).isEmpty();
    }

    @Test
    void otherClientsAreUnaffected() throws Exception {
        for (int i = 0; i < 4; i++) {
            get("/api/echo", "192.0.2.2");
        }
        assertThat(get("/api/echo", "192.0.2.3").statusCode()).isEqualTo(200);
    }

    @Test
    void bypassPathsAreNeverLimited() throws Exception {
        for (int i = 0; i < 6; i++) {
            assertThat(get("/actuator/health", "192.0.2.4").statusCode()).isNotEqualTo(429);
        }
    }

    @Test
    void developmentAcceptsUnsignedFormsWithoutSecret() throws Exception {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create("http://localhost:" + port + "/api/contact"))
                .header("X-Forwarded-For", "192.0.2.5")
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString("{\"a\":1}"))
                .build();

        assertThat(http.send(req, HttpResponse.BodyHandlers.ofString()).statusCode()).isEqualTo(200);
    }
}
