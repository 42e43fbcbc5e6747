package com.shlokmestry.gateway.crypto;

import java.io.IOException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import com.fasterxml.jackson.databind.ObjectMapper;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

/**
 * Reduced-capability provider for runtimes that cannot afford (or do not ship) adaptive
 * hashing. Nonces, HMAC and constant-time comparison stay local; bcrypt hashing and
 * comparison are sent to a full-featured instance's internal endpoint.
 *
 * <p>Fails closed: if the delegate cannot be reached or answers garbage,
 * {@link #matchesPassword} returns {@code false}.
 */
public class DelegatingCryptoProvider implements CryptoProvider {

    private static final Logger log = LoggerFactory.getLogger(DelegatingCryptoProvider.class);

    private final CryptoProvider local;
    private final RestClient delegate;
    private final ObjectMapper objectMapper;
    private final String signingSecret;
    private final String signatureHeader;

    private final Counter matchFailures;
    private final Counter hashFailures;

    public DelegatingCryptoProvider(
            CryptoProvider local,
            RestClient delegate,
            ObjectMapper objectMapper,
            String signingSecret,
            String signatureHeader,
            MeterRegistry meterRegistry
    ) {
        this.local = local;
        this.delegate = delegate;
        this.objectMapper = objectMapper;
        this.signingSecret = signingSecret;
        this.signatureHeader = signatureHeader;

        this.matchFailures = Counter.builder("crypto.delegation.failures.total")
                .tag("operation", "password_match")
                .register(meterRegistry);

        this.hashFailures = Counter.builder("crypto.delegation.failures.total")
                .tag("operation", "password_hash")
                .register(meterRegistry);
    }

    @Override
    public String generateNonce() {
        return local.generateNonce();
    }

    @Override
    public String hmacSha256Hex(String secret, byte[] data) {
        return local.hmacSha256Hex(secret, data);
    }

    @Override
    public boolean constantTimeEquals(String expected, String actual) {
        return local.constantTimeEquals(expected, actual);
    }

    @Override
    public String hashPassword(String rawPassword) {
        final CryptoDelegation.PasswordHashResponse res;
        try {
            res = post(CryptoDelegation.PASSWORD_HASH_PATH,
                    new CryptoDelegation.PasswordHashRequest(rawPassword),
                    CryptoDelegation.PasswordHashResponse.class);
        } catch (IOException | RestClientException e) {
            hashFailures.increment();
            throw new CryptoUnavailableException("password hashing delegate unavailable", e);
        }

        if (res == null || res.hash() == null || res.hash().isBlank()) {
            hashFailures.increment();
            throw new CryptoUnavailableException("password hashing delegate returned no hash");
        }
        return res.hash();
    }

    @Override
    public boolean matchesPassword(String rawPassword, String passwordHash) {
        if (rawPassword == null || passwordHash == null || passwordHash.isBlank()) {
            return false;
        }

        final CryptoDelegation.PasswordMatchResponse res;
        try {
            res = post(CryptoDelegation.PASSWORD_MATCH_PATH,
                    new CryptoDelegation.PasswordMatchRequest(rawPassword, passwordHash),
                    CryptoDelegation.PasswordMatchResponse.class);
        } catch (IOException | RestClientException e) {
            matchFailures.increment();
            log.warn("Fail-closed: password match delegate error", e);
            return false;
        }

        if (res == null) {
            matchFailures.increment();
            log.warn("Fail-closed: password match delegate returned an empty response");
            return false;
        }
        return res.matches();
    }

    private <T> T post(String path, Object payload, Class<T> responseType) throws IOException {
        byte[] body = objectMapper.writeValueAsBytes(payload);
        String signature = signingSecret == null || signingSecret.isBlank()
                ? ""
                : local.hmacSha256Hex(signingSecret, body);

        return delegate.post()
                .uri(path)
                .contentType(MediaType.APPLICATION_JSON)
                .header(signatureHeader, signature)
                .body(body)
                .retrieve()
                .body(responseType);
    }
}
