package com.shlokmestry.gateway.internal;

import java.io.IOException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.shlokmestry.gateway.api.InvalidRequestException;
import com.shlokmestry.gateway.crypto.CryptoDelegation;
import com.shlokmestry.gateway.crypto.CryptoProvider;
import com.shlokmestry.gateway.crypto.DelegatingCryptoProvider;
import com.shlokmestry.gateway.gateway.GatewayError;
import com.shlokmestry.gateway.gateway.GatewayResponses;
import com.shlokmestry.gateway.hmac.HmacGate;

import jakarta.servlet.http.HttpServletRequest;

/**
 * Password hashing for instances running a {@link DelegatingCryptoProvider}. Only
 * registered when {@code gateway.crypto.expose-endpoint=true}; bodies must be signed
 * with the shared secret, and without a secret every call is refused.
 */
@RestController
@ConditionalOnProperty(prefix = "gateway.crypto", name = "expose-endpoint", havingValue = "true")
public class CryptoDelegateController {

    private static final Logger log = LoggerFactory.getLogger(CryptoDelegateController.class);

    private final CryptoProvider crypto;
    private final HmacGate hmac;
    private final ObjectMapper objectMapper;

    public CryptoDelegateController(CryptoProvider crypto, HmacGate hmac, ObjectMapper objectMapper) {
        if (crypto instanceof DelegatingCryptoProvider) {
            throw new IllegalStateException("crypto endpoint cannot be exposed by a delegating instance");
        }
        this.crypto = crypto;
        this.hmac = hmac;
        this.objectMapper = objectMapper;
        log.info("crypto delegate endpoint exposed path={}", CryptoDelegation.BASE_PATH);
    }

    @PostMapping(CryptoDelegation.PASSWORD_MATCH_PATH)
    public ResponseEntity<?> passwordMatch(@RequestBody byte[] body, HttpServletRequest request) {
        if (!signed(body, request)) {
            return unauthorized(request);
        }
        CryptoDelegation.PasswordMatchRequest req = read(body, CryptoDelegation.PasswordMatchRequest.class);
        boolean matches = crypto.matchesPassword(req.password(), req.hash());
        return ResponseEntity.ok(new CryptoDelegation.PasswordMatchResponse(matches));
    }

    @PostMapping(CryptoDelegation.PASSWORD_HASH_PATH)
    public ResponseEntity<?> passwordHash(@RequestBody byte[] body, HttpServletRequest request) {
        if (!signed(body, request)) {
            return unauthorized(request);
        }
        CryptoDelegation.PasswordHashRequest req = read(body, CryptoDelegation.PasswordHashRequest.class);
        if (req.password() == null || req.password().isEmpty()) {
            throw new InvalidRequestException("password required");
        }
        return ResponseEntity.ok(new CryptoDelegation.PasswordHashResponse(crypto.hashPassword(req.password())));
    }

    private boolean signed(byte[] body, HttpServletRequest request) {
        return hmac.hasSecret() && hmac.verify(body, request.getHeader(hmac.signatureHeader()));
    }

    private <T> T read(byte[] body, Class<T> type) {
        try {
            return objectMapper.readValue(body, type);
        } catch (IOException e) {
            throw new InvalidRequestException("Malformed request body");
        }
    }

    private static ResponseEntity<GatewayError> unauthorized(HttpServletRequest request) {
        String cid = GatewayResponses.correlationId(request);
        log.warn("crypto delegate reject reason=invalid_signature cid={}", cid);
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(GatewayError.of(cid, "invalid_signature"));
    }
}
