package com.shlokmestry.gateway.api;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RestController;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shlokmestry.gateway.events.RequestOrigin;
import com.shlokmestry.gateway.events.SecurityEventLogger;
import com.shlokmestry.gateway.events.SecurityEventType;
import com.shlokmestry.gateway.events.Severity;
import com.shlokmestry.gateway.gateway.ClientIdentityResolver;

import jakarta.servlet.http.HttpServletRequest;

/**
 * Browser CSP violation reports. Always answers 204, parsed or not, so browsers do not
 * retry.
 */
@RestController
@RequestMapping("/api/security/csp-report")
@CrossOrigin(origins = "*", methods = {RequestMethod.POST, RequestMethod.OPTIONS}, allowedHeaders = "Content-Type")
public class CspReportController {

    private static final Logger log = LoggerFactory.getLogger(CspReportController.class);

    private static final int MAX_FIELD_LENGTH = 512;

    // report field -> event detail key
    private static final Map<String, String> FIELDS = Map.of(
            "violated-directive", "violatedDirective",
            "effective-directive", "effectiveDirective",
            "blocked-uri", "blockedUri",
            "document-uri", "documentUri",
            "source-file", "sourceFile",
            "original-policy", "originalPolicy",
            "disposition", "disposition"
    );

    private final ObjectMapper objectMapper;
    private final SecurityEventLogger events;
    private final ClientIdentityResolver identities;

    public CspReportController(ObjectMapper objectMapper, SecurityEventLogger events, ClientIdentityResolver identities) {
        this.objectMapper = objectMapper;
        this.events = events;
        this.identities = identities;
    }

    @PostMapping
    public ResponseEntity<Void> report(@RequestBody(required = false) byte[] body, HttpServletRequest request) {
        RequestOrigin origin = RequestOrigin.of(identities.resolve(request), request);
        try {
            JsonNode root = body == null || body.length == 0 ? null : objectMapper.readTree(body);
            if (root == null || !root.isObject()) {
                throw new IOException("report is not a JSON object");
            }
            JsonNode violation = root.has("csp-report") ? root.get("csp-report") : root;

            Map<String, Object> details = new LinkedHashMap<>();
            FIELDS.forEach((field, key) -> {
                JsonNode v = violation.get(field);
                if (v != null && !v.isNull()) {
                    details.put(key, truncate(v.asText()));
                }
            });
            events.record(SecurityEventType.CSP_VIOLATION, Severity.MEDIUM, origin, details);
        } catch (IOException e) {
            log.debug("csp report unreadable client={}", origin.clientIdentity(), e);
            events.record(SecurityEventType.MIDDLEWARE_ERROR, Severity.MEDIUM, origin, Map.of(
                    "endpoint", "/api/security/csp-report",
                    "error", truncate(String.valueOf(e.getMessage()))
            ));
        }
        return ResponseEntity.noContent().build();
    }

    @RequestMapping(method = RequestMethod.OPTIONS)
    public ResponseEntity<Void> preflight() {
        return ResponseEntity.ok()
                .header(HttpHeaders.ACCESS_CONTROL_ALLOW_ORIGIN, "*")
                .header(HttpHeaders.ACCESS_CONTROL_ALLOW_METHODS, "POST, OPTIONS")
                .header(HttpHeaders.ACCESS_CONTROL_ALLOW_HEADERS, "Content-Type")
                .build();
    }

    private static String truncate(String value) {
        return value.length() > MAX_FIELD_LENGTH ? value.substring(0, MAX_FIELD_LENGTH) : value;
    }
}
