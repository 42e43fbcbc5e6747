package com.shlokmestry.gateway.gateway;

import java.io.IOException;

import org.springframework.http.MediaType;

import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

/**
 * Writes short-circuit responses from filters, where there is no controller to return a
 * {@code ResponseEntity}.
 */
public class GatewayResponses {

    private final ObjectMapper objectMapper;

    public GatewayResponses(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public void writeJson(HttpServletResponse response, int status, Object body) throws IOException {
        response.setStatus(status);
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding("UTF-8");
        objectMapper.writeValue(response.getOutputStream(), body);
    }

    public static String correlationId(HttpServletRequest request) {
        Object cid = request.getAttribute(GatewayAttributes.CORRELATION_ID);
        return cid instanceof String s ? s : null;
    }
}
