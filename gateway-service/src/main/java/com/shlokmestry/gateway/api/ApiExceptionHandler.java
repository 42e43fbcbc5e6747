package com.shlokmestry.gateway.api;

import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import com.shlokmestry.gateway.crypto.CryptoUnavailableException;
import com.shlokmestry.gateway.gateway.GatewayError;
import com.shlokmestry.gateway.gateway.GatewayResponses;

import jakarta.servlet.http.HttpServletRequest;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<GatewayError> invalidBody(MethodArgumentNotValidException e, HttpServletRequest request) {
        String fields = e.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getField)
                .distinct()
                .collect(Collectors.joining(", "));
        return badRequest(request, fields.isEmpty() ? "Invalid request body" : "Invalid field(s): " + fields);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<GatewayError> unreadable(HttpMessageNotReadableException e, HttpServletRequest request) {
        return badRequest(request, "Malformed request body");
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<GatewayError> typeMismatch(MethodArgumentTypeMismatchException e, HttpServletRequest request) {
        return badRequest(request, "Invalid parameter: " + e.getName());
    }

    @ExceptionHandler(InvalidRequestException.class)
    public ResponseEntity<GatewayError> invalid(InvalidRequestException e, HttpServletRequest request) {
        return badRequest(request, e.getMessage());
    }

    @ExceptionHandler(CryptoUnavailableException.class)
    public ResponseEntity<GatewayError> cryptoUnavailable(CryptoUnavailableException e, HttpServletRequest request) {
        String cid = GatewayResponses.correlationId(request);
        log.warn("crypto unavailable cid={} path={}", cid, request.getRequestURI(), e);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(GatewayError.of(cid, "crypto_unavailable"));
    }

    private static ResponseEntity<GatewayError> badRequest(HttpServletRequest request, String message) {
        return ResponseEntity.badRequest()
                .body(GatewayError.of(GatewayResponses.correlationId(request), "invalid_request", message));
    }
}
