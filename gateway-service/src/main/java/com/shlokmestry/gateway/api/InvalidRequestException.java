package com.shlokmestry.gateway.api;

/**
 * Input that passed binding but is not acceptable, e.g. an unknown reset action.
 * Rendered as 400 by {@link ApiExceptionHandler}.
 */
public class InvalidRequestException extends RuntimeException {

    public InvalidRequestException(String message) {
        super(message);
    }
}
