package com.shlokmestry.gateway.crypto;

public class CryptoUnavailableException extends RuntimeException {

    public CryptoUnavailableException(String message) {
        super(message);
    }

    public CryptoUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
