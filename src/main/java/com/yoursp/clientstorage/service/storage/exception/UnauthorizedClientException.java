package com.yoursp.clientstorage.service.storage.exception;

/**
 * Thrown when the client key gate rejects a key.
 */
public class UnauthorizedClientException extends RuntimeException {

    public UnauthorizedClientException(String message) {
        super(message);
    }
}
