package com.yoursp.clientstorage.service.storage.exception;

/**
 * Unexpected filesystem failure (disk full, permission denied, ...).
 * The message may contain physical paths and must not be returned to callers.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
