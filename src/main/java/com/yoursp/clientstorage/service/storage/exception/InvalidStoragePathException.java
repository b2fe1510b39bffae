package com.yoursp.clientstorage.service.storage.exception;

/**
 * Thrown for malformed input: blank names, traversal sequences, references
 * that would escape the client namespace.
 */
public class InvalidStoragePathException extends StorageException {

    public InvalidStoragePathException(String message) {
        super(message);
    }
}
