package com.yoursp.clientstorage.service.storage.exception;

import lombok.Getter;

/**
 * Thrown when a reference does not resolve to a stored file in the client's
 * namespace.
 */
@Getter
public class StoredFileNotFoundException extends StorageException {

    private final String reference;

    public StoredFileNotFoundException(String reference) {
        super("File not found: " + reference);
        this.reference = reference;
    }
}
