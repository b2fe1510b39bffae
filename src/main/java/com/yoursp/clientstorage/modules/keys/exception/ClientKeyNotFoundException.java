package com.yoursp.clientstorage.modules.keys.exception;

import lombok.Getter;

/**
 * Thrown when an admin operation targets an unknown client key id.
 */
@Getter
public class ClientKeyNotFoundException extends RuntimeException {

    private final long id;

    public ClientKeyNotFoundException(long id) {
        super("Client key not found: " + id);
        this.id = id;
    }
}
