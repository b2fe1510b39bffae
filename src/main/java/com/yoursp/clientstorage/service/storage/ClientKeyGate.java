package com.yoursp.clientstorage.service.storage;

/**
 * Decides whether an opaque client key may use the storage engine.
 * The engine never looks inside the key.
 */
@FunctionalInterface
public interface ClientKeyGate {

    /**
     * @param key opaque client key, may be {@code null}
     * @return {@code true} when the key exists and is active
     */
    boolean isAuthorized(String key);
}
