package com.yoursp.clientstorage.service.storage;

import java.nio.file.Path;

/**
 * Maps a client identity and a logical file reference to a physical path
 * below the storage root. Implementations reject traversal attempts with
 * {@link com.yoursp.clientstorage.service.storage.exception.InvalidStoragePathException}
 * and missing files with
 * {@link com.yoursp.clientstorage.service.storage.exception.StoredFileNotFoundException}.
 */
public interface PathResolver {

    /**
     * Directory of the client's namespace. Not required to exist.
     */
    Path clientRoot(String clientId);

    /**
     * Directory that receives new files: the client root, or the owner
     * sub-directory when {@code owner} is non-blank. Not required to exist.
     */
    Path targetDirectory(String clientId, String owner);

    /**
     * Locate an existing regular file.
     *
     * @param reference {@code filename} or {@code owner/filename}
     */
    Path resolve(String clientId, String reference);
}
