package com.yoursp.clientstorage.service.storage;

import com.yoursp.clientstorage.service.storage.dto.FileStatistics;
import com.yoursp.clientstorage.service.storage.dto.StoredFileRecord;

import java.nio.file.Path;
import java.util.List;

/**
 * Per-client file storage. Every operation is scoped to the namespace of
 * {@code clientId}; references are {@code filename} or {@code owner/filename}.
 * <p>
 * No locks are held across calls: a {@link #list} racing a {@link #delete}
 * may or may not include the deleted file.
 * </p>
 */
public interface StorageService {

    /**
     * Store a new file.
     *
     * @param clientId     client identity, must pass the key gate
     * @param originalName name supplied by the uploader
     * @param data         file content
     * @param mimeType     declared content type; blank falls back to the
     *                     extension
     * @param owner        optional owner sub-directory, may be {@code null}
     * @return metadata of the stored file
     */
    StoredFileRecord save(String clientId, String originalName, byte[] data, String mimeType, String owner);

    /**
     * All files of the client, flat files and one level of owner
     * directories. Empty when the client has never stored anything.
     */
    List<StoredFileRecord> list(String clientId);

    /**
     * Absolute path of a stored file.
     */
    Path fetchPath(String clientId, String reference);

    /**
     * Metadata of a stored file; {@code relativePath} always reflects where
     * the file actually lives, even when looked up by bare name.
     */
    StoredFileRecord info(String clientId, String reference);

    /**
     * Delete a stored file.
     */
    void delete(String clientId, String reference);

    /**
     * Aggregate usage of the client namespace.
     */
    FileStatistics statistics(String clientId);
}
