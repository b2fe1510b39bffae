package com.yoursp.clientstorage.service.storage.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

import java.time.Instant;

/**
 * Metadata of one stored file. Every field is derived from the file's path
 * and attributes, so the same file yields the same record from save, list and
 * info.
 */
@Getter
@Builder
@AllArgsConstructor
public class StoredFileRecord {

    /** Physical file name, {@code <timestamp>_<disambiguator>_<originalName>}. */
    private final String storedName;
    private final String originalName;
    /** Owner sub-directory, {@code null} for flat files. */
    private final String owner;
    /** {@code storedName} or {@code owner/storedName}. */
    private final String relativePath;
    private final long size;
    private final String mimeType;
    private final String category;
    private final Instant uploadedAt;
    private final String downloadUrl;
    private final String publicUrl;
}
