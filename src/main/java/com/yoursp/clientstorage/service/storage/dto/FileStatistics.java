package com.yoursp.clientstorage.service.storage.dto;

import java.util.Map;

/**
 * Usage statistics of one client namespace, recomputed on every request.
 */
public record FileStatistics(
        long totalFiles,
        long totalSize,
        Map<String, CategoryStats> fileTypes,
        Map<String, Long> sizeBreakdown) {

    public static FileStatistics empty() {
        return new FileStatistics(0, 0, Map.of(), Map.of());
    }
}
