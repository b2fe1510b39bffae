package com.yoursp.clientstorage.service.storage.dto;

/**
 * Per-category aggregate. {@code percentage} is the category's share of the
 * file count, 0-100 with two decimals.
 */
public record CategoryStats(
        long count,
        long totalSize,
        double percentage) {
}
