package com.yoursp.clientstorage.service.storage;

import com.yoursp.clientstorage.service.storage.dto.CategoryStats;
import com.yoursp.clientstorage.service.storage.dto.FileStatistics;
import com.yoursp.clientstorage.service.storage.dto.StoredFileRecord;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Folds a namespace listing into {@link FileStatistics}.
 * <p>
 * Only categories and size buckets that contain at least one file are
 * reported. Buckets keep their ascending order, categories are sorted by name.
 * </p>
 */
@Component
public class FileStatisticsAggregator {

    private static final long MB = 1024L * 1024L;

    static final String BUCKET_UP_TO_1MB = "0-1MB";
    static final String BUCKET_UP_TO_10MB = "1-10MB";
    static final String BUCKET_UP_TO_100MB = "10-100MB";
    static final String BUCKET_OVER_100MB = "100MB+";

    private static final List<String> BUCKET_ORDER = List.of(
            BUCKET_UP_TO_1MB, BUCKET_UP_TO_10MB, BUCKET_UP_TO_100MB, BUCKET_OVER_100MB);

    public FileStatistics aggregate(List<StoredFileRecord> records) {
        if (records == null || records.isEmpty()) {
            return FileStatistics.empty();
        }

        long totalSize = 0;
        Map<String, long[]> perCategory = new TreeMap<>();
        Map<String, Long> bucketCounts = new LinkedHashMap<>();

        for (StoredFileRecord record : records) {
            totalSize += record.getSize();

            long[] acc = perCategory.computeIfAbsent(record.getCategory(), k -> new long[2]);
            acc[0]++;
            acc[1] += record.getSize();

            bucketCounts.merge(bucketOf(record.getSize()), 1L, Long::sum);
        }

        int totalFiles = records.size();
        Map<String, CategoryStats> fileTypes = new LinkedHashMap<>();
        perCategory.forEach((category, acc) ->
                fileTypes.put(category, new CategoryStats(acc[0], acc[1], percentage(acc[0], totalFiles))));

        Map<String, Long> sizeBreakdown = new LinkedHashMap<>();
        for (String bucket : BUCKET_ORDER) {
            Long count = bucketCounts.get(bucket);
            if (count != null) {
                sizeBreakdown.put(bucket, count);
            }
        }

        return new FileStatistics(totalFiles, totalSize, fileTypes, sizeBreakdown);
    }

    static String bucketOf(long size) {
        if (size < MB) {
            return BUCKET_UP_TO_1MB;
        }
        if (size < 10 * MB) {
            return BUCKET_UP_TO_10MB;
        }
        if (size < 100 * MB) {
            return BUCKET_UP_TO_100MB;
        }
        return BUCKET_OVER_100MB;
    }

    private static double percentage(long count, long total) {
        return BigDecimal.valueOf(count * 100.0 / total)
                .setScale(2, RoundingMode.HALF_UP)
                .doubleValue();
    }
}
