package com.jordtransport.manifest.config;

import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Import limits and tuning, read from the {@code manifest.import} prefix.
 * <ul>
 *   <li>{@code max-file-size-bytes} - uploads above this are rejected before parsing (default 10 MB)</li>
 *   <li>{@code max-rows} - data rows above this are rejected after parsing</li>
 *   <li>{@code parallel-threshold} - files with at least this many rows are validated on the worker pool</li>
 *   <li>{@code worker-threads} - pool size; 0 means max(4, available processors)</li>
 *   <li>{@code data-sheet-name} - sheet read from .xlsx uploads when present</li>
 * </ul>
 */
@Slf4j
@Data
@ConfigurationProperties(prefix = "manifest.import")
public class ManifestProperties {

    public static final long DEFAULT_MAX_FILE_SIZE_BYTES = 10L * 1024 * 1024;
    public static final int DEFAULT_MAX_ROWS = 100_000;
    public static final int DEFAULT_PARALLEL_THRESHOLD = 500;

    /**
     * Largest upload that can be buffered in one byte array, leaving room for the one extra byte read to detect an oversized upload.
     */
    public static final long MAX_FILE_SIZE_CEILING = Integer.MAX_VALUE - 9;

    private long maxFileSizeBytes = DEFAULT_MAX_FILE_SIZE_BYTES;
    private int maxRows = DEFAULT_MAX_ROWS;
    private int parallelThreshold = DEFAULT_PARALLEL_THRESHOLD;
    private int workerThreads = 0;
    private String dataSheetName = "Data";

    @PostConstruct
    void validate() {
        if (maxFileSizeBytes <= 0) {
            log.warn("max-file-size-bytes must be positive (got {}), using {}", maxFileSizeBytes, DEFAULT_MAX_FILE_SIZE_BYTES);
            maxFileSizeBytes = DEFAULT_MAX_FILE_SIZE_BYTES;
        } else if (maxFileSizeBytes > MAX_FILE_SIZE_CEILING) {
            log.warn("max-file-size-bytes {} cannot be buffered, capping at {}", maxFileSizeBytes, MAX_FILE_SIZE_CEILING);
            maxFileSizeBytes = MAX_FILE_SIZE_CEILING;
        }
        if (maxRows <= 0) {
            log.warn("max-rows must be positive (got {}), using {}", maxRows, DEFAULT_MAX_ROWS);
            maxRows = DEFAULT_MAX_ROWS;
        }
        if (parallelThreshold <= 0) {
            log.warn("parallel-threshold must be positive (got {}), using {}", parallelThreshold, DEFAULT_PARALLEL_THRESHOLD);
            parallelThreshold = DEFAULT_PARALLEL_THRESHOLD;
        }
        if (workerThreads < 0) {
            log.warn("worker-threads must not be negative (got {}), sizing from available processors", workerThreads);
            workerThreads = 0;
        }
    }

    public int resolveWorkerThreads() {
        return workerThreads > 0 ? workerThreads : Math.max(4, Runtime.getRuntime().availableProcessors());
    }
}
