package com.libragraph.salvage.core.analysis;

import com.libragraph.salvage.core.esm.EsmScanner;
import com.libragraph.salvage.core.strings.StringPoolSettings;

/**
 * Deployment-wide analysis limits, read from configuration by {@link AnalysisSettingsProducer}.
 *
 * @param maxRecordSize largest plausible record data size, at most {@link EsmScanner#MAX_RECORD_SIZE_LIMIT}
 * @param maxBufferSize largest buffer an analysis call accepts
 */
public record AnalysisSettings(
        int workerCount,
        int maxFilesPerType,
        long maxRecordSize,
        long maxBufferSize,
        StringPoolSettings strings
) {
    public static final int DEFAULT_WORKER_COUNT = 3;
    public static final int DEFAULT_MAX_FILES_PER_TYPE = 10_000;
    public static final long DEFAULT_MAX_RECORD_SIZE = 10_000_000L;
    public static final long DEFAULT_MAX_BUFFER_SIZE = 16L * 1024 * 1024 * 1024;

    public AnalysisSettings {
        if (workerCount < 2) {
            throw new IllegalArgumentException("workerCount must be >= 2, carving and record scanning run side by side");
        }
        if (maxFilesPerType < 1 || maxRecordSize < 1 || maxBufferSize < 1) {
            throw new IllegalArgumentException("Analysis limits must be positive");
        }
        if (maxRecordSize > EsmScanner.MAX_RECORD_SIZE_LIMIT) {
            throw new IllegalArgumentException("maxRecordSize " + maxRecordSize
                    + " exceeds the " + EsmScanner.MAX_RECORD_SIZE_LIMIT + " byte record limit");
        }
    }

    public static AnalysisSettings defaults() {
        return new AnalysisSettings(DEFAULT_WORKER_COUNT, DEFAULT_MAX_FILES_PER_TYPE,
                DEFAULT_MAX_RECORD_SIZE, DEFAULT_MAX_BUFFER_SIZE, StringPoolSettings.defaults());
    }
}
