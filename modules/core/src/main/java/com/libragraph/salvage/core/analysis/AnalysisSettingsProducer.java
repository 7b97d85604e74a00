package com.libragraph.salvage.core.analysis;

import com.libragraph.salvage.core.strings.StringPoolSettings;
import io.quarkus.runtime.Startup;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;

@ApplicationScoped
public class AnalysisSettingsProducer {

    @ConfigProperty(name = "salvage.analysis.worker-count", defaultValue = "3")
    int workerCount;

    @ConfigProperty(name = "salvage.analysis.max-buffer-bytes", defaultValue = "17179869184")
    long maxBufferSize;

    @ConfigProperty(name = "salvage.carve.max-files-per-type", defaultValue = "10000")
    int maxFilesPerType;

    @ConfigProperty(name = "salvage.esm.max-record-size", defaultValue = "10000000")
    long maxRecordSize;

    @ConfigProperty(name = "salvage.strings.min-length", defaultValue = "4")
    int minStringLength;

    @ConfigProperty(name = "salvage.strings.max-length", defaultValue = "512")
    int maxStringLength;

    @ConfigProperty(name = "salvage.strings.provenance-window", defaultValue = "256")
    long provenanceWindow;

    /**
     * Built eagerly so an out-of-range limit fails boot instead of the first analysis.
     */
    @Produces
    @Singleton
    @Startup
    public AnalysisSettings analysisSettings() {
        return new AnalysisSettings(workerCount, maxFilesPerType, maxRecordSize, maxBufferSize,
                new StringPoolSettings(minStringLength, maxStringLength, provenanceWindow));
    }
}
