package com.libragraph.salvage.api;

import com.libragraph.salvage.core.analysis.AnalysisException;
import com.libragraph.salvage.core.analysis.AnalysisOptions;
import com.libragraph.salvage.core.analysis.AnalysisResult;
import com.libragraph.salvage.core.analysis.AnalysisService;
import com.libragraph.salvage.core.analysis.SemanticResult;
import com.libragraph.salvage.core.coverage.CoverageSummary;
import com.libragraph.salvage.types.FileCategory;
import com.libragraph.salvage.util.buffer.BinaryData;
import com.libragraph.salvage.util.buffer.BufferAccessException;
import jakarta.inject.Inject;
import jakarta.ws.rs.BadRequestException;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.NotFoundException;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Runs a full pass over a dump file on the server's disk and returns counts.
 */
@Path("/api/analysis")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class AnalysisResource {

    private static final Logger log = Logger.getLogger(AnalysisResource.class);

    @Inject
    AnalysisService analysisService;

    @POST
    public AnalysisSummary analyze(AnalysisRequest request) {
        if (request == null || request.path() == null || request.path().isBlank()) {
            throw new BadRequestException("path is required");
        }
        java.nio.file.Path file = java.nio.file.Path.of(request.path());
        if (!Files.isRegularFile(file)) {
            throw new NotFoundException("No such dump: " + request.path());
        }

        AnalysisOptions options = AnalysisOptions.defaults()
                .withFileTypes(categories(request.categories()))
                .withVerbose(Boolean.TRUE.equals(request.verbose()));
        if (Boolean.FALSE.equals(request.strings())) {
            options = options.withoutStrings();
        }

        try (BinaryData data = open(file)) {
            AnalysisResult analysis = analysisService.analyze(data, options);
            SemanticResult semantic = analysisService.reconstruct(analysis);
            return summarize(request.path(), analysis, semantic);
        } catch (IOException e) {
            log.errorf(e, "Failed to close %s", file);
            throw new UncheckedIOException("Failed to close " + file, e);
        }
    }

    private static BinaryData open(java.nio.file.Path file) {
        try {
            return BinaryData.open(file);
        } catch (BufferAccessException e) {
            throw new AnalysisException(e.offset(), e.operation(), e.getMessage(), e);
        }
    }

    private static Set<FileCategory> categories(List<String> labels) {
        if (labels == null || labels.isEmpty()) {
            return Set.of();
        }
        Set<FileCategory> categories = EnumSet.noneOf(FileCategory.class);
        for (String label : labels) {
            try {
                categories.add(FileCategory.fromLabel(label));
            } catch (IllegalArgumentException e) {
                throw new BadRequestException(e.getMessage(), e);
            }
        }
        return categories;
    }

    static AnalysisSummary summarize(String path, AnalysisResult analysis, SemanticResult semantic) {
        Map<String, Long> carved = new TreeMap<>();
        analysis.carvedFiles().forEach(f -> carved.merge(f.category().label(), 1L, Long::sum));

        Map<String, Long> strings = new TreeMap<>();
        analysis.stringPool().countsByCategory().forEach((c, n) -> strings.put(c.label(), n));

        CoverageSummary cov = analysis.coverage().summary();
        Map<String, Long> byKind = new LinkedHashMap<>();
        cov.bytesByKind().forEach((k, n) -> byKind.put(k.label(), n));

        Map<String, Long> diagnostics = new TreeMap<>();
        analysis.diagnostics().counts().forEach((k, n) -> diagnostics.put(k.name(), n));
        semantic.diagnostics().counts().forEach((k, n) -> diagnostics.merge(k.name(), n, Long::sum));

        return new AnalysisSummary(
                path,
                analysis.bufferSize(),
                analysis.complete() && semantic.complete(),
                carved,
                analysis.records().size(),
                analysis.duplicateRecords().size(),
                analysis.groups().size(),
                semantic.countsByTag(),
                semantic.formIdToDisplayName().size(),
                strings,
                analysis.stringPool().linkedToCarvedFiles(),
                new AnalysisSummary.Coverage(cov.claimedBytes(), cov.claimedPercent(), cov.gapCount(),
                        cov.gapBytes(), byKind),
                diagnostics,
                analysis.diagnostics().droppedEntries() + semantic.diagnostics().droppedEntries());
    }
}
