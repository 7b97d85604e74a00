package com.libragraph.salvage.core.analysis;

import com.libragraph.salvage.core.carve.CarveResult;
import com.libragraph.salvage.core.carve.CarvedFile;
import com.libragraph.salvage.core.carve.SignatureCarver;
import com.libragraph.salvage.core.coverage.CoverageTracker;
import com.libragraph.salvage.core.coverage.ReconciledCoverage;
import com.libragraph.salvage.core.diagnostic.DiagnosticReport;
import com.libragraph.salvage.core.diagnostic.Diagnostics;
import com.libragraph.salvage.core.diagnostic.Tally;
import com.libragraph.salvage.core.esm.EsmScanResult;
import com.libragraph.salvage.core.esm.EsmScanner;
import com.libragraph.salvage.core.esm.RawRecord;
import com.libragraph.salvage.core.progress.CancellationToken;
import com.libragraph.salvage.core.progress.ProgressEvent;
import com.libragraph.salvage.core.progress.ProgressSink;
import com.libragraph.salvage.core.progress.ScanContext;
import com.libragraph.salvage.core.semantic.LiftingRegistry;
import com.libragraph.salvage.core.semantic.SemanticRecord;
import com.libragraph.salvage.core.strings.StringCrossReference;
import com.libragraph.salvage.core.strings.StringPool;
import com.libragraph.salvage.core.strings.StringPoolExtractor;
import com.libragraph.salvage.core.strings.StringPoolSettings;
import com.libragraph.salvage.core.xref.FormIdIndex;
import com.libragraph.salvage.core.xref.FormIdResolver;
import com.libragraph.salvage.formats.registry.FormatRegistry;
import com.libragraph.salvage.types.StringCategory;
import com.libragraph.salvage.util.buffer.BinaryData;
import com.libragraph.salvage.util.buffer.BufferAccessException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Entry points of the forensic engine.
 *
 * <p>An analysis pass carves files and scans for records in parallel over the same buffer,
 * then extracts strings from what neither claimed, then reconciles coverage. Reconstruction
 * lifts the raw records of a finished pass and builds the FormID resolver.
 */
@ApplicationScoped
public class AnalysisService {

    private static final Logger log = Logger.getLogger(AnalysisService.class);

    private static final int RECONSTRUCT_REPORT_INTERVAL = 1000;

    @Inject
    FormatRegistry formatRegistry;

    @Inject
    @Named("analysisExecutor")
    ExecutorService executor;

    @Inject
    AnalysisSettings settings;

    private final LiftingRegistry liftingRegistry = LiftingRegistry.standard();

    AnalysisService() {
    }

    public AnalysisService(FormatRegistry formatRegistry, ExecutorService executor, AnalysisSettings settings) {
        this.formatRegistry = formatRegistry;
        this.executor = executor;
        this.settings = settings;
    }

    public AnalysisResult analyze(BinaryData buffer, AnalysisOptions options) {
        return analyze(buffer, options, ProgressSink.NONE, CancellationToken.none());
    }

    /**
     * Runs a full analysis pass.
     *
     * @throws AnalysisException when the buffer cannot be addressed or read
     */
    public AnalysisResult analyze(BinaryData buffer, AnalysisOptions options,
                                  ProgressSink sink, CancellationToken cancellation) {
        ScanContext ctx = new ScanContext(sink, cancellation, new Diagnostics("analysis", options.verbose()));
        long size = buffer.size();
        if (size > settings.maxBufferSize()) {
            AnalysisException e = new AnalysisException(0, "analyze",
                    String.format("Buffer of %d bytes exceeds the %d byte limit", size, settings.maxBufferSize()));
            fail(ctx, "analyze", e);
            throw e;
        }

        log.infof("Analyzing %d bytes (types=%s, strings=%s)", size,
                options.fileTypes().isEmpty() ? "all" : options.fileTypes(), options.extractStrings());
        CoverageTracker coverage = new CoverageTracker(size);
        // Lets a failure in one scanner stop the other without touching the caller's token
        CancellationToken passToken = CancellationToken.linkedTo(cancellation);

        ScanContext carveCtx = new ScanContext(sink, passToken,
                new Diagnostics(SignatureCarver.COMPONENT, options.verbose()));
        ScanContext esmCtx = new ScanContext(sink, passToken,
                new Diagnostics(EsmScanner.COMPONENT, options.verbose()));
        SignatureCarver carver = new SignatureCarver(formatRegistry, settings.maxFilesPerType());
        EsmScanner scanner = new EsmScanner(settings.maxRecordSize());

        try {
            CompletionService<Object> scans = new ExecutorCompletionService<>(executor);
            Future<Object> carving = scans.submit(
                    () -> carver.carve(buffer, options.fileTypes(), coverage, carveCtx));
            Future<Object> scanning = scans.submit(
                    () -> scanner.scan(buffer, coverage, esmCtx));
            awaitBoth(scans, carving, passToken);

            CarveResult carved = (CarveResult) await(carving, SignatureCarver.COMPONENT);
            EsmScanResult scanned = (EsmScanResult) await(scanning, EsmScanner.COMPONENT);

            StringPool pool = StringPool.empty();
            if (options.extractStrings()) {
                ScanContext stringCtx = new ScanContext(sink, cancellation,
                        new Diagnostics(StringPoolExtractor.COMPONENT, options.verbose()));
                pool = new StringPoolExtractor().extract(buffer, size, settings.strings(), coverage,
                        options.stringCategories(), stringCtx);
                pool = crossReference(pool, carved.files());
            }

            ReconciledCoverage reconciled = coverage.reconcile(ctx.diagnostics());

            DiagnosticReport diagnostics = Diagnostics.combine(List.of(
                    carved.diagnostics(), scanned.diagnostics(), pool.diagnostics(),
                    ctx.diagnostics().snapshot(List.of())));
            boolean complete = carved.complete() && scanned.complete() && pool.complete();

            Map<Integer, RawRecord> formIds = new LinkedHashMap<>();
            for (RawRecord r : scanned.records()) {
                formIds.put(r.formId(), r);
            }

            AnalysisResult result = new AnalysisResult(size, carved.files(), scanned.records(),
                    scanned.duplicates(), scanned.groups(), Collections.unmodifiableMap(formIds), pool,
                    reconciled, diagnostics, complete);

            log.infof("Analysis %s: %d carved files, %d records (%d duplicates), %d strings, %.2f%% covered",
                    complete ? "complete" : "cancelled", carved.files().size(), scanned.records().size(),
                    scanned.duplicates().size(), pool.entries().size(), reconciled.summary().claimedPercent());
            ctx.report(ProgressEvent.completed(size, size, "analyze",
                    complete ? "Analysis complete" : "Analysis cancelled"));
            return result;
        } catch (AnalysisException e) {
            fail(ctx, "analyze", e);
            throw e;
        } catch (BufferAccessException e) {
            AnalysisException wrapped = new AnalysisException(e.offset(), e.operation(), e.getMessage(), e);
            fail(ctx, "analyze", wrapped);
            throw wrapped;
        }
    }

    public SemanticResult reconstruct(AnalysisResult analysis) {
        return reconstruct(analysis, ProgressSink.NONE, CancellationToken.none());
    }

    /**
     * Lifts the raw records of {@code analysis} and builds the resolver over them.
     * Runs on the calling thread.
     */
    public SemanticResult reconstruct(AnalysisResult analysis, ProgressSink sink, CancellationToken cancellation) {
        ScanContext ctx = new ScanContext(sink, cancellation, new Diagnostics("reconstruct", false));
        List<RawRecord> raw = analysis.records();
        FormIdIndex<RawRecord> rawIndex = FormIdIndex.of(raw, RawRecord::formId);
        FormIdIndex<SemanticRecord> semanticIndex = new FormIdIndex<>();
        List<SemanticRecord> lifted = new ArrayList<>(raw.size());
        Map<Integer, String> names = new LinkedHashMap<>();
        boolean complete = analysis.complete();

        for (RawRecord record : raw) {
            if (ctx.cancelled()) {
                complete = false;
                break;
            }
            SemanticRecord semantic = liftingRegistry.lift(record, ctx.diagnostics());
            lifted.add(semantic);
            semanticIndex.register(semantic.formId(), semantic);
            semantic.bestName().ifPresent(name -> names.put(semantic.formId(), name));
            if (lifted.size() % RECONSTRUCT_REPORT_INTERVAL == 0) {
                ctx.report(ProgressEvent.progress(lifted.size(), raw.size(), "reconstruct", record.label()));
            }
        }

        Tally tally = new Tally("reconstruct", lifted.size(), lifted.size(), 0, 0);
        FormIdResolver resolver = new FormIdResolver(rawIndex, semanticIndex);
        SemanticResult result = new SemanticResult(lifted.size(), List.copyOf(lifted),
                Collections.unmodifiableMap(names), resolver, ctx.diagnostics().snapshot(tally), complete);
        log.infof("Reconstructed %d of %d records (%d generic, %d named)",
                lifted.size(), raw.size(), result.genericCount(), names.size());
        ctx.report(ProgressEvent.completed(lifted.size(), raw.size(), "reconstruct",
                complete ? "Reconstruction complete" : "Reconstruction cancelled"));
        return result;
    }

    public StringPool extractStringPoolOnly(BinaryData accessor, long size, StringPoolSettings info,
                                            CoverageTracker coverage, Set<StringCategory> filter) {
        return extractStringPoolOnly(accessor, size, info, coverage, filter,
                ProgressSink.NONE, CancellationToken.none());
    }

    /**
     * Extracts strings from the regions {@code coverage} leaves unclaimed, without carving or
     * record scanning. Strings found are claimed in {@code coverage}.
     */
    public StringPool extractStringPoolOnly(BinaryData accessor, long size, StringPoolSettings info,
                                            CoverageTracker coverage, Set<StringCategory> filter,
                                            ProgressSink sink, CancellationToken cancellation) {
        ScanContext ctx = new ScanContext(sink, cancellation, new Diagnostics(StringPoolExtractor.COMPONENT, false));
        try {
            StringPool pool = new StringPoolExtractor().extract(accessor, size, info, coverage, filter, ctx);
            ctx.report(ProgressEvent.completed(pool.bytesScanned(), size, StringPoolExtractor.COMPONENT,
                    pool.entries().size() + " strings"));
            return pool;
        } catch (BufferAccessException e) {
            AnalysisException wrapped = new AnalysisException(e.offset(), e.operation(), e.getMessage(), e);
            fail(ctx, StringPoolExtractor.COMPONENT, wrapped);
            throw wrapped;
        }
    }

    /**
     * Attaches carved-file provenance to the strings of {@code pool}.
     */
    public StringPool crossReference(StringPool pool, List<CarvedFile> carvedFiles) {
        return StringCrossReference.link(pool, carvedFiles, settings.strings().provenanceWindow());
    }

    /**
     * Waits for both scans in completion order. The first failure cancels the pass, the other
     * scan is still drained, and the first failure is rethrown with any later one suppressed.
     */
    private static void awaitBoth(CompletionService<Object> scans, Future<Object> carving,
                                  CancellationToken passToken) {
        AnalysisException failure = null;
        for (int remaining = 2; remaining > 0; remaining--) {
            Future<Object> done;
            try {
                done = scans.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                passToken.cancel();
                throw new AnalysisException(-1, "analyze", "Interrupted while waiting for scans", e);
            }
            try {
                await(done, done == carving ? SignatureCarver.COMPONENT : EsmScanner.COMPONENT);
            } catch (AnalysisException e) {
                if (failure == null) {
                    failure = e;
                    passToken.cancel();
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
    }

    private static <T> T await(Future<T> future, String operation) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AnalysisException(-1, operation, "Interrupted while waiting for " + operation, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof BufferAccessException) {
                BufferAccessException access = (BufferAccessException) cause;
                throw new AnalysisException(access.offset(), access.operation(), access.getMessage(), access);
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new AnalysisException(-1, operation, operation + " failed: " + cause, cause);
        }
    }

    private static void fail(ScanContext ctx, String label, AnalysisException e) {
        log.errorf(e, "%s failed at offset %d during %s", label, e.offset(), e.operation());
        ctx.report(ProgressEvent.failed(label, e.getMessage()));
    }
}
