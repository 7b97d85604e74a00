package com.libragraph.salvage.core.carve;

import com.libragraph.salvage.core.coverage.CoverageTracker;
import com.libragraph.salvage.core.diagnostic.DiagnosticKind;
import com.libragraph.salvage.core.diagnostic.Diagnostics;
import com.libragraph.salvage.core.diagnostic.Tally;
import com.libragraph.salvage.core.progress.ProgressEvent;
import com.libragraph.salvage.core.progress.ScanContext;
import com.libragraph.salvage.formats.api.DetectionCriteria;
import com.libragraph.salvage.formats.api.Extent;
import com.libragraph.salvage.formats.api.SignatureFormat;
import com.libragraph.salvage.formats.registry.FormatRegistry;
import com.libragraph.salvage.types.CoverageKind;
import com.libragraph.salvage.types.FileCategory;
import com.libragraph.salvage.util.buffer.BinaryData;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Finds embedded files by magic bytes, measures them with their format handler, and keeps
 * the non-overlapping subset favoring higher confidence, then earlier offset.
 *
 * <p>The buffer is read in fixed chunks that overlap by the longest magic reach, so a
 * signature straddling a chunk boundary is still seen exactly once.
 */
public class SignatureCarver {

    private static final Logger log = Logger.getLogger(SignatureCarver.class);

    public static final String COMPONENT = "carve";

    static final int CHUNK_SIZE = 1 << 20;

    private static final Comparator<Candidate> RESOLUTION_ORDER =
            Comparator.comparingInt((Candidate c) -> c.format.getDetectionCriteria().priority()).reversed()
                    .thenComparingLong(c -> c.offset)
                    .thenComparing(c -> c.format.id());

    private final FormatRegistry registry;
    private final int maxFilesPerFormat;

    public SignatureCarver(FormatRegistry registry, int maxFilesPerFormat) {
        this.registry = registry;
        this.maxFilesPerFormat = maxFilesPerFormat;
    }

    /**
     * Carves {@code data}, claiming accepted extents as {@link CoverageKind#CARVED_FILE}.
     *
     * @param categories categories to look for; empty means all
     */
    public CarveResult carve(BinaryData data, Set<FileCategory> categories,
                             CoverageTracker coverage, ScanContext ctx) {
        Diagnostics diagnostics = ctx.diagnostics();
        List<SignatureFormat> formats = registry.formatsFor(categories);
        if (formats.isEmpty() || data.size() == 0) {
            return new CarveResult(List.of(), diagnostics.snapshot(Tally.empty(COMPONENT)), true);
        }

        MagicIndex index = new MagicIndex(formats);
        Counters counters = new Counters();
        List<Candidate> candidates = new ArrayList<>();
        Map<String, Integer> perFormat = new HashMap<>();
        long size = data.size();
        boolean complete = true;

        scan:
        for (long chunkStart = 0; chunkStart < size; chunkStart += CHUNK_SIZE) {
            if (ctx.cancelled()) {
                complete = false;
                break;
            }
            byte[] window = data.read(chunkStart, CHUNK_SIZE + index.reach - 1);
            int limit = (int) Math.min(CHUNK_SIZE, size - chunkStart);
            for (int i = 0; i < limit; i++) {
                List<MagicEntry> entries = index.byFirstByte[window[i] & 0xFF];
                if (entries == null) continue;
                for (MagicEntry entry : entries) {
                    if (!entry.matches(window, i)) continue;
                    long offset = chunkStart + i - entry.criteria.magicOffset();
                    if (offset < 0) continue;
                    if (ctx.cancelled()) {
                        complete = false;
                        break scan;
                    }
                    counters.found++;
                    // capped matches are never measured
                    if (perFormat.getOrDefault(entry.format.id(), 0) >= maxFilesPerFormat) {
                        counters.rejected++;
                        diagnostics.record(DiagnosticKind.CANDIDATE_CAPPED, offset,
                                entry.format.id() + " cap of " + maxFilesPerFormat + " reached");
                        continue;
                    }
                    Candidate candidate = measure(data, entry.format, offset, counters, diagnostics);
                    if (candidate == null) continue;
                    perFormat.merge(entry.format.id(), 1, Integer::sum);
                    candidates.add(candidate);
                }
            }
            long scanned = Math.min(size, chunkStart + CHUNK_SIZE);
            ctx.report(ProgressEvent.progress(scanned, size, COMPONENT,
                    candidates.size() + " candidates"));
        }

        List<CarvedFile> files = resolve(data, candidates, coverage, counters, diagnostics);
        Tally tally = new Tally(COMPONENT, counters.found, counters.accepted, counters.rejected, 0);
        log.debugf("Carved %d files from %d candidates (%d rejected)%s",
                files.size(), counters.found, counters.rejected, complete ? "" : ", cancelled");
        return new CarveResult(files, diagnostics.snapshot(tally), complete);
    }

    private Candidate measure(BinaryData data, SignatureFormat format, long offset,
                              Counters counters, Diagnostics diagnostics) {
        DetectionCriteria criteria = format.getDetectionCriteria();
        Optional<Extent> extent = format.measure(data, offset);
        if (extent.isEmpty()) {
            counters.rejected++;
            diagnostics.record(DiagnosticKind.CANDIDATE_INVALID, offset, format.id() + " header invalid");
            return null;
        }
        long length = extent.get().length();
        if (length > data.size() - offset) {
            counters.rejected++;
            diagnostics.record(DiagnosticKind.CANDIDATE_OVERRUN, offset,
                    String.format("%s extent %d runs past end of buffer", format.id(), length));
            return null;
        }
        if (!criteria.acceptsSize(length)) {
            counters.rejected++;
            diagnostics.record(DiagnosticKind.CANDIDATE_INVALID, offset,
                    String.format("%s size %d outside [%d, %d]", format.id(), length,
                            criteria.minSize(), criteria.maxSize()));
            return null;
        }
        return new Candidate(format, offset, length, extent.get().name());
    }

    private List<CarvedFile> resolve(BinaryData data, List<Candidate> candidates, CoverageTracker coverage,
                                     Counters counters, Diagnostics diagnostics) {
        candidates.sort(RESOLUTION_ORDER);
        TreeMap<Long, Candidate> kept = new TreeMap<>();
        for (Candidate c : candidates) {
            Candidate blocker = overlapping(kept, c);
            if (blocker != null) {
                counters.rejected++;
                diagnostics.record(DiagnosticKind.CANDIDATE_OVERLAP, c.offset,
                        String.format("%s overlaps %s@0x%08X", c.format.id(), blocker.format.id(), blocker.offset));
                continue;
            }
            kept.put(c.offset, c);
        }

        List<CarvedFile> files = new ArrayList<>(kept.size());
        for (Candidate c : kept.values()) {
            CarvedFile file = new CarvedFile(c.offset, c.length, c.format.category(), c.format.id(),
                    c.format.getDetectionCriteria().priority(), c.name, data.hash(c.offset, c.length));
            if (!coverage.claim(file.range(), CoverageKind.CARVED_FILE, file.label())) {
                counters.rejected++;
                diagnostics.record(DiagnosticKind.COVERAGE_CONFLICT, c.offset,
                        file.label() + " refused by coverage policy");
                continue;
            }
            counters.accepted++;
            files.add(file);
        }
        return files;
    }

    private static Candidate overlapping(TreeMap<Long, Candidate> kept, Candidate c) {
        Map.Entry<Long, Candidate> before = kept.lowerEntry(c.offset + c.length);
        if (before != null && before.getValue().offset + before.getValue().length > c.offset) {
            return before.getValue();
        }
        return null;
    }

    private record Candidate(SignatureFormat format, long offset, long length, String name) {
    }

    private static final class Counters {
        long found;
        long accepted;
        long rejected;
    }

    private static final class MagicEntry {
        final SignatureFormat format;
        final DetectionCriteria criteria;
        final byte[] magic;

        MagicEntry(SignatureFormat format, byte[] magic) {
            this.format = format;
            this.criteria = format.getDetectionCriteria();
            this.magic = magic;
        }

        boolean matches(byte[] window, int index) {
            if (index + magic.length > window.length) return false;
            for (int i = 1; i < magic.length; i++) {
                if (window[index + i] != magic[i]) return false;
            }
            return true;
        }
    }

    /**
     * Magic table keyed by first byte. Positions are magic positions; the candidate offset is
     * the match position minus the format's magic offset.
     */
    private static final class MagicIndex {
        @SuppressWarnings("unchecked")
        final List<MagicEntry>[] byFirstByte = new List[256];
        final int reach;

        MagicIndex(List<SignatureFormat> formats) {
            int maxMagic = 1;
            for (SignatureFormat format : formats) {
                for (byte[] magic : format.getDetectionCriteria().magics()) {
                    int b = magic[0] & 0xFF;
                    if (byFirstByte[b] == null) byFirstByte[b] = new ArrayList<>();
                    byFirstByte[b].add(new MagicEntry(format, magic));
                    maxMagic = Math.max(maxMagic, magic.length);
                }
            }
            this.reach = maxMagic;
        }
    }
}
