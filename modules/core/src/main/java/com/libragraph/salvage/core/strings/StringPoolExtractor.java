package com.libragraph.salvage.core.strings;

import com.libragraph.salvage.core.coverage.ByteRange;
import com.libragraph.salvage.core.coverage.CoverageTracker;
import com.libragraph.salvage.core.diagnostic.DiagnosticKind;
import com.libragraph.salvage.core.diagnostic.Diagnostics;
import com.libragraph.salvage.core.diagnostic.Tally;
import com.libragraph.salvage.core.progress.ProgressEvent;
import com.libragraph.salvage.core.progress.ScanContext;
import com.libragraph.salvage.types.CoverageKind;
import com.libragraph.salvage.types.StringCategory;
import com.libragraph.salvage.util.buffer.BinaryData;
import org.jboss.logging.Logger;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Pulls NUL-terminated printable ASCII runs out of the regions no other component claimed,
 * classifies them, and claims them as {@link CoverageKind#STRING_POOL}.
 *
 * <p>A run that hits the end of its region without a terminator is dropped.
 */
public class StringPoolExtractor {

    private static final Logger log = Logger.getLogger(StringPoolExtractor.class);

    public static final String COMPONENT = "strings";

    static final int READ_CHUNK = 64 * 1024;

    /**
     * @param size       scan limit; regions beyond it are ignored
     * @param categories categories to keep; empty keeps all
     */
    public StringPool extract(BinaryData data, long size, StringPoolSettings settings,
                              CoverageTracker coverage, Set<StringCategory> categories, ScanContext ctx) {
        long limit = Math.min(size, data.size());
        Run run = new Run(settings, categories, coverage, ctx.diagnostics());
        long regions = 0;
        long bytes = 0;
        boolean complete = true;

        regionLoop:
        for (ByteRange gap : coverage.gaps()) {
            if (gap.start() >= limit) break;
            ByteRange region = new ByteRange(gap.start(), Math.min(gap.end(), limit));
            regions++;
            bytes += region.length();
            run.enter(region);
            for (long pos = region.start(); pos < region.end(); pos += READ_CHUNK) {
                if (ctx.cancelled()) {
                    complete = false;
                    break regionLoop;
                }
                byte[] chunk = data.read(pos, (int) Math.min(READ_CHUNK, region.end() - pos));
                run.feed(pos, chunk);
            }
            ctx.report(ProgressEvent.progress(region.end(), limit, COMPONENT, run.kept.size() + " strings"));
        }

        Tally tally = new Tally(COMPONENT, run.found, run.kept.size(), run.rejected, 0);
        log.debugf("Extracted %d strings from %d regions (%d bytes)%s",
                run.kept.size(), regions, bytes, complete ? "" : ", cancelled");
        return new StringPool(List.copyOf(run.kept), regions, bytes, ctx.diagnostics().snapshot(tally), complete);
    }

    /**
     * Run accumulator carried across chunk boundaries within one region.
     */
    private static final class Run {
        private final StringPoolSettings settings;
        private final Set<StringCategory> categories;
        private final CoverageTracker coverage;
        private final Diagnostics diagnostics;
        private final byte[] buffer;
        private final List<StringPoolEntry> kept = new ArrayList<>();
        private ByteRange region;
        private long start = -1;
        private int length;
        private boolean overflow;
        private long found;
        private long rejected;

        Run(StringPoolSettings settings, Set<StringCategory> categories, CoverageTracker coverage,
            Diagnostics diagnostics) {
            this.settings = settings;
            this.categories = categories;
            this.coverage = coverage;
            this.diagnostics = diagnostics;
            this.buffer = new byte[settings.maxLength()];
        }

        void enter(ByteRange region) {
            this.region = region;
            this.start = -1;
        }

        void feed(long base, byte[] chunk) {
            for (int i = 0; i < chunk.length; i++) {
                int b = chunk[i] & 0xFF;
                if (b >= 0x20 && b <= 0x7E) {
                    if (start < 0) {
                        start = base + i;
                        length = 0;
                        overflow = false;
                    }
                    if (length < buffer.length) {
                        buffer[length++] = (byte) b;
                    } else {
                        overflow = true;
                    }
                    continue;
                }
                if (b == 0 && start >= 0 && !overflow && length >= settings.minLength()) {
                    emit();
                }
                start = -1;
            }
        }

        private void emit() {
            found++;
            String text = new String(buffer, 0, length, StandardCharsets.US_ASCII);
            StringCategory category = StringClassifier.classify(text);
            if (!categories.isEmpty() && !categories.contains(category)) {
                rejected++;
                return;
            }
            StringPoolEntry entry = new StringPoolEntry(start, text, category, region, null);
            if (!coverage.claim(entry.range(), CoverageKind.STRING_POOL, category.label())) {
                rejected++;
                diagnostics.record(DiagnosticKind.COVERAGE_CONFLICT, start, "string refused by coverage policy");
                return;
            }
            kept.add(entry);
        }
    }
}
