package com.libragraph.salvage.core.esm;

import com.libragraph.salvage.core.coverage.CoverageTracker;
import com.libragraph.salvage.core.diagnostic.DiagnosticKind;
import com.libragraph.salvage.core.diagnostic.Diagnostics;
import com.libragraph.salvage.core.diagnostic.Tally;
import com.libragraph.salvage.core.progress.ProgressEvent;
import com.libragraph.salvage.core.progress.ScanContext;
import com.libragraph.salvage.types.CoverageKind;
import com.libragraph.salvage.util.BigEndian;
import com.libragraph.salvage.util.buffer.BinaryData;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Finds ESM records anywhere in a dump.
 *
 * <p>Every offset whose four bytes form a known record tag is a candidate. A candidate that
 * validates is accepted and scanning resumes at its end; one that does not is recorded and
 * scanning resumes one byte later, so a corrupt record never hides a valid one after it.
 */
public class EsmScanner {

    private static final Logger log = Logger.getLogger(EsmScanner.class);

    public static final String COMPONENT = "esm";

    /**
     * Largest record data size that fits a single payload array.
     */
    public static final long MAX_RECORD_SIZE_LIMIT = Integer.MAX_VALUE - 8;

    static final int WINDOW_SIZE = 1 << 20;
    private static final long REPORT_INTERVAL = 16L << 20;

    private final long maxRecordSize;

    public EsmScanner(long maxRecordSize) {
        if (maxRecordSize < 1 || maxRecordSize > MAX_RECORD_SIZE_LIMIT) {
            throw new IllegalArgumentException("maxRecordSize must be in 1.." + MAX_RECORD_SIZE_LIMIT
                    + ", got " + maxRecordSize);
        }
        this.maxRecordSize = maxRecordSize;
    }

    public EsmScanResult scan(BinaryData data, CoverageTracker coverage, ScanContext ctx) {
        return scan(data, coverage, ctx, record -> { });
    }

    /**
     * @param onRecord called for each accepted record, in offset order, on the scanning thread
     */
    public EsmScanResult scan(BinaryData data, CoverageTracker coverage, ScanContext ctx,
                              Consumer<RawRecord> onRecord) {
        Diagnostics diagnostics = ctx.diagnostics();
        List<RawRecord> records = new ArrayList<>();
        List<RawRecord> duplicates = new ArrayList<>();
        List<GroupHeader> groups = new ArrayList<>();
        Set<Integer> seenFormIds = new HashSet<>();
        long found = 0;
        long rejected = 0;
        boolean complete = true;

        long size = data.size();
        long pos = 0;
        long windowStart = 0;
        byte[] window = new byte[0];
        long nextReport = REPORT_INTERVAL;

        while (pos + RecordHeader.SIZE <= size) {
            if (pos + RecordHeader.SIZE > windowStart + window.length) {
                if (ctx.cancelled()) {
                    complete = false;
                    break;
                }
                windowStart = pos;
                window = data.read(pos, WINDOW_SIZE);
            }
            if (pos >= nextReport) {
                ctx.report(ProgressEvent.progress(pos, size, COMPONENT, records.size() + " records"));
                nextReport = pos + REPORT_INTERVAL;
            }

            int i = (int) (pos - windowStart);
            RecordTypes.TagMatch match = RecordTypes.match(BigEndian.i32(window, i));
            if (match == null) {
                pos++;
                continue;
            }
            if (ctx.cancelled()) {
                complete = false;
                break;
            }

            if (RecordTypes.GROUP.equals(match.tag())) {
                GroupHeader group = GroupHeader.decode(window, i, pos);
                if (group.plausible(size - pos)) {
                    groups.add(group);
                    pos += RecordHeader.SIZE;
                } else {
                    pos++;
                }
                continue;
            }

            found++;
            RecordHeader header = RecordHeader.decode(window, i, match.tag(), match.reversed());
            RawRecord record;
            try {
                validate(header, pos, size);
                record = read(data, pos, header);
            } catch (MalformedRecordException e) {
                rejected++;
                diagnostics.record(e.kind(), pos, header.tag() + ": " + e.getMessage());
                pos++;
                continue;
            }

            if (!coverage.claim(record.range(), CoverageKind.RECORD, record.label())) {
                rejected++;
                diagnostics.record(DiagnosticKind.COVERAGE_CONFLICT, pos,
                        record.label() + " refused by coverage policy");
                pos++;
                continue;
            }

            if (seenFormIds.add(record.formId())) {
                records.add(record);
                onRecord.accept(record);
            } else {
                duplicates.add(record);
                diagnostics.record(DiagnosticKind.DUPLICATE_FORM_ID, pos,
                        record.label() + " already defined by an earlier record");
            }
            pos = record.end();
        }

        Tally tally = new Tally(COMPONENT, found, records.size(), rejected, duplicates.size());
        log.debugf("Scanned %d record candidates: %d records, %d duplicates, %d rejected, %d groups%s",
                found, records.size(), duplicates.size(), rejected, groups.size(),
                complete ? "" : ", cancelled");
        return new EsmScanResult(List.copyOf(records), List.copyOf(duplicates), List.copyOf(groups),
                diagnostics.snapshot(tally), complete);
    }

    private void validate(RecordHeader header, long pos, long size) throws MalformedRecordException {
        long dataSize = header.dataSize();
        if (dataSize < 1 || dataSize > maxRecordSize) {
            throw new MalformedRecordException(DiagnosticKind.RECORD_INVALID, "implausible data size " + dataSize);
        }
        if ((header.flags() & RecordHeader.FLAG_RESERVED_MASK) != 0 && !header.compressed()) {
            throw new MalformedRecordException(DiagnosticKind.RECORD_INVALID,
                    String.format("reserved flag bits set: 0x%08X", header.flags()));
        }
        int formId = header.formId();
        boolean fileHeader = RecordTypes.FILE_HEADER.equals(header.tag());
        if ((formId == 0 && !fileHeader) || formId == 0xFFFFFFFF || FormIds.looksLikeText(formId)) {
            throw new MalformedRecordException(DiagnosticKind.RECORD_INVALID,
                    "implausible FormID " + FormIds.hex(formId));
        }
        if (dataSize > size - pos - RecordHeader.SIZE) {
            throw new MalformedRecordException(DiagnosticKind.RECORD_OVERRUN,
                    "data size " + dataSize + " runs past end of buffer");
        }
    }

    private RawRecord read(BinaryData data, long pos, RecordHeader header) throws MalformedRecordException {
        byte[] payload = data.readExact(pos + RecordHeader.SIZE, (int) header.dataSize());
        if (header.compressed()) {
            payload = RecordPayloads.inflate(payload, maxRecordSize);
        }
        return new RawRecord(pos, header, List.copyOf(RecordPayloads.split(payload, header.reversed())));
    }
}
