package com.libragraph.salvage.core.analysis;

import com.libragraph.salvage.core.carve.CarvedFile;
import com.libragraph.salvage.core.coverage.ReconciledCoverage;
import com.libragraph.salvage.core.diagnostic.DiagnosticReport;
import com.libragraph.salvage.core.esm.GroupHeader;
import com.libragraph.salvage.core.esm.RawRecord;
import com.libragraph.salvage.core.strings.StringPool;

import java.util.List;
import java.util.Map;

/**
 * Everything one analysis pass found.
 *
 * @param formIds  FormID to record, built from raw records before any lifting
 * @param coverage terminal coverage map
 * @param complete false when the pass was cancelled; all contents are still fully validated
 */
public record AnalysisResult(
        long bufferSize,
        List<CarvedFile> carvedFiles,
        List<RawRecord> records,
        List<RawRecord> duplicateRecords,
        List<GroupHeader> groups,
        Map<Integer, RawRecord> formIds,
        StringPool stringPool,
        ReconciledCoverage coverage,
        DiagnosticReport diagnostics,
        boolean complete
) {
}
