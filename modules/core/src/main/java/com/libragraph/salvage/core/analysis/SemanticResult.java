package com.libragraph.salvage.core.analysis;

import com.libragraph.salvage.core.diagnostic.DiagnosticReport;
import com.libragraph.salvage.core.semantic.SemanticRecord;
import com.libragraph.salvage.core.xref.FormIdResolver;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * @param records              lifted records in offset order
 * @param formIdToDisplayName  best name per FormID, for records that have one
 */
public record SemanticResult(
        int totalRecordsReconstructed,
        List<SemanticRecord> records,
        Map<Integer, String> formIdToDisplayName,
        FormIdResolver resolver,
        DiagnosticReport diagnostics,
        boolean complete
) {
    public Map<String, Long> countsByTag() {
        Map<String, Long> counts = new TreeMap<>();
        for (SemanticRecord r : records) {
            counts.merge(r.tag(), 1L, Long::sum);
        }
        return counts;
    }

    public long genericCount() {
        return records.stream().filter(r -> r instanceof SemanticRecord.Generic).count();
    }
}
