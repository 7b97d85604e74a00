package com.libragraph.salvage.core.carve;

import com.libragraph.salvage.core.diagnostic.DiagnosticReport;
import com.libragraph.salvage.types.FileCategory;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * @param files    accepted files in offset order
 * @param complete false when the scan stopped on cancellation
 */
public record CarveResult(List<CarvedFile> files, DiagnosticReport diagnostics, boolean complete) {

    public Map<FileCategory, Long> countsByCategory() {
        Map<FileCategory, Long> counts = new EnumMap<>(FileCategory.class);
        for (CarvedFile f : files) {
            counts.merge(f.category(), 1L, Long::sum);
        }
        return counts;
    }
}
