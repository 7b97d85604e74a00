package com.libragraph.salvage.core.strings;

import com.libragraph.salvage.core.diagnostic.DiagnosticReport;
import com.libragraph.salvage.types.StringCategory;

import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Strings recovered from unclaimed territory, in offset order.
 *
 * @param regionsScanned number of unclaimed regions walked
 * @param bytesScanned   total size of those regions
 * @param complete       false when extraction stopped on cancellation
 */
public record StringPool(
        List<StringPoolEntry> entries,
        long regionsScanned,
        long bytesScanned,
        DiagnosticReport diagnostics,
        boolean complete
) {
    public static StringPool empty() {
        return new StringPool(List.of(), 0, 0, DiagnosticReport.empty(), true);
    }

    public Map<StringCategory, Long> countsByCategory() {
        Map<StringCategory, Long> counts = new EnumMap<>(StringCategory.class);
        for (StringPoolEntry e : entries) {
            counts.merge(e.category(), 1L, Long::sum);
        }
        return counts;
    }

    public Map<StringCategory, Long> uniqueCountsByCategory() {
        Map<StringCategory, Set<String>> seen = new EnumMap<>(StringCategory.class);
        for (StringPoolEntry e : entries) {
            seen.computeIfAbsent(e.category(), c -> new HashSet<>()).add(e.text());
        }
        Map<StringCategory, Long> counts = new EnumMap<>(StringCategory.class);
        seen.forEach((c, texts) -> counts.put(c, (long) texts.size()));
        return counts;
    }

    public List<StringPoolEntry> ofCategory(StringCategory category) {
        return entries.stream().filter(e -> e.category() == category).toList();
    }

    public long linkedToCarvedFiles() {
        return entries.stream().filter(e -> e.provenance() != null).count();
    }

    StringPool withEntries(List<StringPoolEntry> linked) {
        return new StringPool(List.copyOf(linked), regionsScanned, bytesScanned, diagnostics, complete);
    }
}
