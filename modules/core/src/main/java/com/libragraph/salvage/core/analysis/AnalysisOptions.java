package com.libragraph.salvage.core.analysis;

import com.libragraph.salvage.types.FileCategory;
import com.libragraph.salvage.types.StringCategory;

import java.util.Set;

/**
 * Per-call analysis options.
 *
 * @param fileTypes        file categories to carve; empty means all
 * @param verbose          log every diagnostic at INFO
 * @param stringCategories string categories to keep; empty means all
 * @param extractStrings   run string pool extraction after carving and record scanning
 */
public record AnalysisOptions(
        Set<FileCategory> fileTypes,
        boolean verbose,
        Set<StringCategory> stringCategories,
        boolean extractStrings
) {
    public AnalysisOptions {
        fileTypes = Set.copyOf(fileTypes);
        stringCategories = Set.copyOf(stringCategories);
    }

    public static AnalysisOptions defaults() {
        return new AnalysisOptions(Set.of(), false, Set.of(), true);
    }

    public AnalysisOptions withFileTypes(Set<FileCategory> types) {
        return new AnalysisOptions(types, verbose, stringCategories, extractStrings);
    }

    public AnalysisOptions withVerbose(boolean verbose) {
        return new AnalysisOptions(fileTypes, verbose, stringCategories, extractStrings);
    }

    public AnalysisOptions withoutStrings() {
        return new AnalysisOptions(fileTypes, verbose, stringCategories, false);
    }
}
