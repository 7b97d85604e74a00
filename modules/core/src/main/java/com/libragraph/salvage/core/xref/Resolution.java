package com.libragraph.salvage.core.xref;

import com.libragraph.salvage.core.esm.FormIds;

import java.util.Optional;

/**
 * What a FormID points at.
 *
 * @param tag  record type when present, otherwise null
 * @param name best name when resolved, otherwise null
 */
public record Resolution(int formId, ResolutionStatus status, String tag, String name) {

    public Optional<String> nameIfResolved() {
        return Optional.ofNullable(name);
    }

    @Override
    public String toString() {
        return switch (status) {
            case RESOLVED -> name + " (" + FormIds.hex(formId) + ")";
            case UNRESOLVED -> tag + " " + FormIds.hex(formId) + " [unresolved]";
            case MISSING -> FormIds.hex(formId) + " [missing]";
        };
    }
}
