package com.libragraph.salvage.core.xref;

public enum ResolutionStatus {
    /** Present and named. */
    RESOLVED("resolved"),
    /** Present in the dump, but no name could be derived. */
    UNRESOLVED("unresolved"),
    /** Not present in the dump at all. */
    MISSING("missing");

    private final String label;

    ResolutionStatus(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
