package com.libragraph.salvage.types;

/**
 * Attribution kind of a claimed byte range.
 *
 * <p>{@code rank} orders kinds during reconciliation: where claims of different
 * kinds overlap, the lower rank keeps the bytes.
 */
public enum CoverageKind {
    RECORD(0, "record", 0),
    CARVED_FILE(1, "carved-file", 1),
    STRING_POOL(2, "string-pool", 2);

    private final int id;
    private final String label;
    private final int rank;

    CoverageKind(int id, String label, int rank) {
        this.id = id;
        this.label = label;
        this.rank = rank;
    }

    public int id() {
        return id;
    }

    public String label() {
        return label;
    }

    public int rank() {
        return rank;
    }

    public static CoverageKind fromId(int id) {
        for (CoverageKind k : values()) {
            if (k.id == id) return k;
        }
        throw new IllegalArgumentException("Unknown CoverageKind id: " + id);
    }
}
