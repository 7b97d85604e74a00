package com.libragraph.salvage.core.strings;

/**
 * String extraction limits.
 *
 * @param minLength        shortest run kept, terminator excluded
 * @param maxLength        longest run kept; longer runs are discarded whole
 * @param provenanceWindow how far a carved file may be from a string and still be linked to it
 */
public record StringPoolSettings(int minLength, int maxLength, long provenanceWindow) {

    public static final int DEFAULT_MIN_LENGTH = 4;
    public static final int DEFAULT_MAX_LENGTH = 512;
    public static final long DEFAULT_PROVENANCE_WINDOW = 256;

    public StringPoolSettings {
        if (minLength < 1 || maxLength < minLength) {
            throw new IllegalArgumentException("Invalid string length bounds " + minLength + ".." + maxLength);
        }
        if (provenanceWindow < 0) {
            throw new IllegalArgumentException("provenanceWindow must be >= 0");
        }
    }

    public static StringPoolSettings defaults() {
        return new StringPoolSettings(DEFAULT_MIN_LENGTH, DEFAULT_MAX_LENGTH, DEFAULT_PROVENANCE_WINDOW);
    }
}
