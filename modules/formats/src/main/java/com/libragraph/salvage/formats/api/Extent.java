package com.libragraph.salvage.formats.api;

import java.util.Optional;

/**
 * Measured extent of a signature candidate.
 *
 * @param length total length in bytes, measured from the candidate start
 * @param name   embedded name when the format carries one (script name), otherwise null
 */
public record Extent(long length, String name) {

    public Extent {
        if (length <= 0) {
            throw new IllegalArgumentException("Extent length must be positive: " + length);
        }
    }

    public static Extent of(long length) {
        return new Extent(length, null);
    }

    public Optional<String> embeddedName() {
        return Optional.ofNullable(name);
    }
}
