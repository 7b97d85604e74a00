package com.libragraph.salvage.formats.api;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Criteria for detecting where a signature format starts inside an unindexed byte stream.
 *
 * @param magics       Alternative magic byte sequences; any one of them starts a candidate
 * @param magicOffset  Offset of the magic relative to the start of the file (0 for all built-in formats)
 * @param minSize      Smallest plausible extent in bytes
 * @param maxSize      Largest plausible extent in bytes
 * @param priority     Confidence: a higher priority wins when candidates overlap
 */
public record DetectionCriteria(
        List<byte[]> magics,
        int magicOffset,
        long minSize,
        long maxSize,
        int priority
) {
    public DetectionCriteria {
        if (magics.isEmpty()) {
            throw new IllegalArgumentException("At least one magic sequence is required");
        }
        List<byte[]> copies = new ArrayList<>(magics.size());
        for (byte[] magic : magics) {
            if (magic.length == 0) {
                throw new IllegalArgumentException("Empty magic sequence");
            }
            copies.add(Arrays.copyOf(magic, magic.length));
        }
        magics = List.copyOf(copies);
        if (minSize < 0 || maxSize < minSize) {
            throw new IllegalArgumentException("Invalid size bounds: " + minSize + ".." + maxSize);
        }
    }

    public static DetectionCriteria of(byte[] magic, long minSize, long maxSize, int priority) {
        return new DetectionCriteria(List.of(magic), 0, minSize, maxSize, priority);
    }

    /**
     * Returns the index of the magic that matches {@code window} at {@code index}, or -1.
     * A magic that would run past the end of the window never matches.
     */
    public int matchAt(byte[] window, int index) {
        for (int m = 0; m < magics.size(); m++) {
            byte[] magic = magics.get(m);
            if (index < 0 || index + magic.length > window.length) continue;
            boolean match = true;
            for (int i = 0; i < magic.length; i++) {
                if (window[index + i] != magic[i]) {
                    match = false;
                    break;
                }
            }
            if (match) return m;
        }
        return -1;
    }

    public int longestMagic() {
        int longest = 0;
        for (byte[] magic : magics) {
            longest = Math.max(longest, magic.length);
        }
        return longest;
    }

    public boolean acceptsSize(long length) {
        return length >= minSize && length <= maxSize;
    }
}
