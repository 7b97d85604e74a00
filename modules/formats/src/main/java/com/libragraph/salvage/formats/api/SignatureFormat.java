package com.libragraph.salvage.formats.api;

import com.libragraph.salvage.types.FileCategory;
import com.libragraph.salvage.util.buffer.BinaryData;

import java.util.Optional;

/**
 * A carvable file format: how to spot it and how to measure it.
 * Implementations should be stateless {@code @ApplicationScoped} CDI beans.
 */
public interface SignatureFormat {

    /**
     * Stable identifier, e.g. {@code "bink"}. Unique across the registry.
     */
    String id();

    FileCategory category();

    /**
     * Returns criteria for detecting candidates of this format.
     */
    DetectionCriteria getDetectionCriteria();

    /**
     * Measures the candidate starting at {@code offset}.
     *
     * <p>Implementations read only through {@code data} and must terminate on any input.
     * The returned length may exceed the remaining data; the caller rejects such
     * candidates. Structural nonsense (impossible header fields, missing terminator)
     * yields an empty result.
     *
     * @param data   the whole dump
     * @param offset absolute offset of the candidate start (magic position minus magic offset)
     */
    Optional<Extent> measure(BinaryData data, long offset);
}
