package com.libragraph.salvage.core.strings;

import com.libragraph.salvage.core.carve.CarvedFile;

/**
 * Link from a string to the carved file it most likely belongs to.
 *
 * @param distance bytes between the string and the file, 0 when contained or matched by name
 */
public record Provenance(CarvedFile file, Kind kind, long distance) {

    public enum Kind {
        /** A file path whose file name matches the name embedded in a carved file. */
        NAME_MATCH,
        /** The string lies inside the carved file. */
        CONTAINED,
        /** The string lies within the provenance window of the carved file. */
        NEARBY
    }
}
