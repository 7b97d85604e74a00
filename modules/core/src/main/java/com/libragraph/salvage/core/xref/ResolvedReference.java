package com.libragraph.salvage.core.xref;

import com.libragraph.salvage.core.semantic.FormIdRef;

/**
 * An outgoing reference with its target looked up.
 *
 * @param partial the source record was not lifted, so the reference was read from raw subrecords
 */
public record ResolvedReference(FormIdRef reference, Resolution target, boolean partial) {
}
