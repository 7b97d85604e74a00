package com.libragraph.salvage.core.semantic;

import com.libragraph.salvage.core.esm.RawRecord;

import java.util.List;

/**
 * Lifts one record type. Implementations read only what is present and tolerate short
 * subrecords by leaving the corresponding field empty.
 */
@FunctionalInterface
public interface RecordLifter {

    SemanticRecord lift(RawRecord raw, RecordIdentity identity, List<FormIdRef> references);
}
