package com.libragraph.salvage.core.semantic;

/**
 * An outgoing FormID reference and the subrecord it was read from.
 */
public record FormIdRef(String subrecordTag, int formId) {
}
