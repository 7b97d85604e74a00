package com.libragraph.salvage.core.esm;

import com.libragraph.salvage.core.diagnostic.DiagnosticKind;

/**
 * A record candidate failed validation after its header was accepted. Confined to one
 * candidate; the scanner records it and resynchronizes.
 */
class MalformedRecordException extends Exception {

    private final DiagnosticKind kind;

    MalformedRecordException(DiagnosticKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    MalformedRecordException(DiagnosticKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    DiagnosticKind kind() {
        return kind;
    }
}
