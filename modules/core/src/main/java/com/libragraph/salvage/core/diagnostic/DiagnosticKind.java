package com.libragraph.salvage.core.diagnostic;

public enum DiagnosticKind {
    /** Candidate failed structural validation. */
    CANDIDATE_INVALID,
    /** Candidate extent runs past the end of the buffer. */
    CANDIDATE_OVERRUN,
    /** Candidate lost to an overlapping candidate of higher confidence or earlier offset. */
    CANDIDATE_OVERLAP,
    /** Per-format cap reached. */
    CANDIDATE_CAPPED,
    RECORD_INVALID,
    RECORD_OVERRUN,
    SUBRECORD_OVERRUN,
    RECORD_DECOMPRESSION_FAILED,
    DUPLICATE_FORM_ID,
    /** Claim refused by the coverage policy. */
    COVERAGE_CONFLICT,
    /** Cross-kind overlap trimmed during reconciliation. */
    COVERAGE_TRIMMED,
    LIFT_FAILED
}
