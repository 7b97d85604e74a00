package com.libragraph.salvage.core.diagnostic;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DiagnosticsTest {

    @Test
    void shouldCountBeyondRetainedEntries() {
        Diagnostics diagnostics = new Diagnostics("carve", false, 2);
        for (int i = 0; i < 5; i++) {
            diagnostics.record(DiagnosticKind.CANDIDATE_INVALID, i * 16L, "bad header");
        }

        DiagnosticReport report = diagnostics.snapshot(List.of());

        assertThat(report.count(DiagnosticKind.CANDIDATE_INVALID)).isEqualTo(5);
        assertThat(report.entries()).hasSize(2);
        assertThat(report.droppedEntries()).isEqualTo(3);
    }

    @Test
    void shouldCombineInGivenOrder() {
        Diagnostics carve = new Diagnostics("carve", false);
        carve.record(DiagnosticKind.CANDIDATE_OVERLAP, 0x100, "lost to bink@0x00000080");
        Diagnostics esm = new Diagnostics("esm", false);
        esm.record(DiagnosticKind.RECORD_OVERRUN, 0x2000, "data runs past end");
        esm.record(DiagnosticKind.CANDIDATE_OVERLAP, 0x3000, "unexpected");

        DiagnosticReport combined = Diagnostics.combine(List.of(
                carve.snapshot(new Tally("carve", 2, 1, 1, 0)),
                esm.snapshot(new Tally("esm", 3, 1, 1, 1))));

        assertThat(combined.entries()).extracting(Diagnostic::component)
                .containsExactly("carve", "esm", "esm");
        assertThat(combined.count(DiagnosticKind.CANDIDATE_OVERLAP)).isEqualTo(2);
        assertThat(combined.tally("esm")).hasValueSatisfying(t -> assertThat(t.duplicate()).isEqualTo(1));
        assertThat(combined.reconciles()).isTrue();
    }

    @Test
    void shouldDetectUnbalancedTally() {
        DiagnosticReport report = new Diagnostics("strings", false).snapshot(new Tally("strings", 5, 3, 1, 0));

        assertThat(report.reconciles()).isFalse();
    }

    @Test
    void shouldFormatEntryWithHexOffset() {
        Diagnostic d = new Diagnostic("esm", DiagnosticKind.DUPLICATE_FORM_ID, 0x1234, "0x00012345 seen before");

        assertThat(d.toString()).isEqualTo("[esm] DUPLICATE_FORM_ID @0x00001234: 0x00012345 seen before");
    }
}
