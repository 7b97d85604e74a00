package com.libragraph.salvage.core.esm;

import com.libragraph.salvage.core.coverage.CoverageTracker;
import com.libragraph.salvage.core.diagnostic.DiagnosticKind;
import com.libragraph.salvage.core.diagnostic.Diagnostics;
import com.libragraph.salvage.core.diagnostic.Tally;
import com.libragraph.salvage.core.fixtures.EsmBlobBuilder;
import com.libragraph.salvage.core.progress.CancellationToken;
import com.libragraph.salvage.core.progress.ScanContext;
import com.libragraph.salvage.types.CoverageKind;
import com.libragraph.salvage.util.buffer.BinaryData;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.concurrent.atomic.AtomicInteger;

import static com.libragraph.salvage.core.fixtures.DumpFixtures.*;
import static com.libragraph.salvage.core.fixtures.EsmBlobBuilder.record;
import static org.assertj.core.api.Assertions.*;

class EsmScannerTest {

    private final EsmScanner scanner = new EsmScanner(10_000_000);

    private EsmScanResult scan(byte[] dump) {
        return scanner.scan(BinaryData.of(dump), new CoverageTracker(dump.length), ScanContext.detached("esm"));
    }

    @Test
    void shouldRecoverWellFormedRecord() {
        byte[] blob = record("QUST", 0x00012345)
                .text("EDID", "TestQuest")
                .formId("SCRI", 0x00054321)
                .build();
        byte[] dump = place(zeros(4096), 512, blob);

        EsmScanResult result = scan(dump);

        assertThat(result.records()).hasSize(1);
        RawRecord r = result.records().get(0);
        assertThat(r.offset()).isEqualTo(512);
        assertThat(r.tag()).isEqualTo("QUST");
        assertThat(r.formId()).isEqualTo(0x00012345);
        assertThat(r.header().dataSize()).isEqualTo(blob.length - 24);
        assertThat(r.header().reversed()).isFalse();
        assertThat(r.editorId()).contains("TestQuest");
        assertThat(r.first("SCRI").orElseThrow().formId()).hasValue(0x00054321);
        assertThat(r.subrecords()).extracting(Subrecord::tag).containsExactly("EDID", "SCRI");
    }

    @Test
    void shouldClaimRecordBytes() {
        byte[] blob = record("GLOB", 0x00000A01).text("EDID", "GameHour").build();
        byte[] dump = place(zeros(1024), 100, blob);
        CoverageTracker coverage = new CoverageTracker(dump.length);

        scanner.scan(BinaryData.of(dump), coverage, ScanContext.detached("esm"));

        assertThat(coverage.claims(CoverageKind.RECORD)).singleElement()
                .satisfies(c -> {
                    assertThat(c.start()).isEqualTo(100);
                    assertThat(c.end()).isEqualTo(100 + blob.length);
                });
    }

    @Test
    void shouldAcceptByteReversedTags() {
        byte[] blob = record("NPC_", 0x00001234).reversedTags()
                .text("EDID", "DocMitchell")
                .build();
        byte[] dump = place(zeros(1024), 64, blob);

        EsmScanResult result = scan(dump);

        assertThat(result.records()).singleElement().satisfies(r -> {
            assertThat(r.tag()).isEqualTo("NPC_");
            assertThat(r.header().reversed()).isTrue();
            assertThat(r.editorId()).contains("DocMitchell");
        });
    }

    @Test
    void shouldInflateCompressedRecord() {
        byte[] blob = record("SCPT", 0x00002000).compressed()
                .text("EDID", "VDoorScript")
                .text("SCTX", "scn VDoorScript\nbegin OnActivate\nend")
                .build();
        byte[] dump = place(zeros(2048), 0, blob);

        EsmScanResult result = scan(dump);

        assertThat(result.records()).singleElement().satisfies(r -> {
            assertThat(r.header().compressed()).isTrue();
            assertThat(r.first("SCTX").orElseThrow().asText()).startsWith("scn VDoorScript");
        });
    }

    @Test
    void shouldRejectCorruptCompressedRecordAndKeepNeighbours() {
        byte[] first = record("NOTE", 0x00003001).text("EDID", "Before").build();
        byte[] corrupt = record("SCPT", 0x00003002).compressed()
                .text("EDID", "Mangled")
                .text("SCTX", "scn Mangled\nbegin GameMode\nend")
                .build();
        // keep the size prefix and zlib header, then a deflate block of reserved type
        Arrays.fill(corrupt, 24 + 4 + 2, corrupt.length, (byte) 0xFF);
        byte[] last = record("NOTE", 0x00003003).text("EDID", "After").build();
        byte[] dump = zeros(4096);
        place(dump, 100, first);
        place(dump, 1000, corrupt);
        place(dump, 2000, last);

        EsmScanResult result = scan(dump);

        assertThat(result.records()).extracting(RawRecord::formId).containsExactly(0x00003001, 0x00003003);
        assertThat(result.diagnostics().count(DiagnosticKind.RECORD_DECOMPRESSION_FAILED)).isEqualTo(1);
        Tally tally = result.diagnostics().tally("esm").orElseThrow();
        assertThat(tally.rejected()).isEqualTo(1);
        assertThat(tally.reconciles()).isTrue();
    }

    @Test
    void shouldRejectRecordSizeLimitBeyondPayloadArray() {
        assertThatIllegalArgumentException()
                .isThrownBy(() -> new EsmScanner(Integer.MAX_VALUE + 1L))
                .withMessageContaining("maxRecordSize");
    }

    @Test
    void shouldApplyExtendedSubrecordSize() {
        byte[] big = new byte[70_000];
        big[69_999] = 7;
        byte[] blob = record("LAND", 0x00003000).subrecord("VHGT", big).text("EDID", "Land").build();
        byte[] dump = place(zeros(blob.length + 256), 128, blob);

        EsmScanResult result = scan(dump);

        assertThat(result.records()).singleElement().satisfies(r -> {
            assertThat(r.subrecords()).extracting(Subrecord::tag).containsExactly("VHGT", "EDID");
            assertThat(r.first("VHGT").orElseThrow().length()).isEqualTo(70_000);
        });
    }

    @Test
    void shouldIsolateRecordOverrunningBuffer() {
        byte[] first = record("MISC", 0x00004001).text("EDID", "Tin").build();
        byte[] broken = record("MISC", 0x00004002).text("EDID", "Broken").declaredSize(1_000_000).build();
        byte[] last = record("MISC", 0x00004003).text("EDID", "Wrench").build();
        byte[] dump = zeros(4096);
        place(dump, 100, first);
        place(dump, 1000, broken);
        place(dump, 2000, last);

        EsmScanResult result = scan(dump);

        assertThat(result.records()).extracting(RawRecord::formId).containsExactly(0x00004001, 0x00004003);
        assertThat(result.diagnostics().count(DiagnosticKind.RECORD_OVERRUN)).isEqualTo(1);
        Tally tally = result.diagnostics().tally("esm").orElseThrow();
        assertThat(tally.found()).isEqualTo(3);
        assertThat(tally.reconciles()).isTrue();
    }

    @Test
    void shouldRejectSubrecordRunningPastRecordEnd() {
        byte[] good = record("KEYM", 0x00005001).text("EDID", "Key").build();
        // Declared record size cuts the EDID payload short
        byte[] bad = record("KEYM", 0x00005002).text("EDID", "LongerKeyName").declaredSize(10).build();
        byte[] dump = zeros(2048);
        place(dump, 0, bad);
        place(dump, 512, good);

        EsmScanResult result = scan(dump);

        assertThat(result.records()).extracting(RawRecord::formId).containsExactly(0x00005001);
        assertThat(result.diagnostics().count(DiagnosticKind.SUBRECORD_OVERRUN)).isEqualTo(1);
    }

    @Test
    void shouldRejectImplausibleFormIds() {
        byte[] zero = record("WEAP", 0).text("EDID", "Zero").build();
        byte[] text = record("WEAP", 0x41424344).text("EDID", "Ascii").build();
        byte[] dump = zeros(1024);
        place(dump, 0, zero);
        place(dump, 300, text);

        EsmScanResult result = scan(dump);

        assertThat(result.records()).isEmpty();
        assertThat(result.diagnostics().count(DiagnosticKind.RECORD_INVALID)).isEqualTo(2);
    }

    @Test
    void shouldAllowZeroFormIdOnFileHeader() {
        byte[] header = record("TES4", 0).floats("HEDR", 0.94f).build();

        EsmScanResult result = scan(place(zeros(512), 0, header));

        assertThat(result.records()).extracting(RawRecord::tag).containsExactly("TES4");
    }

    @Test
    void shouldRejectReservedFlagsUnlessCompressed() {
        byte[] blob = record("STAT", 0x00006001).flags(0x80000000).text("EDID", "Rock").build();

        EsmScanResult result = scan(place(zeros(512), 0, blob));

        assertThat(result.records()).isEmpty();
    }

    @Test
    void shouldKeepFirstRecordForDuplicateFormId() {
        byte[] a = record("GLOB", 0x00007001).text("EDID", "First").build();
        byte[] b = record("GLOB", 0x00007001).text("EDID", "Second").build();
        byte[] dump = zeros(1024);
        place(dump, 0, a);
        place(dump, 400, b);

        EsmScanResult result = scan(dump);

        assertThat(result.records()).singleElement()
                .satisfies(r -> assertThat(r.editorId()).contains("First"));
        assertThat(result.duplicates()).singleElement()
                .satisfies(r -> assertThat(r.editorId()).contains("Second"));
        assertThat(result.diagnostics().count(DiagnosticKind.DUPLICATE_FORM_ID)).isEqualTo(1);
        assertThat(result.diagnostics().reconciles()).isTrue();
    }

    @Test
    void shouldRecordGroupsAndScanTheirContents() {
        byte[] grup = EsmBlobBuilder.group("WEAP",
                record("WEAP", 0x00008001).text("EDID", "Pistol").build(),
                record("WEAP", 0x00008002).text("EDID", "Rifle").build());
        byte[] dump = place(zeros(2048), 256, grup);

        EsmScanResult result = scan(dump);

        assertThat(result.groups()).singleElement().satisfies(g -> {
            assertThat(g.offset()).isEqualTo(256);
            assertThat(g.size()).isEqualTo(grup.length);
        });
        assertThat(result.records()).extracting(RawRecord::formId).containsExactly(0x00008001, 0x00008002);
    }

    @Test
    void shouldReturnExactlyTheRecordsValidatedBeforeCancellation() {
        byte[] dump = zeros(8192);
        for (int i = 0; i < 6; i++) {
            place(dump, 100 + i * 1000, record("MISC", 0x00009000 + i).text("EDID", "Item" + i).build());
        }
        CancellationToken token = CancellationToken.none();
        AtomicInteger seen = new AtomicInteger();
        ScanContext ctx = new ScanContext(event -> { }, token, new Diagnostics("esm", false));

        EsmScanResult result = scanner.scan(BinaryData.of(dump), new CoverageTracker(dump.length), ctx, r -> {
            if (seen.incrementAndGet() == 3) token.cancel();
        });

        assertThat(result.complete()).isFalse();
        assertThat(result.records()).extracting(RawRecord::formId)
                .containsExactly(0x00009000, 0x00009001, 0x00009002);
    }

    @Test
    void shouldResynchronizeOneByteAfterGarbage() {
        byte[] dump = filled(2048);
        // A tag with a nonsense header immediately followed by a valid record
        place(dump, 200, "QUST".getBytes());
        byte[] valid = record("QUST", 0x0000A001).text("EDID", "AfterGarbage").build();
        place(dump, 204, valid);

        EsmScanResult result = scan(dump);

        assertThat(result.records()).extracting(RawRecord::offset).containsExactly(204L);
    }
}
