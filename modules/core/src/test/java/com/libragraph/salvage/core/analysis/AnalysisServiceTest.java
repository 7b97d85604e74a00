package com.libragraph.salvage.core.analysis;

import com.libragraph.salvage.core.carve.CarvedFile;
import com.libragraph.salvage.core.coverage.ByteRange;
import com.libragraph.salvage.core.coverage.Claim;
import com.libragraph.salvage.core.coverage.CoverageTracker;
import com.libragraph.salvage.core.esm.RawRecord;
import com.libragraph.salvage.core.progress.CancellationToken;
import com.libragraph.salvage.core.progress.ProgressEvent;
import com.libragraph.salvage.core.semantic.SemanticRecord;
import com.libragraph.salvage.core.strings.Provenance;
import com.libragraph.salvage.core.strings.StringPool;
import com.libragraph.salvage.core.strings.StringPoolEntry;
import com.libragraph.salvage.core.strings.StringPoolSettings;
import com.libragraph.salvage.formats.registry.FormatRegistry;
import com.libragraph.salvage.types.CoverageKind;
import com.libragraph.salvage.types.FileCategory;
import com.libragraph.salvage.types.StringCategory;
import com.libragraph.salvage.util.buffer.BinaryData;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static com.libragraph.salvage.core.fixtures.DumpFixtures.*;
import static com.libragraph.salvage.core.fixtures.EsmBlobBuilder.record;
import static org.assertj.core.api.Assertions.*;

class AnalysisServiceTest {

    private static final int QUEST = 0x00012345;

    private ExecutorService executor;
    private AnalysisService service;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(2);
        service = new AnalysisService(FormatRegistry.builtIn(), executor, AnalysisSettings.defaults());
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    /** 64 KB of zeros with a Bink header at 1024 and one quest record at 8192. */
    private static byte[] sampleDump() {
        byte[] dump = zeros(64 * 1024);
        place(dump, 1024, bink(2048));
        place(dump, 8192, record("QUST", QUEST).paddedText("EDID", "TestQuest", 58).build());
        return dump;
    }

    @Test
    void shouldCarveAndScanSampleDump() {
        AnalysisResult result = service.analyze(BinaryData.of(sampleDump()), AnalysisOptions.defaults());

        assertThat(result.complete()).isTrue();
        assertThat(result.bufferSize()).isEqualTo(64 * 1024);
        assertThat(result.carvedFiles()).singleElement().satisfies(f -> {
            assertThat(f.offset()).isEqualTo(1024);
            assertThat(f.length()).isEqualTo(2048);
            assertThat(f.category()).isEqualTo(FileCategory.VIDEO);
        });
        assertThat(result.records()).singleElement().satisfies(r -> {
            assertThat(r.offset()).isEqualTo(8192);
            assertThat(r.header().dataSize()).isEqualTo(64);
            assertThat(r.editorId()).contains("TestQuest");
        });
        assertThat(result.formIds()).containsOnlyKeys(QUEST);
        assertThat(result.stringPool().entries()).isEmpty();
        assertThat(result.diagnostics().reconciles()).isTrue();
    }

    @Test
    void shouldResolveNamesAfterReconstruction() {
        AnalysisResult analysis = service.analyze(BinaryData.of(sampleDump()), AnalysisOptions.defaults());

        SemanticResult semantic = service.reconstruct(analysis);

        assertThat(semantic.complete()).isTrue();
        assertThat(semantic.totalRecordsReconstructed()).isEqualTo(1);
        assertThat(semantic.records()).singleElement().isInstanceOf(SemanticRecord.Quest.class);
        assertThat(semantic.formIdToDisplayName()).containsEntry(QUEST, "TestQuest");
        assertThat(semantic.resolver().resolve(QUEST)).isEqualTo("TestQuest");
        assertThat(semantic.resolver().exists(0x00099999)).isFalse();
        assertThat(semantic.resolver().resolve(0x00099999)).isEqualTo("unresolved");
    }

    @Test
    void shouldReportPresentButNamelessRecordAsUnresolved() {
        byte[] dump = zeros(16 * 1024);
        place(dump, 4096, record("LAND", 0x00020000).ints("DATA", 1).build());

        SemanticResult semantic = service.reconstruct(service.analyze(BinaryData.of(dump), AnalysisOptions.defaults()));

        assertThat(semantic.resolver().exists(0x00020000)).isTrue();
        assertThat(semantic.resolver().resolve(0x00020000)).isEqualTo("unresolved");
        assertThat(semantic.genericCount()).isEqualTo(1);
        assertThat(semantic.countsByTag()).containsEntry("LAND", 1L);
    }

    @Test
    void shouldProduceIdenticalResultsAcrossRuns() {
        byte[] dump = sampleDump();
        place(dump, 20_000, dds(64, 64));
        place(dump, 30_000, cString("textures\\clutter\\bottle.dds"));
        place(dump, 40_000, record("WEAP", 0x00030000).text("EDID", "WeapPistol").build());

        AnalysisResult first = service.analyze(BinaryData.of(dump), AnalysisOptions.defaults());
        AnalysisResult second = service.analyze(BinaryData.of(dump), AnalysisOptions.defaults());

        assertThat(second.carvedFiles()).isEqualTo(first.carvedFiles());
        assertThat(second.records()).extracting(RawRecord::offset, RawRecord::formId)
                .containsExactlyElementsOf(first.records().stream()
                        .map(r -> tuple(r.offset(), r.formId())).toList());
        assertThat(second.stringPool().entries()).isEqualTo(first.stringPool().entries());
        assertThat(second.coverage().claims()).isEqualTo(first.coverage().claims());
    }

    @Test
    void shouldLeaveNoOverlapInReconciledCoverage() {
        byte[] dump = sampleDump();
        place(dump, 30_000, cString("meshes\\clutter\\bottle.nif"));

        AnalysisResult result = service.analyze(BinaryData.of(dump), AnalysisOptions.defaults());

        List<Claim> claims = result.coverage().claims();
        for (int i = 1; i < claims.size(); i++) {
            assertThat(claims.get(i).start()).isGreaterThanOrEqualTo(claims.get(i - 1).end());
        }
        assertThat(claims).extracting(Claim::kind)
                .contains(CoverageKind.CARVED_FILE, CoverageKind.RECORD, CoverageKind.STRING_POOL);
        assertThat(result.coverage().summary().claimedBytes())
                .isEqualTo(claims.stream().mapToLong(c -> c.range().length()).sum());
    }

    @Test
    void shouldHonourFileTypeFilter() {
        AnalysisResult result = service.analyze(BinaryData.of(sampleDump()),
                AnalysisOptions.defaults().withFileTypes(Set.of(FileCategory.TEXTURE)));

        assertThat(result.carvedFiles()).isEmpty();
        assertThat(result.records()).hasSize(1);
    }

    @Test
    void shouldReturnPartialResultWhenCancelled() {
        CancellationToken token = CancellationToken.none();
        token.cancel();
        List<ProgressEvent> events = Collections.synchronizedList(new ArrayList<>());

        AnalysisResult result = service.analyze(BinaryData.of(sampleDump()), AnalysisOptions.defaults(),
                events::add, token);

        assertThat(result.complete()).isFalse();
        assertThat(events).last().satisfies(e -> {
            assertThat(e.terminal()).isTrue();
            assertThat(e.success()).isTrue();
        });
    }

    @Test
    void shouldRejectBufferOverConfiguredLimit() {
        AnalysisSettings small = new AnalysisSettings(2, 100, 10_000_000, 1024, StringPoolSettings.defaults());
        AnalysisService limited = new AnalysisService(FormatRegistry.builtIn(), executor, small);
        List<ProgressEvent> events = new ArrayList<>();

        assertThatThrownBy(() -> limited.analyze(BinaryData.of(zeros(4096)), AnalysisOptions.defaults(),
                events::add, CancellationToken.none()))
                .isInstanceOf(AnalysisException.class)
                .hasMessageContaining("4096");
        assertThat(events).singleElement().satisfies(e -> {
            assertThat(e.terminal()).isTrue();
            assertThat(e.success()).isFalse();
            assertThat(e.error()).isNotBlank();
        });
    }

    @Test
    void shouldFailWithOffsetWhenBufferCannotBeRead() {
        byte[] backing = sampleDump();
        BinaryData failing = new BinaryData() {
            @Override
            public long size() {
                return backing.length;
            }

            @Override
            protected int readAt(long pos, byte[] dst, int off, int len) throws IOException {
                if (pos >= 32 * 1024) {
                    throw new IOException("bad sector");
                }
                int n = (int) Math.min(len, 32 * 1024 - pos);
                System.arraycopy(backing, (int) pos, dst, off, n);
                return n;
            }
        };

        assertThatThrownBy(() -> service.analyze(failing, AnalysisOptions.defaults()))
                .isInstanceOfSatisfying(AnalysisException.class, e -> assertThat(e.offset()).isEqualTo(32 * 1024));
    }

    @Test
    void shouldReportRecordScanFailureEvenWhenCarverFailsLater() {
        int window = 1 << 20;
        long size = 4L * window;
        long recordFailure = window - 24 + 1;
        CountDownLatch recordScanFailed = new CountDownLatch(1);
        BinaryData failing = new BinaryData() {
            @Override
            public long size() {
                return size;
            }

            @Override
            protected int readAt(long pos, byte[] dst, int off, int len) throws IOException {
                if (len == window && pos == size - window) {
                    // final carver chunk fails only once a record window read has failed
                    try {
                        recordScanFailed.await(10, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    throw new IOException("bad sector in last chunk");
                }
                if (len == window && pos > 0) {
                    recordScanFailed.countDown();
                    throw new IOException("bad sector in record window");
                }
                Arrays.fill(dst, off, off + len, (byte) 0);
                return len;
            }
        };

        assertThatThrownBy(() -> service.analyze(failing, AnalysisOptions.defaults()))
                .isInstanceOfSatisfying(AnalysisException.class, e -> {
                    assertThat(e.offset()).isEqualTo(recordFailure);
                    assertThat(e.operation()).isEqualTo("read");
                });
        assertThat(recordScanFailed.getCount()).isZero();
    }

    @Test
    void shouldExtractStringsOnlyAndLinkToCarvedFiles() {
        byte[] dump = filled(8192);
        place(dump, 1000, cString("fCombatDistance"));
        place(dump, 5000, cString("I woke up in Goodsprings after being shot."));
        CoverageTracker coverage = new CoverageTracker(dump.length);
        coverage.claim(new ByteRange(900, 980), CoverageKind.CARVED_FILE, "dds@0x00000384");
        CarvedFile texture = new CarvedFile(900, 80, FileCategory.TEXTURE, "dds", 90, null, null);

        StringPool pool = service.extractStringPoolOnly(BinaryData.of(dump), dump.length,
                StringPoolSettings.defaults(), coverage, Set.of());
        StringPool linked = service.crossReference(pool, List.of(texture));

        assertThat(pool.entries()).extracting(StringPoolEntry::category)
                .containsExactly(StringCategory.GAME_SETTING, StringCategory.DIALOGUE_LINE);
        assertThat(linked.entries().get(0).linkedFile()).map(Provenance::distance).contains(20L);
        assertThat(linked.entries().get(1).linkedFile()).isEmpty();
    }
}
