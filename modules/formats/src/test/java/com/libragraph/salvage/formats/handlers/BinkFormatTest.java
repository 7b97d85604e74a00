package com.libragraph.salvage.formats.handlers;

import com.libragraph.salvage.formats.api.Extent;
import com.libragraph.salvage.types.FileCategory;
import com.libragraph.salvage.util.buffer.BinaryData;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class BinkFormatTest {

    private BinkFormat format;

    @BeforeEach
    void setUp() {
        format = new BinkFormat();
    }

    @Test
    void shouldMeasureDeclaredLength() {
        BinaryData data = BinaryData.of(FormatFixtures.place(8192, 1024, FormatFixtures.bink(2048)));

        assertThat(format.measure(data, 1024)).map(Extent::length).contains(2048L);
        assertThat(format.category()).isEqualTo(FileCategory.VIDEO);
    }

    @Test
    void shouldReportDeclaredLengthEvenPastEnd() {
        BinaryData data = BinaryData.of(FormatFixtures.place(512, 0, FormatFixtures.bink(4096)));

        assertThat(format.measure(data, 0)).map(Extent::length).contains(4096L);
    }

    @Test
    void shouldRejectImplausibleLength() {
        BinaryData data = BinaryData.of(FormatFixtures.place(512, 0, FormatFixtures.bink(10)));

        assertThat(format.measure(data, 0)).isEmpty();
    }

    @Test
    void shouldRejectTruncatedHeader() {
        byte[] header = FormatFixtures.bink(2048);
        BinaryData data = BinaryData.of(FormatFixtures.place(10, 0, java.util.Arrays.copyOf(header, 10)));

        assertThat(format.measure(data, 0)).isEmpty();
    }
}
