package com.libragraph.salvage.util.buffer;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.*;

class RamBufferTest {

    private static final byte[] DATA = "....IEND....tail".getBytes(StandardCharsets.US_ASCII);

    @Test
    void shouldClampReadsAtEnd() {
        BinaryData data = BinaryData.of(DATA);

        assertThat(data.read(12, 100)).isEqualTo("tail".getBytes(StandardCharsets.US_ASCII));
        assertThat(data.read(16, 4)).isEmpty();
    }

    @Test
    void shouldRejectExactReadPastEnd() {
        BinaryData data = BinaryData.of(DATA);

        assertThatThrownBy(() -> data.readExact(14, 4))
                .isInstanceOf(BufferAccessException.class)
                .satisfies(e -> assertThat(((BufferAccessException) e).offset()).isEqualTo(14));
    }

    @Test
    void shouldReportContainment() {
        BinaryData data = BinaryData.of(DATA);

        assertThat(data.contains(0, 16)).isTrue();
        assertThat(data.contains(1, 16)).isFalse();
        assertThat(data.contains(-1, 1)).isFalse();
        assertThat(data.contains(4, Long.MAX_VALUE)).isFalse();
    }

    @Test
    void shouldFindPattern() {
        BinaryData data = BinaryData.of(DATA);
        byte[] iend = "IEND".getBytes(StandardCharsets.US_ASCII);

        assertThat(data.indexOf(iend, 0, data.size())).isEqualTo(4);
        assertThat(data.indexOf(iend, 5, data.size())).isEqualTo(-1);
        assertThat(data.indexOf(iend, 0, 4)).isEqualTo(-1);
    }

    @Test
    void shouldHashRangeLikeStandaloneCopy() {
        BinaryData data = BinaryData.of(DATA);

        assertThat(data.hash(4, 4)).isEqualTo(BinaryData.of("IEND".getBytes(StandardCharsets.US_ASCII)).hash());
        assertThat(data.hash(4, 4)).isNotEqualTo(data.hash(0, 4));
    }
}
