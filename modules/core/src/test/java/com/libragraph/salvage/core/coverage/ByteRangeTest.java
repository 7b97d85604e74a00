package com.libragraph.salvage.core.coverage;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class ByteRangeTest {

    @Test
    void shouldRejectEmptyOrNegativeRanges() {
        assertThatThrownBy(() -> new ByteRange(10, 10)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ByteRange(-1, 10)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldTreatRangesAsHalfOpen() {
        ByteRange a = new ByteRange(0, 10);

        assertThat(a.contains(9)).isTrue();
        assertThat(a.contains(10)).isFalse();
        assertThat(a.overlaps(new ByteRange(10, 20))).isFalse();
        assertThat(a.overlaps(new ByteRange(9, 20))).isTrue();
    }

    @Test
    void shouldMeasureDistanceBetweenRanges() {
        ByteRange a = new ByteRange(100, 200);

        assertThat(a.distanceTo(new ByteRange(250, 300))).isEqualTo(50);
        assertThat(a.distanceTo(new ByteRange(0, 40))).isEqualTo(60);
        assertThat(a.distanceTo(new ByteRange(150, 160))).isZero();
        assertThat(a.distanceTo(new ByteRange(200, 210))).isZero();
    }
}
