package io.nodelogs.server.core;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ByteRangeTest {

    @Test
    void absentHeaderServesWhole() {
        assertThat(ByteRange.parse(null, 10)).isInstanceOf(ByteRange.Whole.class);
        assertThat(ByteRange.parse("", 10)).isInstanceOf(ByteRange.Whole.class);
    }

    @Test
    void closedRangeIsClampedToSize() {
        assertThat(ByteRange.parse("bytes=2-5", 10)).isEqualTo(new ByteRange.Single(new ByteRange(2, 4)));
        assertThat(ByteRange.parse("bytes=6-100", 10)).isEqualTo(new ByteRange.Single(new ByteRange(6, 4)));
    }

    @Test
    void openAndSuffixRanges() {
        assertThat(ByteRange.parse("bytes=7-", 10)).isEqualTo(new ByteRange.Single(new ByteRange(7, 3)));
        assertThat(ByteRange.parse("bytes=-3", 10)).isEqualTo(new ByteRange.Single(new ByteRange(7, 3)));
        assertThat(ByteRange.parse("bytes=-30", 10)).isEqualTo(new ByteRange.Single(new ByteRange(0, 10)));
    }

    @Test
    void rangesPastTheEndAreUnsatisfiable() {
        assertThat(ByteRange.parse("bytes=10-", 10)).isInstanceOf(ByteRange.Unsatisfiable.class);
        assertThat(ByteRange.parse("bytes=-0", 10)).isInstanceOf(ByteRange.Unsatisfiable.class);
    }

    @Test
    void malformedHeadersAreInvalid() {
        assertThat(ByteRange.parse("items=0-1", 10)).isInstanceOf(ByteRange.Invalid.class);
        assertThat(ByteRange.parse("bytes=5-2", 10)).isInstanceOf(ByteRange.Invalid.class);
        assertThat(ByteRange.parse("bytes=a-b", 10)).isInstanceOf(ByteRange.Invalid.class);
        assertThat(ByteRange.parse("bytes=3", 10)).isInstanceOf(ByteRange.Invalid.class);
    }

    @Test
    void severalRangesServeWhole() {
        assertThat(ByteRange.parse("bytes=0-1, 4-5", 10)).isInstanceOf(ByteRange.Whole.class);
    }

    @Test
    void contentRangeHeaderValue() {
        assertThat(new ByteRange(6, 4).contentRange(10)).isEqualTo("bytes 6-9/10");
    }
}
