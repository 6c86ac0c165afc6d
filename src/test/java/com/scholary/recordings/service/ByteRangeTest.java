package com.scholary.recordings.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.scholary.recordings.error.RangeNotSatisfiableException;
import org.junit.jupiter.api.Test;

class ByteRangeTest {

  @Test
  void parse_shouldResolveClosedRange() {
    ByteRange range = ByteRange.parse("bytes=0-99", 1000);

    assertThat(range.start()).isZero();
    assertThat(range.end()).isEqualTo(99);
    assertThat(range.length()).isEqualTo(100);
    assertThat(range.contentRange(1000)).isEqualTo("bytes 0-99/1000");
  }

  @Test
  void parse_shouldClampEndToLastByte() {
    ByteRange range = ByteRange.parse("bytes=900-5000", 1000);

    assertThat(range.end()).isEqualTo(999);
    assertThat(range.length()).isEqualTo(100);
  }

  @Test
  void parse_shouldResolveOpenEndedRange() {
    assertThat(ByteRange.parse("bytes=10-", 100)).isEqualTo(new ByteRange(10, 99));
  }

  @Test
  void parse_shouldResolveSuffixRange() {
    assertThat(ByteRange.parse("bytes=-10", 100)).isEqualTo(new ByteRange(90, 99));
    assertThat(ByteRange.parse("bytes=-500", 100)).isEqualTo(new ByteRange(0, 99));
  }

  @Test
  void parse_shouldServeOnlyFirstOfSeveralRanges() {
    assertThat(ByteRange.parse("bytes=0-1, 5-6", 100)).isEqualTo(new ByteRange(0, 1));
  }

  @Test
  void parse_shouldRejectStartAtOrPastEnd() {
    assertThatThrownBy(() -> ByteRange.parse("bytes=100-", 100))
        .isInstanceOf(RangeNotSatisfiableException.class)
        .satisfies(e -> assertThat(((RangeNotSatisfiableException) e).size()).isEqualTo(100));
    assertThatThrownBy(() -> ByteRange.parse("bytes=150-200", 100))
        .isInstanceOf(RangeNotSatisfiableException.class);
  }

  @Test
  void parse_shouldRejectMalformedHeaders() {
    for (String header :
        new String[] {"items=0-1", "bytes=a-b", "bytes=5-1", "bytes=-", "bytes=-0", "bytes 0-1"}) {
      assertThatThrownBy(() -> ByteRange.parse(header, 100))
          .as(header)
          .isInstanceOf(RangeNotSatisfiableException.class);
    }
  }

  @Test
  void parse_shouldRejectAnyRangeOnEmptyBlob() {
    assertThatThrownBy(() -> ByteRange.parse("bytes=0-", 0))
        .isInstanceOf(RangeNotSatisfiableException.class);
  }

  @Test
  void parse_shouldRejectNumbersTooLargeForLong() {
    assertThatThrownBy(() -> ByteRange.parse("bytes=0-99999999999999999999", 100))
        .isInstanceOf(RangeNotSatisfiableException.class);
  }
}
