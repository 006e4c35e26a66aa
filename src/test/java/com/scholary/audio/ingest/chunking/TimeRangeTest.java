package com.scholary.audio.ingest.chunking;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class TimeRangeTest {

  @Test
  void constructor_shouldRejectNegativeStart() {
    assertThatThrownBy(() -> new TimeRange(-1.0, 10.0))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("negative");
  }

  @Test
  void constructor_shouldRejectEndBeforeStart() {
    assertThatThrownBy(() -> new TimeRange(10.0, 5.0))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("must be >= start time");
  }

  @Test
  void duration_shouldCalculateCorrectly() {
    assertThat(new TimeRange(240.0, 480.0).duration()).isEqualTo(240.0);
  }

  @Test
  void overlaps_shouldTreatAdjacentRangesAsDisjoint() {
    TimeRange first = new TimeRange(0.0, 240.0);
    TimeRange second = new TimeRange(240.0, 480.0);
    TimeRange straddling = new TimeRange(200.0, 300.0);

    assertThat(first.overlaps(second)).isFalse();
    assertThat(first.overlaps(straddling)).isTrue();
    assertThat(straddling.overlaps(second)).isTrue();
  }
}
