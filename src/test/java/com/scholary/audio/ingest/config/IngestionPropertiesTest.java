package com.scholary.audio.ingest.config;

import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class IngestionPropertiesTest {

  @Test
  void constructor_shouldRejectTargetAboveCeiling() {
    assertThatThrownBy(
            () ->
                new IngestionProperties(
                    1_000,
                    2_000,
                    15.0,
                    "/tmp",
                    Duration.ofMinutes(30),
                    false,
                    new IngestionProperties.ResultCacheProperties(10, 24)))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("targetChunkBytes");
  }
}
