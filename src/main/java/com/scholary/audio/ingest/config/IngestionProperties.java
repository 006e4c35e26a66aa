package com.scholary.audio.ingest.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the ingestion pipeline.
 *
 * <p>{@code maxRequestBytes} is the recognition service's hard payload ceiling; {@code
 * targetChunkBytes} is the size chunks are planned against, kept below the ceiling.
 */
@ConfigurationProperties(prefix = "ingestion")
@Validated
public record IngestionProperties(
    @Positive long maxRequestBytes,
    @Positive long targetChunkBytes,
    @Positive double segmentDurationSeconds,
    @NotBlank String tempDir,
    @NotNull Duration deadline,
    boolean allowPartialTranscripts,
    @Valid ResultCacheProperties resultCache) {

  public IngestionProperties {
    if (targetChunkBytes > maxRequestBytes) {
      throw new IllegalArgumentException(
          String.format(
              "targetChunkBytes (%d) must not exceed maxRequestBytes (%d)",
              targetChunkBytes, maxRequestBytes));
    }
  }

  public record ResultCacheProperties(@Positive int maxSize, @Positive int ttlHours) {}
}
