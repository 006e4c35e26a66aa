package com.scholary.audio.ingest.testutil;

import com.scholary.audio.ingest.chunking.FfmpegProperties;
import com.scholary.audio.ingest.config.IngestionProperties;
import com.scholary.audio.ingest.probe.AudioInfo;
import java.nio.file.Path;
import java.time.Duration;

/** Shared property and data builders for tests. */
public final class TestFixtures {

  public static final long MB = 1024L * 1024L;
  public static final long MAX_REQUEST_BYTES = 25 * MB;
  public static final long TARGET_CHUNK_BYTES = 20 * MB;

  private TestFixtures() {}

  public static IngestionProperties ingestionProperties(Path tempDir) {
    return ingestionProperties(tempDir, false);
  }

  public static IngestionProperties ingestionProperties(Path tempDir, boolean allowPartial) {
    return new IngestionProperties(
        MAX_REQUEST_BYTES,
        TARGET_CHUNK_BYTES,
        15.0,
        tempDir.toString(),
        Duration.ofMinutes(30),
        allowPartial,
        new IngestionProperties.ResultCacheProperties(100, 24));
  }

  public static FfmpegProperties ffmpegProperties() {
    return new FfmpegProperties("ffmpeg", "ffprobe", 16000, 1, "flac", 30, 300, 120);
  }

  public static AudioInfo wavInfo(double durationSeconds, long sizeBytes) {
    return new AudioInfo(durationSeconds, sizeBytes, "pcm_s16le", 44100, 2, "wav");
  }

  public static AudioInfo flacInfo(double durationSeconds, long sizeBytes) {
    return new AudioInfo(durationSeconds, sizeBytes, "flac", 16000, 1, "flac");
  }
}
