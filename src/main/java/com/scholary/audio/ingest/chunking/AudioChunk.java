package com.scholary.audio.ingest.chunking;

import java.nio.file.Path;

/**
 * One extracted slice of the recording, ready to send to the recognition service.
 *
 * <p>{@code startTime} is the slice's offset in the original recording; the chunk's own transcript
 * timestamps are relative to it. Chunk indices follow chronological order.
 */
public record AudioChunk(Path sourcePath, int chunkIndex, double startTime, double duration) {

  public AudioChunk {
    if (chunkIndex < 0) {
      throw new IllegalArgumentException("Chunk index cannot be negative");
    }
    if (startTime < 0) {
      throw new IllegalArgumentException("Start time cannot be negative");
    }
    if (duration <= 0) {
      throw new IllegalArgumentException("Chunk duration must be positive");
    }
  }

  public double endTime() {
    return startTime + duration;
  }

  public TimeRange range() {
    return new TimeRange(startTime, endTime());
  }
}
