package com.scholary.audio.ingest.chunking;

/**
 * How a recording has to be prepared before transcription.
 *
 * <p>Derived once per ingestion and never changed afterwards.
 */
public record ProcessingPlan(
    boolean needsCompression,
    boolean needsSplitting,
    Double chunkDurationSeconds, // null unless splitting
    int expectedChunkCount) {

  public ProcessingPlan {
    if (needsSplitting && (chunkDurationSeconds == null || chunkDurationSeconds <= 0)) {
      throw new IllegalArgumentException("A split plan needs a positive chunk duration");
    }
    if (needsSplitting && !needsCompression) {
      throw new IllegalArgumentException("Splitting is only planned for compressed audio");
    }
  }

  /** Send the original bytes as a single chunk. */
  public static ProcessingPlan passThrough() {
    return new ProcessingPlan(false, false, null, 1);
  }

  /** Compress, then send the compressed audio as a single chunk. */
  public static ProcessingPlan compressOnly() {
    return new ProcessingPlan(true, false, null, 1);
  }

  /** Compress, then cut into {@code chunkCount} chunks of the given duration. */
  public static ProcessingPlan compressAndSplit(double chunkDurationSeconds, int chunkCount) {
    return new ProcessingPlan(true, true, chunkDurationSeconds, chunkCount);
  }
}
