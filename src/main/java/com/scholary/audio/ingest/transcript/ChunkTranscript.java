package com.scholary.audio.ingest.transcript;

import com.scholary.audio.ingest.chunking.TimeRange;
import com.scholary.audio.ingest.whisper.TranscriptSegment;
import java.util.List;

/**
 * Transcript for a single chunk with metadata.
 *
 * <p>Tracks the chunk's offset in the original recording so we can shift its chunk-local
 * timestamps onto the global timeline during merging.
 */
public record ChunkTranscript(
    int chunkIndex,
    double startTime,
    double duration,
    List<TranscriptSegment> segments,
    String language) {

  public ChunkTranscript {
    segments = List.copyOf(segments);
  }

  public double endTime() {
    return startTime + duration;
  }

  /** The span of the original recording this transcript covers. */
  public TimeRange range() {
    return new TimeRange(startTime, endTime());
  }
}
