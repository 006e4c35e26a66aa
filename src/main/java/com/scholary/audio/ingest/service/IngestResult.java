package com.scholary.audio.ingest.service;

import com.scholary.audio.ingest.chunking.ProcessingPlan;
import com.scholary.audio.ingest.chunking.TimeRange;
import com.scholary.audio.ingest.transcript.AnalysisSegment;
import java.util.List;

/**
 * Outcome of one ingestion.
 *
 * @param audioId SHA-256 of the original bytes
 * @param segments the transcript, in time order
 * @param plan how the audio was prepared
 * @param chunkCount number of chunks sent for transcription
 * @param gaps time ranges of chunks that could not be transcribed; always empty unless partial
 *     transcripts are enabled
 * @param cached true if this result was found in the store instead of being computed
 */
public record IngestResult(
    String audioId,
    List<AnalysisSegment> segments,
    ProcessingPlan plan,
    int chunkCount,
    List<TimeRange> gaps,
    boolean cached) {

  public IngestResult {
    segments = List.copyOf(segments);
    gaps = List.copyOf(gaps);
  }

  public boolean isComplete() {
    return gaps.isEmpty();
  }

  public IngestResult asCached() {
    return new IngestResult(audioId, segments, plan, chunkCount, gaps, true);
  }
}
