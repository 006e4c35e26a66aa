package com.scholary.audio.ingest.transcript;

/**
 * A final transcript segment, sized for downstream per-segment classification.
 *
 * <p>Segments of one transcript are in ascending start order, do not overlap, and carry trimmed,
 * non-empty text.
 */
public record AnalysisSegment(double start, double end, String text) {

  public double duration() {
    return end - start;
  }
}
