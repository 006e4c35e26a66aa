package com.scholary.audio.ingest.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Each event sets an {@code event_type} plus its own fields for the duration of one log call,
 * so they can be queried alongside the ingestion context ({@code ingestionId}, {@code audioId}).
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log the processing plan chosen for an ingestion. */
  public void logPlanSelected(
      boolean needsCompression,
      boolean needsSplitting,
      int chunkCount,
      long sizeBytes,
      Long compressedSizeBytes,
      double durationSeconds) {
    try {
      MDC.put("event_type", "plan_selected");
      MDC.put("needsCompression", String.valueOf(needsCompression));
      MDC.put("needsSplitting", String.valueOf(needsSplitting));
      MDC.put("chunkCount", String.valueOf(chunkCount));
      MDC.put("sizeBytes", String.valueOf(sizeBytes));
      MDC.put("compressedSizeBytes", String.valueOf(compressedSizeBytes));
      MDC.put("durationSeconds", String.valueOf(durationSeconds));

      logger.info(
          "Plan selected: compress={}, split={}, chunks={}, size={} bytes, compressed={} bytes,"
              + " duration={}s",
          needsCompression,
          needsSplitting,
          chunkCount,
          sizeBytes,
          compressedSizeBytes,
          durationSeconds);
    } finally {
      clearEventFields();
    }
  }

  /** Log chunk started event. */
  public void logChunkStarted(int chunkIndex, int totalChunks, double start, double duration) {
    try {
      MDC.put("event_type", "chunk_started");
      MDC.put("chunk_index", String.valueOf(chunkIndex));
      MDC.put("totalChunks", String.valueOf(totalChunks));
      MDC.put("start", String.valueOf(start));
      MDC.put("durationSeconds", String.valueOf(duration));

      logger.info(
          "Chunk started: index={}/{}, start={}s, duration={}s",
          chunkIndex,
          totalChunks,
          start,
          duration);
    } finally {
      clearEventFields();
    }
  }

  /** Log chunk finished event. */
  public void logChunkFinished(
      int chunkIndex, int fragmentCount, long waitedMs, long transcribeMs) {
    try {
      MDC.put("event_type", "chunk_finished");
      MDC.put("chunk_index", String.valueOf(chunkIndex));
      MDC.put("fragmentCount", String.valueOf(fragmentCount));
      MDC.put("waitedMs", String.valueOf(waitedMs));
      MDC.put("transcribeMs", String.valueOf(transcribeMs));

      logger.info(
          "Chunk finished: index={}, fragments={}, rateLimitWait={}ms, transcribe={}ms",
          chunkIndex,
          fragmentCount,
          waitedMs,
          transcribeMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log chunk failure event. */
  public void logChunkFailed(int chunkIndex, int abandonedChunks, String errorType, String message) {
    try {
      MDC.put("event_type", "chunk_failed");
      MDC.put("chunk_index", String.valueOf(chunkIndex));
      MDC.put("abandonedChunks", String.valueOf(abandonedChunks));
      MDC.put("errorType", errorType);

      logger.error(
          "Chunk failed: index={}, abandoned={}, error={}, message={}",
          chunkIndex,
          abandonedChunks,
          errorType,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Log ingestion finished event. */
  public void logIngestionFinished(int chunkCount, int segmentCount, int gapCount, long elapsedMs) {
    try {
      MDC.put("event_type", "ingestion_finished");
      MDC.put("chunkCount", String.valueOf(chunkCount));
      MDC.put("segmentCount", String.valueOf(segmentCount));
      MDC.put("gapCount", String.valueOf(gapCount));
      MDC.put("elapsedMs", String.valueOf(elapsedMs));

      logger.info(
          "Ingestion finished: chunks={}, segments={}, gaps={}, elapsed={}ms",
          chunkCount,
          segmentCount,
          gapCount,
          elapsedMs);
    } finally {
      clearEventFields();
    }
  }

  /** Set ingestion context in MDC. */
  public static void setIngestionContext(String ingestionId, String audioId) {
    MDC.put("ingestionId", ingestionId);
    MDC.put("audioId", audioId);
  }

  /** Clear ingestion context from MDC. */
  public static void clearIngestionContext() {
    MDC.remove("ingestionId");
    MDC.remove("audioId");
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("needsCompression");
    MDC.remove("needsSplitting");
    MDC.remove("chunkCount");
    MDC.remove("sizeBytes");
    MDC.remove("compressedSizeBytes");
    MDC.remove("durationSeconds");
    MDC.remove("chunk_index");
    MDC.remove("totalChunks");
    MDC.remove("start");
    MDC.remove("fragmentCount");
    MDC.remove("waitedMs");
    MDC.remove("transcribeMs");
    MDC.remove("abandonedChunks");
    MDC.remove("errorType");
    MDC.remove("segmentCount");
    MDC.remove("gapCount");
    MDC.remove("elapsedMs");
  }
}
