package com.scholary.audio.ingest.service;

import com.scholary.audio.ingest.chunking.AudioChunk;
import com.scholary.audio.ingest.config.IngestionProperties;
import com.scholary.audio.ingest.logging.StructuredLogger;
import com.scholary.audio.ingest.ratelimit.RateLimiter;
import com.scholary.audio.ingest.transcript.ChunkTranscript;
import com.scholary.audio.ingest.transcript.EstimatedTimingSegmenter;
import com.scholary.audio.ingest.whisper.TranscribeOptions;
import com.scholary.audio.ingest.whisper.TranscriptSegment;
import com.scholary.audio.ingest.whisper.WhisperException;
import com.scholary.audio.ingest.whisper.WhisperResponse;
import com.scholary.audio.ingest.whisper.WhisperService;
import java.io.IOException;
import java.nio.file.Files;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Sends chunks to the recognition service one at a time, in chunk order.
 *
 * <p>Each chunk moves {@code PENDING -> CALLING -> SUCCEEDED | FAILED}. Calls are never issued in
 * parallel: the service quota is global, so the shared {@link RateLimiter} is acquired before
 * every call and is the only point where ingestions synchronize with each other.
 *
 * <p>Failure policy is all-or-nothing by default. The first failed chunk aborts the ingestion and
 * the chunks after it are never submitted. With {@code allowPartialTranscripts} enabled, failed
 * chunks are skipped and reported so the caller can mark them as gaps.
 */
@Component
public class ChunkTranscriptionDriver {

  private static final Logger LOGGER = LoggerFactory.getLogger(ChunkTranscriptionDriver.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final WhisperService whisperService;
  private final RateLimiter rateLimiter;
  private final EstimatedTimingSegmenter timingSegmenter;
  private final Clock clock;
  private final boolean allowPartialTranscripts;
  private final double segmentDurationSeconds;

  public ChunkTranscriptionDriver(
      WhisperService whisperService,
      RateLimiter rateLimiter,
      EstimatedTimingSegmenter timingSegmenter,
      IngestionProperties properties,
      Clock clock) {
    this.whisperService = whisperService;
    this.rateLimiter = rateLimiter;
    this.timingSegmenter = timingSegmenter;
    this.clock = clock;
    this.allowPartialTranscripts = properties.allowPartialTranscripts();
    this.segmentDurationSeconds = properties.segmentDurationSeconds();
  }

  /**
   * Transcribe every chunk, strictly in order.
   *
   * @param chunks chunks in ascending index order
   * @param deadline the ingestion's deadline
   * @return transcripts in chunk order, plus failures if partial transcripts are enabled
   * @throws ChunkTranscriptionException on the first failed chunk (fail-fast mode), or if no chunk
   *     succeeded (partial mode)
   * @throws DeadlineExceededException if the deadline passes before all chunks are sent
   */
  public Outcome transcribe(List<AudioChunk> chunks, Instant deadline) {
    ChunkState[] states = new ChunkState[chunks.size()];
    Arrays.fill(states, ChunkState.PENDING);

    List<ChunkTranscript> transcripts = new ArrayList<>(chunks.size());
    List<ChunkFailure> failures = new ArrayList<>();

    for (int i = 0; i < chunks.size(); i++) {
      AudioChunk chunk = chunks.get(i);
      if (i > 0 && chunk.chunkIndex() <= chunks.get(i - 1).chunkIndex()) {
        throw new IllegalArgumentException("Chunks must be in ascending index order");
      }

      try {
        transcripts.add(transcribeChunk(chunk, chunks.size(), deadline, states, i));
        states[i] = ChunkState.SUCCEEDED;
      } catch (ChunkTranscriptionException e) {
        states[i] = ChunkState.FAILED;
        int abandoned = allowPartialTranscripts ? 0 : chunks.size() - i - 1;
        structuredLogger.logChunkFailed(
            chunk.chunkIndex(), abandoned, rootCauseName(e), e.getMessage());

        if (!allowPartialTranscripts) {
          LOGGER.error("Aborting transcription, chunk states: {}", Arrays.toString(states));
          throw e;
        }
        failures.add(new ChunkFailure(chunk, e));
      }
    }

    if (!failures.isEmpty() && transcripts.isEmpty()) {
      throw failures.get(0).cause();
    }
    if (!failures.isEmpty()) {
      LOGGER.warn(
          "Accepting partial transcript: {} of {} chunks failed", failures.size(), chunks.size());
    }

    return new Outcome(transcripts, failures);
  }

  private ChunkTranscript transcribeChunk(
      AudioChunk chunk, int totalChunks, Instant deadline, ChunkState[] states, int position) {
    int index = chunk.chunkIndex();
    if (!clock.instant().isBefore(deadline)) {
      throw new DeadlineExceededException(index, "Deadline passed before chunk " + index);
    }

    byte[] audioBytes;
    try {
      audioBytes = Files.readAllBytes(chunk.sourcePath());
    } catch (IOException e) {
      throw new ChunkTranscriptionException(index, "cannot read chunk file", e);
    }

    long waitStart = clock.millis();
    try {
      if (!rateLimiter.acquire(deadline)) {
        throw new DeadlineExceededException(
            index, "Rate limit wait for chunk " + index + " would pass the deadline");
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ChunkTranscriptionException(index, "interrupted waiting for rate limit", e);
    }
    long waitedMs = clock.millis() - waitStart;

    states[position] = ChunkState.CALLING;
    structuredLogger.logChunkStarted(index, totalChunks, chunk.startTime(), chunk.duration());

    long callStart = clock.millis();
    WhisperResponse response;
    try {
      response =
          whisperService.transcribe(
              audioBytes,
              chunk.sourcePath().getFileName().toString(),
              TranscribeOptions.withTimestamps());
    } catch (WhisperException e) {
      throw new ChunkTranscriptionException(index, e.getMessage(), e);
    } catch (RuntimeException e) {
      throw new ChunkTranscriptionException(index, "recognition call failed: " + e, e);
    }
    if (response == null) {
      throw new ChunkTranscriptionException(
          index, "recognition service returned no response", null);
    }

    List<TranscriptSegment> segments = response.segments();
    if (segments.isEmpty() && response.text() != null && !response.text().isBlank()) {
      LOGGER.warn("Chunk {} returned text without timestamps, estimating timing", index);
      segments =
          timingSegmenter.segment(response.text(), chunk.duration(), segmentDurationSeconds);
    }

    structuredLogger.logChunkFinished(
        index, segments.size(), waitedMs, clock.millis() - callStart);

    return new ChunkTranscript(
        index, chunk.startTime(), chunk.duration(), segments, response.language());
  }

  private static String rootCauseName(Throwable e) {
    Throwable cause = e;
    while (cause.getCause() != null) {
      cause = cause.getCause();
    }
    return cause.getClass().getSimpleName();
  }

  /** A chunk that could not be transcribed. */
  public record ChunkFailure(AudioChunk chunk, ChunkTranscriptionException cause) {}

  /** Transcripts of the chunks that succeeded, and the ones that did not. */
  public record Outcome(List<ChunkTranscript> transcripts, List<ChunkFailure> failures) {

    public Outcome {
      transcripts = List.copyOf(transcripts);
      failures = List.copyOf(failures);
    }
  }
}
