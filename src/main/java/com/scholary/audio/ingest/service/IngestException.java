package com.scholary.audio.ingest.service;

import java.util.Optional;

/**
 * Base exception for a failed ingestion.
 *
 * <p>Every failure is fatal to the ingestion it happened in. The kind tells the caller which phase
 * failed, and the chunk index (when present) which chunk, so it can decide whether a full
 * re-upload is worthwhile. Nothing is retried inside the pipeline.
 */
public class IngestException extends RuntimeException {

  private final IngestErrorKind kind;
  private final Integer chunkIndex;

  public IngestException(IngestErrorKind kind, String message) {
    this(kind, null, message, null);
  }

  public IngestException(IngestErrorKind kind, String message, Throwable cause) {
    this(kind, null, message, cause);
  }

  protected IngestException(
      IngestErrorKind kind, Integer chunkIndex, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
    this.chunkIndex = chunkIndex;
  }

  public IngestErrorKind getKind() {
    return kind;
  }

  public Optional<Integer> getChunkIndex() {
    return Optional.ofNullable(chunkIndex);
  }
}
