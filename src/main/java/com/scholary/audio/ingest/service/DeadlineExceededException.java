package com.scholary.audio.ingest.service;

/** Thrown when an ingestion runs past its caller-supplied deadline. */
public class DeadlineExceededException extends IngestException {

  public DeadlineExceededException(String message) {
    super(IngestErrorKind.DEADLINE_EXCEEDED, message);
  }

  public DeadlineExceededException(int chunkIndex, String message) {
    super(IngestErrorKind.DEADLINE_EXCEEDED, chunkIndex, message, null);
  }
}
