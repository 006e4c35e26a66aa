package com.scholary.audio.ingest.chunking;

import com.scholary.audio.ingest.service.IngestErrorKind;
import com.scholary.audio.ingest.service.IngestException;

/**
 * Thrown when cutting the compressed audio into chunks fails.
 *
 * <p>A split either produces every chunk or none: chunks already cut are deleted before this is
 * thrown.
 */
public class SplitException extends IngestException {

  public SplitException(String message) {
    super(IngestErrorKind.SPLIT, message);
  }

  public SplitException(String message, Throwable cause) {
    super(IngestErrorKind.SPLIT, message, cause);
  }
}
