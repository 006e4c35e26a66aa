package com.scholary.audio.ingest.chunking;

import com.scholary.audio.ingest.service.IngestErrorKind;
import com.scholary.audio.ingest.service.IngestException;

/** Thrown when ffmpeg fails to re-encode the source audio. */
public class CompressionException extends IngestException {

  public CompressionException(String message) {
    super(IngestErrorKind.COMPRESSION, message);
  }

  public CompressionException(String message, Throwable cause) {
    super(IngestErrorKind.COMPRESSION, message, cause);
  }
}
