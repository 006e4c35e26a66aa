package com.scholary.audio.ingest.chunking;

import com.scholary.audio.ingest.service.IngestErrorKind;
import com.scholary.audio.ingest.service.IngestException;

/** Thrown when audio cannot be planned, e.g. it reports a zero duration. */
public class InvalidAudioException extends IngestException {

  public InvalidAudioException(String message) {
    super(IngestErrorKind.INVALID_AUDIO, message);
  }
}
