package com.scholary.audio.ingest.probe;

import com.scholary.audio.ingest.service.IngestErrorKind;
import com.scholary.audio.ingest.service.IngestException;

/** Thrown when the input is empty or ffprobe cannot find a decodable audio stream in it. */
public class ProbeException extends IngestException {

  public ProbeException(String message) {
    super(IngestErrorKind.PROBE, message);
  }

  public ProbeException(String message, Throwable cause) {
    super(IngestErrorKind.PROBE, message, cause);
  }
}
