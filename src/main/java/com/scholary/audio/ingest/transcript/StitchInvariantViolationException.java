package com.scholary.audio.ingest.transcript;

import com.scholary.audio.ingest.service.IngestErrorKind;
import com.scholary.audio.ingest.service.IngestException;

/** Thrown when stitched segments are out of order, overlap, or are empty. Should be unreachable. */
public class StitchInvariantViolationException extends IngestException {

  public StitchInvariantViolationException(String message) {
    super(IngestErrorKind.STITCH_INVARIANT, message);
  }
}
