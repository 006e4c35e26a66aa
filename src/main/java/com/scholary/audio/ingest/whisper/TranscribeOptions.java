package com.scholary.audio.ingest.whisper;

/**
 * Per-request options for the recognition service.
 *
 * @param wantTimestamps request segment-level timestamps
 * @param language ISO-639-1 hint, or null to let the service detect it
 */
public record TranscribeOptions(boolean wantTimestamps, String language) {

  public static TranscribeOptions withTimestamps() {
    return new TranscribeOptions(true, null);
  }
}
