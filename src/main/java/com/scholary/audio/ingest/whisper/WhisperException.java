package com.scholary.audio.ingest.whisper;

import java.util.OptionalInt;

/**
 * Exception thrown when Whisper API calls fail.
 *
 * <p>This could be due to network issues, service unavailability, quota rejection or invalid
 * responses. The HTTP status is kept when the service answered at all.
 */
public class WhisperException extends RuntimeException {

  private final Integer statusCode;

  public WhisperException(String message) {
    super(message);
    this.statusCode = null;
  }

  public WhisperException(String message, Throwable cause) {
    super(message, cause);
    this.statusCode = null;
  }

  public WhisperException(String message, int statusCode) {
    super(message);
    this.statusCode = statusCode;
  }

  public OptionalInt getStatusCode() {
    return statusCode == null ? OptionalInt.empty() : OptionalInt.of(statusCode);
  }
}
