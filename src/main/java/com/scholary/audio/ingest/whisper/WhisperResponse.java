package com.scholary.audio.ingest.whisper;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

/**
 * Response from the Whisper transcription API.
 *
 * <p>Segments are only present for {@code verbose_json} responses; plain {@code json} responses
 * carry the text alone.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WhisperResponse(String text, String language, List<TranscriptSegment> segments) {

  public WhisperResponse {
    segments = segments == null ? List.of() : List.copyOf(segments);
  }
}
