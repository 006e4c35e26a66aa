package com.scholary.audio.ingest.whisper;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * A single timestamped fragment of recognized text.
 *
 * <p>This matches the segment structure returned by the Whisper API. Times are relative to the
 * start of the audio that was sent, i.e. chunk-local.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TranscriptSegment(double start, double end, String text) {}
