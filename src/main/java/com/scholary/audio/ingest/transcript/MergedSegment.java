package com.scholary.audio.ingest.transcript;

/**
 * A recognized fragment with absolute timing in the original recording.
 *
 * <p>After merging chunks, all timestamps reflect the position in the full audio, not within the
 * chunk the fragment came from.
 */
public record MergedSegment(double start, double end, String text) {}
