package com.scholary.audio.ingest.chunking;

import com.scholary.audio.ingest.config.IngestionProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Decides whether a recording needs compression and splitting before transcription.
 *
 * <p>The recognition service rejects requests above {@code maxRequestBytes}. The decision is:
 *
 * <ol>
 *   <li>Fits as-is: send it unchanged, one chunk.
 *   <li>Too big, but the compressed file fits: compress only, one chunk.
 *   <li>Still too big after compression: compress and split into time-bounded chunks.
 * </ol>
 *
 * <p>The split decision always uses the measured size of the compressed file, never an estimate
 * made before compressing. Chunk duration is derived from the observed bytes per second of that
 * file so that each chunk lands near {@code targetChunkBytes}.
 *
 * <p>Everything here is a pure function of its arguments.
 */
@Component
public class ChunkPlanner {

  private static final Logger LOGGER = LoggerFactory.getLogger(ChunkPlanner.class);

  /** Shortest chunk we plan, regardless of bitrate. */
  public static final double MIN_CHUNK_SECONDS = 60.0;

  /** Longest chunk we plan, regardless of bitrate. */
  public static final double MAX_CHUNK_SECONDS = 300.0;

  /** Margin applied to the bitrate-derived chunk duration. */
  public static final double SAFETY_FACTOR = 0.9;

  private final long maxRequestBytes;
  private final long targetChunkBytes;

  public ChunkPlanner(IngestionProperties properties) {
    this.maxRequestBytes = properties.maxRequestBytes();
    this.targetChunkBytes = properties.targetChunkBytes();
  }

  /**
   * Check whether the original audio must be compressed before it can be sent.
   *
   * @throws InvalidAudioException if the duration is not positive
   */
  public boolean requiresCompression(long sizeBytes, double durationSeconds) {
    validateDuration(durationSeconds);
    return sizeBytes > maxRequestBytes;
  }

  /**
   * Plan how to prepare the audio.
   *
   * @param sizeBytes size of the original audio
   * @param compressedSizeBytes measured size after compression, or null if not compressed (only
   *     allowed when the original already fits)
   * @param durationSeconds duration of the recording
   * @return the processing plan
   * @throws InvalidAudioException if the duration is not positive
   */
  public ProcessingPlan plan(long sizeBytes, Long compressedSizeBytes, double durationSeconds) {
    validateDuration(durationSeconds);

    if (sizeBytes <= maxRequestBytes) {
      LOGGER.info(
          "Audio fits in one request ({} <= {} bytes), no compression needed",
          sizeBytes,
          maxRequestBytes);
      return ProcessingPlan.passThrough();
    }

    if (compressedSizeBytes == null) {
      throw new IllegalArgumentException(
          String.format(
              "Audio of %d bytes exceeds %d bytes; a compressed size is required to plan",
              sizeBytes, maxRequestBytes));
    }

    if (compressedSizeBytes <= maxRequestBytes) {
      LOGGER.info(
          "Compressed audio fits in one request ({} <= {} bytes)",
          compressedSizeBytes,
          maxRequestBytes);
      return ProcessingPlan.compressOnly();
    }

    double bytesPerSecond = compressedSizeBytes / durationSeconds;
    double clampedSeconds = clampedChunkSeconds(bytesPerSecond);
    int chunkCount = chunkCount(durationSeconds, clampedSeconds);

    double chunkSeconds = durationSeconds / chunkCount;
    if (chunkSeconds < MIN_CHUNK_SECONDS) {
      // Evening out would go below the floor; keep full-length chunks and a shorter tail.
      chunkSeconds = Math.min(clampedSeconds, durationSeconds);
    }

    if (chunkSeconds * bytesPerSecond > maxRequestBytes) {
      LOGGER.warn(
          "Planned chunks of {}s at {} B/s will still exceed {} bytes",
          String.format("%.1f", chunkSeconds),
          String.format("%.0f", bytesPerSecond),
          maxRequestBytes);
    }

    LOGGER.info(
        "Compressed audio still too large ({} bytes, {} B/s): splitting into {} chunks of {}s",
        compressedSizeBytes,
        String.format("%.0f", bytesPerSecond),
        chunkCount,
        String.format("%.1f", chunkSeconds));

    return ProcessingPlan.compressAndSplit(chunkSeconds, chunkCount);
  }

  /**
   * Chunk duration targeting {@code targetChunkBytes} at the observed bitrate, clamped to {@link
   * #MIN_CHUNK_SECONDS}..{@link #MAX_CHUNK_SECONDS}.
   */
  public double clampedChunkSeconds(double bytesPerSecond) {
    if (!(bytesPerSecond > 0)) {
      throw new InvalidAudioException("Observed bitrate must be positive, got " + bytesPerSecond);
    }
    double rawSeconds = (targetChunkBytes / bytesPerSecond) * SAFETY_FACTOR;
    return Math.max(MIN_CHUNK_SECONDS, Math.min(rawSeconds, MAX_CHUNK_SECONDS));
  }

  private static int chunkCount(double durationSeconds, double chunkSeconds) {
    // Tolerance so that an exact multiple does not round up to an extra chunk
    return Math.max(1, (int) Math.ceil(durationSeconds / chunkSeconds - 1e-9));
  }

  private static void validateDuration(double durationSeconds) {
    if (!(durationSeconds > 0) || Double.isInfinite(durationSeconds)) {
      throw new InvalidAudioException(
          "Audio duration must be positive and finite, got " + durationSeconds);
    }
  }
}
