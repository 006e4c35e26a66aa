package com.scholary.audio.ingest.chunking;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for ffmpeg operations.
 *
 * <p>The target format is what compressed audio and every chunk are re-encoded to. The defaults
 * (16 kHz mono FLAC) keep speech intelligible while shrinking typical recordings several times.
 */
@ConfigurationProperties(prefix = "ffmpeg")
@Validated
public record FfmpegProperties(
    @NotBlank String ffmpegPath,
    @NotBlank String ffprobePath,
    @Positive int targetSampleRate,
    @Positive int targetChannels,
    @NotBlank String targetCodec,
    @Positive int probeTimeoutSeconds,
    @Positive int compressTimeoutSeconds,
    @Positive int cutTimeoutSeconds) {

  /** File extension matching {@link #targetCodec()}. */
  public String targetExtension() {
    return switch (targetCodec) {
      case "libmp3lame", "mp3" -> "mp3";
      case "pcm_s16le" -> "wav";
      default -> targetCodec;
    };
  }
}
