package com.scholary.audio.ingest.probe;

/**
 * What ffprobe reports about an audio file.
 *
 * @param durationSeconds duration of the container
 * @param sizeBytes file size
 * @param codec codec of the first audio stream, e.g. {@code mp3} or {@code pcm_s16le}
 * @param sampleRate sample rate of the first audio stream in Hz
 * @param channels channel count of the first audio stream
 * @param formatName ffprobe's container format name, e.g. {@code wav} or {@code mov,mp4,m4a}
 */
public record AudioInfo(
    double durationSeconds,
    long sizeBytes,
    String codec,
    int sampleRate,
    int channels,
    String formatName) {

  /** A file extension the recognition service will accept for this audio. */
  public String fileExtension() {
    if (codec == null) {
      return "wav";
    }
    if (codec.startsWith("pcm_")) {
      return "wav";
    }
    return switch (codec) {
      case "mp3" -> "mp3";
      case "flac" -> "flac";
      case "aac", "alac" -> "m4a";
      case "vorbis" -> "ogg";
      case "opus" -> formatName != null && formatName.contains("webm") ? "webm" : "ogg";
      default -> "wav";
    };
  }
}
