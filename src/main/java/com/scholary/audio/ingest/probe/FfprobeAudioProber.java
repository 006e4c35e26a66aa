package com.scholary.audio.ingest.probe;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.audio.ingest.chunking.FfmpegCommandRunner;
import com.scholary.audio.ingest.chunking.FfmpegCommandRunner.CommandResult;
import com.scholary.audio.ingest.chunking.FfmpegProperties;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Inspects audio with ffprobe.
 *
 * <p>ffprobe is asked for JSON ({@code -print_format json -show_format -show_streams}) and the
 * first stream with {@code codec_type == "audio"} supplies codec, sample rate and channels.
 * Duration and size come from the container format section, with the file size on disk as a
 * fallback for formats that do not report one.
 */
@Component
public class FfprobeAudioProber {

  private static final Logger LOGGER = LoggerFactory.getLogger(FfprobeAudioProber.class);

  private final FfmpegProperties properties;
  private final FfmpegCommandRunner commandRunner;
  private final ObjectMapper objectMapper;

  public FfprobeAudioProber(
      FfmpegProperties properties, FfmpegCommandRunner commandRunner, ObjectMapper objectMapper) {
    this.properties = properties;
    this.commandRunner = commandRunner;
    this.objectMapper = objectMapper;
  }

  /**
   * Write raw audio bytes into a work directory and probe them.
   *
   * <p>The written file belongs to the caller, who owns the work directory.
   *
   * @param audioBytes raw audio
   * @param workDir directory to write into
   * @return the file written and what ffprobe reports about it
   * @throws ProbeException if the bytes are empty or not decodable audio
   */
  public ProbedFile probe(byte[] audioBytes, Path workDir) {
    if (audioBytes == null || audioBytes.length == 0) {
      throw new ProbeException("Audio input is empty");
    }

    Path file = workDir.resolve("original");
    try {
      Files.write(file, audioBytes);
    } catch (IOException e) {
      throw new ProbeException("Failed to stage audio for probing", e);
    }
    return new ProbedFile(file, probe(file));
  }

  /**
   * Probe an audio file.
   *
   * @param audioFile the file to inspect
   * @return duration, size, codec, sample rate and channel count
   * @throws ProbeException if the file is empty or not decodable audio
   */
  public AudioInfo probe(Path audioFile) {
    long fileSize;
    try {
      fileSize = Files.size(audioFile);
    } catch (IOException e) {
      throw new ProbeException("Cannot read audio file: " + audioFile, e);
    }
    if (fileSize == 0) {
      throw new ProbeException("Audio file is empty: " + audioFile.getFileName());
    }

    List<String> command =
        List.of(
            properties.ffprobePath(),
            "-v",
            "quiet",
            "-print_format",
            "json",
            "-show_format",
            "-show_streams",
            audioFile.toString());

    CommandResult result;
    try {
      result = commandRunner.run(command, Duration.ofSeconds(properties.probeTimeoutSeconds()));
    } catch (IOException e) {
      throw new ProbeException("ffprobe could not complete", e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ProbeException("Probing interrupted", e);
    }

    if (!result.succeeded()) {
      throw new ProbeException(
          String.format(
              "ffprobe failed with exit code %d: %s", result.exitCode(), result.tail()));
    }

    AudioInfo info = parse(result.output(), fileSize);
    LOGGER.info(
        "Audio info: duration={}s, size={} bytes, codec={}, sampleRate={}, channels={}",
        String.format("%.2f", info.durationSeconds()),
        info.sizeBytes(),
        info.codec(),
        info.sampleRate(),
        info.channels());
    return info;
  }

  private AudioInfo parse(String json, long fileSize) {
    JsonNode root;
    try {
      root = objectMapper.readTree(json);
    } catch (IOException e) {
      throw new ProbeException("Unparseable ffprobe output", e);
    }

    JsonNode audioStream = null;
    for (JsonNode stream : root.path("streams")) {
      if ("audio".equals(stream.path("codec_type").asText())) {
        audioStream = stream;
        break;
      }
    }
    if (audioStream == null) {
      throw new ProbeException("No audio stream found");
    }

    JsonNode format = root.path("format");
    // ffprobe reports numbers as strings
    double duration = format.path("duration").asDouble(0.0);
    if (duration <= 0) {
      duration = audioStream.path("duration").asDouble(0.0);
    }
    long size = format.path("size").asLong(0L);

    return new AudioInfo(
        duration,
        size > 0 ? size : fileSize,
        audioStream.path("codec_name").asText(null),
        audioStream.path("sample_rate").asInt(0),
        audioStream.path("channels").asInt(0),
        format.path("format_name").asText(null));
  }

  /** A file written by {@link #probe(byte[], Path)} together with its probe result. */
  public record ProbedFile(Path path, AudioInfo info) {}
}
