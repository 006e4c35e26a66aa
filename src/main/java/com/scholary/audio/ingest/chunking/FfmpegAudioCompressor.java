package com.scholary.audio.ingest.chunking;

import com.scholary.audio.ingest.chunking.FfmpegCommandRunner.CommandResult;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Re-encodes audio to the low-bitrate target format (16 kHz mono FLAC by default).
 *
 * <p>Compression usually shrinks the file well below the request ceiling, but that is not assumed:
 * the caller measures the output and plans splitting from the actual size.
 */
@Component
public class FfmpegAudioCompressor {

  private static final Logger LOGGER = LoggerFactory.getLogger(FfmpegAudioCompressor.class);

  private final FfmpegProperties properties;
  private final FfmpegCommandRunner commandRunner;

  public FfmpegAudioCompressor(FfmpegProperties properties, FfmpegCommandRunner commandRunner) {
    this.properties = properties;
    this.commandRunner = commandRunner;
  }

  /**
   * Compress an audio file into a directory, naming the output after the target codec.
   *
   * @return the compressed file, {@code compressed.<ext>} inside {@code outputDir}
   * @throws CompressionException if ffmpeg fails, times out or is interrupted
   */
  public Path compressInto(Path inputFile, Path outputDir) {
    Path outputFile = outputDir.resolve("compressed." + properties.targetExtension());
    compress(inputFile, outputFile);
    return outputFile;
  }

  /**
   * Compress an audio file.
   *
   * @param inputFile the source audio
   * @param outputFile where to write the compressed audio (overwritten if present)
   * @throws CompressionException if ffmpeg fails, times out or is interrupted
   */
  public void compress(Path inputFile, Path outputFile) {
    LOGGER.info("Compressing {} to {}", inputFile.getFileName(), outputFile.getFileName());

    // -vn: drop embedded cover art, -ar/-ac: resample and downmix, -c:a: target codec
    List<String> command =
        List.of(
            properties.ffmpegPath(),
            "-nostdin",
            "-i",
            inputFile.toString(),
            "-vn",
            "-ar",
            String.valueOf(properties.targetSampleRate()),
            "-ac",
            String.valueOf(properties.targetChannels()),
            "-c:a",
            properties.targetCodec(),
            "-y",
            outputFile.toString());

    CommandResult result;
    try {
      result =
          commandRunner.run(command, Duration.ofSeconds(properties.compressTimeoutSeconds()));
    } catch (IOException e) {
      deleteQuietly(outputFile);
      throw new CompressionException("ffmpeg compression could not complete", e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      deleteQuietly(outputFile);
      throw new CompressionException("Compression interrupted", e);
    }

    if (!result.succeeded()) {
      deleteQuietly(outputFile);
      throw new CompressionException(
          String.format(
              "ffmpeg compression failed with exit code %d: %s",
              result.exitCode(), result.tail()));
    }

    logReduction(inputFile, outputFile);
  }

  private void logReduction(Path inputFile, Path outputFile) {
    try {
      long before = Files.size(inputFile);
      long after = Files.size(outputFile);
      if (after > before) {
        LOGGER.warn("Compression grew the audio: {} -> {} bytes", before, after);
      } else {
        LOGGER.info(
            "Compressed {} -> {} bytes (reduction: {}%)",
            before,
            after,
            String.format("%.1f", (1 - (double) after / before) * 100));
      }
    } catch (IOException e) {
      throw new CompressionException("Compressed output is not readable: " + outputFile, e);
    }
  }

  private static void deleteQuietly(Path file) {
    try {
      Files.deleteIfExists(file);
    } catch (IOException e) {
      LOGGER.warn("Failed to delete partial output {}: {}", file, e.getMessage());
    }
  }
}
