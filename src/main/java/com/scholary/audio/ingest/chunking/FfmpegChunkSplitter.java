package com.scholary.audio.ingest.chunking;

import com.scholary.audio.ingest.chunking.FfmpegCommandRunner.CommandResult;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Cuts compressed audio into sequential, time-bounded chunk files.
 *
 * <p>Chunks cover {@code [0, totalDuration)} with no gaps and no overlap. Each chunk starts where
 * the previous one ended; the last chunk takes whatever remains and may be shorter than the
 * target. Chunk indices are assigned in emission order, which is chronological order, and the
 * stitching step relies on that.
 */
@Component
public class FfmpegChunkSplitter {

  private static final Logger LOGGER = LoggerFactory.getLogger(FfmpegChunkSplitter.class);

  /** Remainders shorter than this are folded into the last chunk instead of becoming a sliver. */
  static final double MIN_REMAINDER_SECONDS = 0.001;

  private static final int MAX_CHUNKS = 10_000;

  private final FfmpegProperties properties;
  private final FfmpegCommandRunner commandRunner;

  public FfmpegChunkSplitter(FfmpegProperties properties, FfmpegCommandRunner commandRunner) {
    this.properties = properties;
    this.commandRunner = commandRunner;
  }

  /**
   * Plan contiguous chunk ranges.
   *
   * @param totalSeconds total audio duration
   * @param chunkSeconds target chunk duration
   * @return ordered ranges whose durations sum to {@code totalSeconds}
   */
  public List<TimeRange> planRanges(double totalSeconds, double chunkSeconds) {
    if (!(totalSeconds > 0)) {
      throw new IllegalArgumentException("Total duration must be positive");
    }
    if (!(chunkSeconds > 0)) {
      throw new IllegalArgumentException("Chunk duration must be positive");
    }
    if (totalSeconds / chunkSeconds > MAX_CHUNKS) {
      throw new IllegalArgumentException(
          String.format(
              "Chunk duration %ss over %ss would exceed %d chunks",
              chunkSeconds, totalSeconds, MAX_CHUNKS));
    }

    List<TimeRange> ranges = new ArrayList<>();
    double start = 0.0;

    while (totalSeconds - start > MIN_REMAINDER_SECONDS) {
      double remaining = totalSeconds - start;
      double duration = remaining - chunkSeconds <= MIN_REMAINDER_SECONDS ? remaining : chunkSeconds;
      ranges.add(new TimeRange(start, start + duration));
      start += duration;
    }

    return ranges;
  }

  /**
   * Cut the audio into chunk files.
   *
   * @param inputFile compressed audio to cut
   * @param totalSeconds its total duration
   * @param chunkSeconds target chunk duration
   * @param outputDir directory for the chunk files
   * @return chunks in chronological order, indexed from 0
   * @throws SplitException if any cut fails; no chunk files are left behind
   */
  public List<AudioChunk> split(
      Path inputFile, double totalSeconds, double chunkSeconds, Path outputDir) {
    List<TimeRange> ranges;
    try {
      ranges = planRanges(totalSeconds, chunkSeconds);
    } catch (IllegalArgumentException e) {
      throw new SplitException("Cannot plan chunks: " + e.getMessage(), e);
    }

    LOGGER.info(
        "Splitting {} ({}s) into {} chunks of ~{}s",
        inputFile.getFileName(),
        String.format("%.2f", totalSeconds),
        ranges.size(),
        String.format("%.1f", chunkSeconds));

    List<AudioChunk> chunks = new ArrayList<>(ranges.size());
    try {
      for (int index = 0; index < ranges.size(); index++) {
        TimeRange range = ranges.get(index);
        Path chunkFile =
            outputDir.resolve(
                String.format("chunk_%04d.%s", index, properties.targetExtension()));

        cutChunk(inputFile, range, chunkFile);
        chunks.add(new AudioChunk(chunkFile, index, range.start(), range.duration()));

        LOGGER.info(
            "Created chunk {}: {}s - {}s",
            index,
            String.format("%.2f", range.start()),
            String.format("%.2f", range.end()));
      }
    } catch (SplitException e) {
      deleteChunks(chunks);
      throw e;
    }

    return List.copyOf(chunks);
  }

  private void cutChunk(Path inputFile, TimeRange range, Path outputFile) {
    List<String> command =
        List.of(
            properties.ffmpegPath(),
            "-nostdin",
            "-ss",
            String.format(Locale.ROOT, "%.3f", range.start()),
            "-t",
            String.format(Locale.ROOT, "%.3f", range.duration()),
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
      result = commandRunner.run(command, Duration.ofSeconds(properties.cutTimeoutSeconds()));
    } catch (IOException e) {
      deleteQuietly(outputFile);
      throw new SplitException("ffmpeg could not cut chunk at " + range.start() + "s", e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      deleteQuietly(outputFile);
      throw new SplitException("Chunk cutting interrupted", e);
    }

    if (!result.succeeded()) {
      deleteQuietly(outputFile);
      throw new SplitException(
          String.format(
              "ffmpeg chunking failed at %.2fs with exit code %d: %s",
              range.start(), result.exitCode(), result.tail()));
    }
  }

  private static void deleteChunks(List<AudioChunk> chunks) {
    for (AudioChunk chunk : chunks) {
      deleteQuietly(chunk.sourcePath());
    }
  }

  private static void deleteQuietly(Path file) {
    try {
      Files.deleteIfExists(file);
    } catch (IOException e) {
      LOGGER.warn("Failed to delete chunk file {}: {}", file, e.getMessage());
    }
  }
}
