package com.scholary.audio.ingest.chunking;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Runs ffmpeg/ffprobe as external processes.
 *
 * <p>Output (stdout and stderr combined) is redirected to a temporary file rather than read from a
 * pipe, so a chatty process can never block on a full pipe buffer while we wait on it with a
 * timeout.
 */
@Component
public class FfmpegCommandRunner {

  private static final Logger LOGGER = LoggerFactory.getLogger(FfmpegCommandRunner.class);

  /**
   * Run a command to completion.
   *
   * @param command the executable and its arguments
   * @param timeout how long to wait before killing the process
   * @return the exit code and combined output
   * @throws IOException if the process cannot be started or times out
   * @throws InterruptedException if interrupted while waiting
   */
  public CommandResult run(List<String> command, Duration timeout)
      throws IOException, InterruptedException {
    LOGGER.debug("Executing: {}", String.join(" ", command));

    Path outputFile = Files.createTempFile("ffmpeg-", ".log");
    try {
      ProcessBuilder pb = new ProcessBuilder(command);
      pb.redirectErrorStream(true);
      pb.redirectOutput(outputFile.toFile());

      Process process = pb.start();
      boolean finished;
      try {
        finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
      } catch (InterruptedException e) {
        process.destroyForcibly();
        throw e;
      }

      if (!finished) {
        process.destroyForcibly();
        throw new IOException(
            String.format("%s timed out after %ds", command.get(0), timeout.toSeconds()));
      }

      String output = Files.readString(outputFile, StandardCharsets.UTF_8);
      return new CommandResult(process.exitValue(), output);
    } finally {
      Files.deleteIfExists(outputFile);
    }
  }

  /** Exit code and combined stdout/stderr of a finished process. */
  public record CommandResult(int exitCode, String output) {

    public boolean succeeded() {
      return exitCode == 0;
    }

    /** The last few lines of output, which is where ffmpeg reports what went wrong. */
    public String tail() {
      String trimmed = output.strip();
      int maxChars = 1000;
      return trimmed.length() <= maxChars
          ? trimmed
          : trimmed.substring(trimmed.length() - maxChars);
    }
  }
}
