package com.scholary.audio.ingest.chunking;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.scholary.audio.ingest.chunking.FfmpegCommandRunner.CommandResult;
import com.scholary.audio.ingest.service.IngestErrorKind;
import com.scholary.audio.ingest.testutil.TestFixtures;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class FfmpegAudioCompressorTest {

  @Mock private FfmpegCommandRunner commandRunner;

  @TempDir Path tempDir;

  private FfmpegAudioCompressor compressor;
  private Path input;

  @BeforeEach
  void setUp() throws IOException {
    compressor = new FfmpegAudioCompressor(TestFixtures.ffmpegProperties(), commandRunner);
    input = Files.write(tempDir.resolve("original"), new byte[4096]);
  }

  @Test
  void compressInto_shouldReencodeToTargetFormat() throws Exception {
    when(commandRunner.run(anyList(), any(Duration.class)))
        .thenAnswer(
            invocation -> {
              List<String> command = invocation.getArgument(0);
              Files.write(Path.of(command.get(command.size() - 1)), new byte[1024]);
              return new CommandResult(0, "");
            });

    Path output = compressor.compressInto(input, tempDir);

    assertThat(output).isEqualTo(tempDir.resolve("compressed.flac")).exists();

    @SuppressWarnings("unchecked")
    ArgumentCaptor<List<String>> command = ArgumentCaptor.forClass(List.class);
    ArgumentCaptor<Duration> timeout = ArgumentCaptor.forClass(Duration.class);
    verify(commandRunner).run(command.capture(), timeout.capture());
    assertThat(command.getValue())
        .startsWith("ffmpeg", "-nostdin", "-i", input.toString())
        .containsSubsequence("-ar", "16000", "-ac", "1", "-c:a", "flac", "-y")
        .endsWith(output.toString());
    assertThat(timeout.getValue()).isEqualTo(Duration.ofSeconds(300));
  }

  @Test
  void compress_shouldStillSucceedWhenOutputGrows() throws Exception {
    when(commandRunner.run(anyList(), any(Duration.class)))
        .thenAnswer(
            invocation -> {
              List<String> command = invocation.getArgument(0);
              Files.write(Path.of(command.get(command.size() - 1)), new byte[8192]);
              return new CommandResult(0, "");
            });
    Path output = tempDir.resolve("bigger.flac");

    compressor.compress(input, output);

    assertThat(Files.size(output)).isGreaterThan(Files.size(input));
  }

  @Test
  void compress_shouldFailOnNonZeroExitAndRemovePartialOutput() throws Exception {
    Path output = tempDir.resolve("compressed.flac");
    when(commandRunner.run(anyList(), any(Duration.class)))
        .thenAnswer(
            invocation -> {
              Files.write(output, new byte[10]);
              return new CommandResult(1, "Invalid data found when processing input");
            });

    assertThatThrownBy(() -> compressor.compress(input, output))
        .isInstanceOf(CompressionException.class)
        .hasMessageContaining("exit code 1")
        .hasMessageContaining("Invalid data")
        .satisfies(
            e ->
                assertThat(((CompressionException) e).getKind())
                    .isEqualTo(IngestErrorKind.COMPRESSION));
    assertThat(output).doesNotExist();
  }

  @Test
  void compress_shouldWrapTimeout() throws Exception {
    when(commandRunner.run(anyList(), any(Duration.class)))
        .thenThrow(new IOException("ffmpeg timed out after 300s"));

    assertThatThrownBy(() -> compressor.compress(input, tempDir.resolve("compressed.flac")))
        .isInstanceOf(CompressionException.class)
        .hasCauseInstanceOf(IOException.class);
  }

  @Test
  void compress_shouldRestoreInterruptFlag() throws Exception {
    when(commandRunner.run(anyList(), any(Duration.class)))
        .thenThrow(new InterruptedException());

    try {
      assertThatThrownBy(() -> compressor.compress(input, tempDir.resolve("compressed.flac")))
          .isInstanceOf(CompressionException.class)
          .hasMessageContaining("interrupted");
      assertThat(Thread.currentThread().isInterrupted()).isTrue();
    } finally {
      Thread.interrupted();
    }
  }
}
