package com.scholary.audio.ingest.probe;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.audio.ingest.chunking.FfmpegCommandRunner;
import com.scholary.audio.ingest.chunking.FfmpegCommandRunner.CommandResult;
import com.scholary.audio.ingest.probe.FfprobeAudioProber.ProbedFile;
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
class FfprobeAudioProberTest {

  private static final String MP3_PROBE =
      "{\"streams\": ["
          + "{\"index\": 0, \"codec_name\": \"mjpeg\", \"codec_type\": \"video\"},"
          + "{\"index\": 1, \"codec_name\": \"mp3\", \"codec_type\": \"audio\","
          + " \"sample_rate\": \"44100\", \"channels\": 2, \"duration\": \"719.5\"}],"
          + " \"format\": {\"filename\": \"original\", \"format_name\": \"mp3\","
          + " \"duration\": \"720.026122\", \"size\": \"41943040\", \"bit_rate\": \"466000\"}}";

  @Mock private FfmpegCommandRunner commandRunner;

  @TempDir Path tempDir;

  private FfprobeAudioProber prober;

  @BeforeEach
  void setUp() {
    prober =
        new FfprobeAudioProber(TestFixtures.ffmpegProperties(), commandRunner, new ObjectMapper());
  }

  @Test
  void probe_shouldReadFormatAndFirstAudioStream() throws Exception {
    Path file = Files.write(tempDir.resolve("original"), new byte[100]);
    when(commandRunner.run(anyList(), any(Duration.class))).thenReturn(new CommandResult(0, MP3_PROBE));

    AudioInfo info = prober.probe(file);

    assertThat(info.durationSeconds()).isCloseTo(720.026122, within(1e-9));
    assertThat(info.sizeBytes()).isEqualTo(41_943_040L);
    assertThat(info.codec()).isEqualTo("mp3");
    assertThat(info.sampleRate()).isEqualTo(44100);
    assertThat(info.channels()).isEqualTo(2);
    assertThat(info.formatName()).isEqualTo("mp3");
    assertThat(info.fileExtension()).isEqualTo("mp3");

    @SuppressWarnings("unchecked")
    ArgumentCaptor<List<String>> command = ArgumentCaptor.forClass(List.class);
    verify(commandRunner).run(command.capture(), any(Duration.class));
    assertThat(command.getValue())
        .containsExactly(
            "ffprobe", "-v", "quiet", "-print_format", "json", "-show_format", "-show_streams",
            file.toString());
  }

  @Test
  void probe_shouldFallBackToStreamDurationAndFileSize() throws Exception {
    Path file = Files.write(tempDir.resolve("original"), new byte[2048]);
    String json =
        "{\"streams\": [{\"codec_name\": \"opus\", \"codec_type\": \"audio\","
            + " \"sample_rate\": \"48000\", \"channels\": 1, \"duration\": \"12.5\"}],"
            + " \"format\": {\"format_name\": \"matroska,webm\"}}";
    when(commandRunner.run(anyList(), any(Duration.class))).thenReturn(new CommandResult(0, json));

    AudioInfo info = prober.probe(file);

    assertThat(info.durationSeconds()).isEqualTo(12.5);
    assertThat(info.sizeBytes()).isEqualTo(2048L);
    assertThat(info.fileExtension()).isEqualTo("webm");
  }

  @Test
  void probe_shouldRejectInputWithoutAudioStream() throws Exception {
    Path file = Files.write(tempDir.resolve("original"), new byte[100]);
    String json =
        "{\"streams\": [{\"codec_name\": \"h264\", \"codec_type\": \"video\"}],"
            + " \"format\": {\"format_name\": \"mov,mp4\", \"duration\": \"10.0\","
            + " \"size\": \"100\"}}";
    when(commandRunner.run(anyList(), any(Duration.class))).thenReturn(new CommandResult(0, json));

    assertThatThrownBy(() -> prober.probe(file))
        .isInstanceOf(ProbeException.class)
        .hasMessageContaining("No audio stream");
  }

  @Test
  void probe_shouldFailWhenFfprobeRejectsInput() throws Exception {
    Path file = Files.write(tempDir.resolve("original"), "not audio".getBytes());
    when(commandRunner.run(anyList(), any(Duration.class)))
        .thenReturn(new CommandResult(1, "Invalid data found when processing input"));

    assertThatThrownBy(() -> prober.probe(file))
        .isInstanceOf(ProbeException.class)
        .hasMessageContaining("exit code 1")
        .satisfies(e -> assertThat(((ProbeException) e).getKind()).isEqualTo(IngestErrorKind.PROBE));
  }

  @Test
  void probe_shouldFailOnUnparseableOutput() throws Exception {
    Path file = Files.write(tempDir.resolve("original"), new byte[100]);
    when(commandRunner.run(anyList(), any(Duration.class)))
        .thenReturn(new CommandResult(0, "{not json"));

    assertThatThrownBy(() -> prober.probe(file))
        .isInstanceOf(ProbeException.class)
        .hasMessageContaining("Unparseable");
  }

  @Test
  void probe_shouldWrapTimeout() throws Exception {
    Path file = Files.write(tempDir.resolve("original"), new byte[100]);
    when(commandRunner.run(anyList(), any(Duration.class)))
        .thenThrow(new IOException("ffprobe timed out after 30s"));

    assertThatThrownBy(() -> prober.probe(file))
        .isInstanceOf(ProbeException.class)
        .hasCauseInstanceOf(IOException.class);
  }

  @Test
  void probeBytes_shouldStageInputInWorkDir() throws Exception {
    when(commandRunner.run(anyList(), any(Duration.class))).thenReturn(new CommandResult(0, MP3_PROBE));
    byte[] audio = {1, 2, 3, 4};

    ProbedFile probed = prober.probe(audio, tempDir);

    assertThat(probed.path()).isEqualTo(tempDir.resolve("original"));
    assertThat(Files.readAllBytes(probed.path())).isEqualTo(audio);
    assertThat(probed.info().codec()).isEqualTo("mp3");
  }

  @Test
  void probeBytes_shouldRejectEmptyInput() throws Exception {
    assertThatThrownBy(() -> prober.probe(new byte[0], tempDir))
        .isInstanceOf(ProbeException.class)
        .hasMessage("Audio input is empty");

    verify(commandRunner, never()).run(anyList(), any(Duration.class));
  }

  @Test
  void probe_shouldRejectEmptyFile() throws Exception {
    Path file = Files.createFile(tempDir.resolve("empty.wav"));

    assertThatThrownBy(() -> prober.probe(file)).isInstanceOf(ProbeException.class);

    verify(commandRunner, never()).run(anyList(), any(Duration.class));
  }

  @Test
  void fileExtension_shouldMapCodecsToUploadableExtensions() {
    assertThat(TestFixtures.wavInfo(1.0, 1).fileExtension()).isEqualTo("wav");
    assertThat(TestFixtures.flacInfo(1.0, 1).fileExtension()).isEqualTo("flac");
    assertThat(new AudioInfo(1.0, 1, "aac", 44100, 2, "mov,mp4,m4a").fileExtension())
        .isEqualTo("m4a");
    assertThat(new AudioInfo(1.0, 1, "vorbis", 44100, 2, "ogg").fileExtension())
        .isEqualTo("ogg");
    assertThat(new AudioInfo(1.0, 1, "opus", 48000, 1, "ogg").fileExtension()).isEqualTo("ogg");
    assertThat(new AudioInfo(1.0, 1, null, 0, 0, null).fileExtension()).isEqualTo("wav");
  }
}
