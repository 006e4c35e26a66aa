package com.scholary.audio.ingest.service;

import com.scholary.audio.ingest.cache.AudioFingerprint;
import com.scholary.audio.ingest.cache.TranscriptStore;
import com.scholary.audio.ingest.chunking.AudioChunk;
import com.scholary.audio.ingest.chunking.ChunkPlanner;
import com.scholary.audio.ingest.chunking.FfmpegAudioCompressor;
import com.scholary.audio.ingest.chunking.FfmpegChunkSplitter;
import com.scholary.audio.ingest.chunking.ProcessingPlan;
import com.scholary.audio.ingest.chunking.SplitException;
import com.scholary.audio.ingest.chunking.TimeRange;
import com.scholary.audio.ingest.config.IngestionProperties;
import com.scholary.audio.ingest.logging.StructuredLogger;
import com.scholary.audio.ingest.probe.AudioInfo;
import com.scholary.audio.ingest.probe.FfprobeAudioProber;
import com.scholary.audio.ingest.probe.FfprobeAudioProber.ProbedFile;
import com.scholary.audio.ingest.probe.ProbeException;
import com.scholary.audio.ingest.transcript.AnalysisSegment;
import com.scholary.audio.ingest.transcript.ConcatenationMerger;
import com.scholary.audio.ingest.transcript.MergedSegment;
import com.scholary.audio.ingest.transcript.SegmentAggregator;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.FileSystemUtils;

/**
 * Turns an uploaded recording into a time-ordered, segmented transcript.
 *
 * <p>Pipeline: probe, plan, compress if too large, re-plan from the compressed size, split if
 * still too large, transcribe chunk by chunk under the shared rate limit, stitch onto the global
 * timeline and re-bucket into analysis segments.
 *
 * <p>Every ingestion works in its own temporary directory, which is deleted on every exit path.
 * Byte-identical audio seen before is answered from the {@link TranscriptStore}.
 */
@Service
public class AudioIngestionService {

  private static final Logger LOGGER = LoggerFactory.getLogger(AudioIngestionService.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final FfprobeAudioProber prober;
  private final ChunkPlanner planner;
  private final FfmpegAudioCompressor compressor;
  private final FfmpegChunkSplitter splitter;
  private final ChunkTranscriptionDriver driver;
  private final ConcatenationMerger merger;
  private final SegmentAggregator aggregator;
  private final TranscriptStore transcriptStore;
  private final IngestionProperties properties;
  private final Clock clock;
  private final Path tempDir;

  public AudioIngestionService(
      FfprobeAudioProber prober,
      ChunkPlanner planner,
      FfmpegAudioCompressor compressor,
      FfmpegChunkSplitter splitter,
      ChunkTranscriptionDriver driver,
      ConcatenationMerger merger,
      SegmentAggregator aggregator,
      TranscriptStore transcriptStore,
      IngestionProperties properties,
      Clock clock) {
    this.prober = prober;
    this.planner = planner;
    this.compressor = compressor;
    this.splitter = splitter;
    this.driver = driver;
    this.merger = merger;
    this.aggregator = aggregator;
    this.transcriptStore = transcriptStore;
    this.properties = properties;
    this.clock = clock;
    this.tempDir = Paths.get(properties.tempDir());

    try {
      Files.createDirectories(this.tempDir);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to create temp directory: " + tempDir, e);
    }
  }

  /**
   * Ingest audio with the configured default deadline.
   *
   * @see #ingest(byte[], Duration)
   */
  public IngestResult ingest(byte[] audioBytes) {
    return ingest(audioBytes, properties.deadline());
  }

  /**
   * Ingest audio.
   *
   * @param audioBytes the original upload
   * @param timeout how long the whole ingestion may take
   * @return the segmented transcript
   * @throws IngestException identifying the failed phase and, for transcription, the chunk
   */
  public IngestResult ingest(byte[] audioBytes, Duration timeout) {
    if (audioBytes == null || audioBytes.length == 0) {
      throw new ProbeException("Audio input is empty");
    }

    String audioId = AudioFingerprint.sha256Hex(audioBytes);
    Optional<IngestResult> existing = transcriptStore.find(audioId);
    if (existing.isPresent()) {
      LOGGER.info("Audio {} already processed, returning stored results", audioId);
      return existing.get().asCached();
    }

    String ingestionId = UUID.randomUUID().toString();
    StructuredLogger.setIngestionContext(ingestionId, audioId);
    Instant started = clock.instant();
    Instant deadline = started.plus(timeout);
    Path workDir = null;

    try {
      LOGGER.info(
          "Starting ingestion: {} bytes, deadline={}", audioBytes.length, deadline);

      workDir = createWorkDir();
      IngestResult result = runPipeline(audioBytes, audioId, workDir, deadline);

      if (result.isComplete()) {
        transcriptStore.save(audioId, result);
      }

      structuredLogger.logIngestionFinished(
          result.chunkCount(),
          result.segments().size(),
          result.gaps().size(),
          Duration.between(started, clock.instant()).toMillis());
      return result;

    } catch (IngestException e) {
      LOGGER.error("Ingestion failed in phase {}: {}", e.getKind(), e.getMessage());
      throw e;
    } finally {
      deleteWorkDir(workDir);
      StructuredLogger.clearIngestionContext();
    }
  }

  private IngestResult runPipeline(
      byte[] audioBytes, String audioId, Path workDir, Instant deadline) {
    ProbedFile original = prober.probe(audioBytes, workDir);
    AudioInfo info = original.info();
    checkDeadline(deadline, "probing");

    ProcessingPlan plan;
    List<AudioChunk> chunks;
    Long compressedSize = null;

    if (!planner.requiresCompression(info.sizeBytes(), info.durationSeconds())) {
      plan = planner.plan(info.sizeBytes(), null, info.durationSeconds());
      Path named = renameForUpload(original.path(), info);
      chunks = List.of(new AudioChunk(named, 0, 0.0, info.durationSeconds()));
    } else {
      Path compressed = compressor.compressInto(original.path(), workDir);
      checkDeadline(deadline, "compression");

      AudioInfo compressedInfo = prober.probe(compressed);
      compressedSize = compressedInfo.sizeBytes();
      double duration =
          compressedInfo.durationSeconds() > 0
              ? compressedInfo.durationSeconds()
              : info.durationSeconds();

      plan = planner.plan(info.sizeBytes(), compressedSize, duration);
      if (plan.needsSplitting()) {
        chunks =
            splitter.split(
                compressed, duration, plan.chunkDurationSeconds(), createChunkDir(workDir));
        checkDeadline(deadline, "splitting");
      } else {
        chunks = List.of(new AudioChunk(compressed, 0, 0.0, duration));
      }
    }

    structuredLogger.logPlanSelected(
        plan.needsCompression(),
        plan.needsSplitting(),
        chunks.size(),
        info.sizeBytes(),
        compressedSize,
        info.durationSeconds());

    ChunkTranscriptionDriver.Outcome outcome = driver.transcribe(chunks, deadline);

    List<MergedSegment> fragments = merger.merge(outcome.transcripts());
    List<AnalysisSegment> segments =
        aggregator.aggregate(fragments, properties.segmentDurationSeconds());
    List<TimeRange> gaps =
        outcome.failures().stream().map(failure -> failure.chunk().range()).toList();

    return new IngestResult(audioId, segments, plan, chunks.size(), gaps, false);
  }

  private void checkDeadline(Instant deadline, String phase) {
    if (!clock.instant().isBefore(deadline)) {
      throw new DeadlineExceededException("Deadline passed after " + phase);
    }
  }

  private static Path renameForUpload(Path original, AudioInfo info) {
    // The recognition service infers the format from the file name
    try {
      return Files.move(original, original.resolveSibling("original." + info.fileExtension()));
    } catch (IOException e) {
      throw new ProbeException("Failed to stage audio for upload", e);
    }
  }

  private Path createWorkDir() {
    try {
      return Files.createTempDirectory(tempDir, "ingest-");
    } catch (IOException e) {
      throw new IngestException(
          IngestErrorKind.WORKSPACE, "Cannot create work directory under " + tempDir, e);
    }
  }

  private static Path createChunkDir(Path workDir) {
    try {
      return Files.createDirectory(workDir.resolve("chunks"));
    } catch (IOException e) {
      throw new SplitException("Failed to create chunk directory", e);
    }
  }

  private static void deleteWorkDir(Path workDir) {
    if (workDir == null) {
      return;
    }
    try {
      FileSystemUtils.deleteRecursively(workDir);
      LOGGER.debug("Cleaned up work directory: {}", workDir);
    } catch (IOException e) {
      LOGGER.warn("Failed to clean up work directory {}: {}", workDir, e.getMessage());
    }
  }
}
