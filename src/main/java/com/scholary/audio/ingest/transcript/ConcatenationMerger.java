package com.scholary.audio.ingest.transcript;

import com.scholary.audio.ingest.whisper.TranscriptSegment;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Stitches chunk transcripts onto the global timeline.
 *
 * <p>Chunks are cut back to back with no overlap, so there is nothing to de-duplicate: every
 * fragment is shifted by its chunk's start offset and the results are concatenated in chunk
 * order. For a single unsplit chunk the offset is zero and this is the identity.
 */
@Component
public class ConcatenationMerger {

  private static final Logger LOGGER = LoggerFactory.getLogger(ConcatenationMerger.class);

  /**
   * Merge chunk transcripts by offsetting and concatenating.
   *
   * @param chunkTranscripts transcripts in ascending chunk order
   * @return fragments with global timestamps, in chunk order
   * @throws StitchInvariantViolationException if the transcripts are not in chunk order
   */
  public List<MergedSegment> merge(List<ChunkTranscript> chunkTranscripts) {
    if (chunkTranscripts.isEmpty()) {
      return List.of();
    }

    validateChunkOrder(chunkTranscripts);

    LOGGER.info("Merging {} chunks with simple concatenation", chunkTranscripts.size());

    List<MergedSegment> merged = new ArrayList<>();
    for (ChunkTranscript chunk : chunkTranscripts) {
      LOGGER.debug(
          "Processing chunk {}: offset={}s, segments={}",
          chunk.chunkIndex(),
          chunk.startTime(),
          chunk.segments().size());

      for (TranscriptSegment segment : chunk.segments()) {
        merged.add(offset(segment, chunk.startTime()));
      }
    }

    LOGGER.info(
        "Concatenation complete: {} total segments from {} chunks",
        merged.size(),
        chunkTranscripts.size());
    return merged;
  }

  /** Shift a chunk-local fragment by its chunk's start offset. */
  public static MergedSegment offset(TranscriptSegment segment, double chunkStartTime) {
    return new MergedSegment(
        chunkStartTime + segment.start(), chunkStartTime + segment.end(), segment.text());
  }

  private static void validateChunkOrder(List<ChunkTranscript> chunkTranscripts) {
    for (int i = 1; i < chunkTranscripts.size(); i++) {
      ChunkTranscript previous = chunkTranscripts.get(i - 1);
      ChunkTranscript current = chunkTranscripts.get(i);

      if (current.chunkIndex() <= previous.chunkIndex()
          || current.startTime() < previous.startTime()) {
        throw new StitchInvariantViolationException(
            String.format(
                "Chunk %d (start %.3fs) follows chunk %d (start %.3fs)",
                current.chunkIndex(),
                current.startTime(),
                previous.chunkIndex(),
                previous.startTime()));
      }

      if (current.range().overlaps(previous.range())) {
        LOGGER.warn(
            "Unexpected overlap between chunks {} and {}: previous ends at {}s, current starts at {}s",
            previous.chunkIndex(),
            current.chunkIndex(),
            previous.endTime(),
            current.startTime());
      }
    }
  }
}
