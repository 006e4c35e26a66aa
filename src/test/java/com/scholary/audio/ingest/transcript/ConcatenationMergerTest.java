package com.scholary.audio.ingest.transcript;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.scholary.audio.ingest.whisper.TranscriptSegment;
import java.util.List;
import org.junit.jupiter.api.Test;

class ConcatenationMergerTest {

  private final ConcatenationMerger merger = new ConcatenationMerger();

  @Test
  void merge_shouldReturnEmptyForNoChunks() {
    assertThat(merger.merge(List.of())).isEmpty();
  }

  @Test
  void merge_shouldBeIdentityForSingleUnsplitChunk() {
    ChunkTranscript only =
        new ChunkTranscript(
            0,
            0.0,
            30.0,
            List.of(new TranscriptSegment(0.0, 4.0, "Hi"), new TranscriptSegment(4.0, 9.5, "there")),
            "en");

    List<MergedSegment> merged = merger.merge(List.of(only));

    assertThat(merged)
        .containsExactly(new MergedSegment(0.0, 4.0, "Hi"), new MergedSegment(4.0, 9.5, "there"));
  }

  @Test
  void merge_shouldShiftFragmentsByChunkStart() {
    List<ChunkTranscript> chunks =
        List.of(
            new ChunkTranscript(0, 0.0, 240.0, List.of(new TranscriptSegment(1.0, 3.0, "a")), "en"),
            new ChunkTranscript(
                1, 240.0, 240.0, List.of(new TranscriptSegment(0.5, 2.0, "b")), "en"),
            new ChunkTranscript(
                2, 480.0, 240.0, List.of(new TranscriptSegment(5.0, 8.0, "c")), "en"));

    List<MergedSegment> merged = merger.merge(chunks);

    assertThat(merged)
        .containsExactly(
            new MergedSegment(1.0, 3.0, "a"),
            new MergedSegment(240.5, 242.0, "b"),
            new MergedSegment(485.0, 488.0, "c"));
  }

  @Test
  void offset_shouldShiftBothEnds() {
    assertThat(ConcatenationMerger.offset(new TranscriptSegment(5.0, 8.0, "x"), 240.0))
        .isEqualTo(new MergedSegment(245.0, 248.0, "x"));
  }

  @Test
  void merge_shouldKeepChunksWithoutFragments() {
    List<ChunkTranscript> chunks =
        List.of(
            new ChunkTranscript(0, 0.0, 240.0, List.of(), "en"),
            new ChunkTranscript(
                1, 240.0, 100.0, List.of(new TranscriptSegment(0.0, 2.0, "late")), "en"));

    assertThat(merger.merge(chunks)).containsExactly(new MergedSegment(240.0, 242.0, "late"));
  }

  @Test
  void merge_shouldRejectOutOfOrderChunks() {
    List<ChunkTranscript> chunks =
        List.of(
            new ChunkTranscript(1, 240.0, 240.0, List.of(), "en"),
            new ChunkTranscript(0, 0.0, 240.0, List.of(), "en"));

    assertThatThrownBy(() -> merger.merge(chunks))
        .isInstanceOf(StitchInvariantViolationException.class)
        .hasMessageContaining("Chunk 0");
  }
}
