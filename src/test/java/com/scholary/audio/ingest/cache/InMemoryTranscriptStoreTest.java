package com.scholary.audio.ingest.cache;

import static org.assertj.core.api.Assertions.assertThat;

import com.scholary.audio.ingest.chunking.ProcessingPlan;
import com.scholary.audio.ingest.service.IngestResult;
import com.scholary.audio.ingest.testutil.TestFixtures;
import com.scholary.audio.ingest.transcript.AnalysisSegment;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InMemoryTranscriptStoreTest {

  private InMemoryTranscriptStore store;

  @BeforeEach
  void setUp() {
    store = new InMemoryTranscriptStore(TestFixtures.ingestionProperties(Path.of("/tmp")));
  }

  @Test
  void find_shouldReturnEmptyForUnknownAudio() {
    assertThat(store.find("unknown")).isEmpty();
  }

  @Test
  void save_shouldMakeResultFindable() {
    IngestResult result = result("abc123");

    store.save("abc123", result);

    assertThat(store.find("abc123")).contains(result);
  }

  @Test
  void evict_shouldRemoveResult() {
    store.save("abc123", result("abc123"));

    store.evict("abc123");

    assertThat(store.find("abc123")).isEmpty();
  }

  private static IngestResult result(String audioId) {
    return new IngestResult(
        audioId,
        List.of(new AnalysisSegment(0, 5, "hello")),
        ProcessingPlan.passThrough(),
        1,
        List.of(),
        false);
  }
}
