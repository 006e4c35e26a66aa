package com.scholary.audio.ingest.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.scholary.audio.ingest.config.IngestionProperties;
import com.scholary.audio.ingest.service.IngestResult;
import java.time.Duration;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * In-memory implementation of TranscriptStore using Caffeine.
 *
 * <p>Results expire a fixed time after they are written (default: 24 hours) and the cache size is
 * bounded, so memory stays flat however many distinct recordings are ingested.
 */
@Component
public class InMemoryTranscriptStore implements TranscriptStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryTranscriptStore.class);

  private final Cache<String, IngestResult> cache;

  public InMemoryTranscriptStore(IngestionProperties properties) {
    IngestionProperties.ResultCacheProperties cacheProperties = properties.resultCache();
    this.cache =
        Caffeine.newBuilder()
            .maximumSize(cacheProperties.maxSize())
            .expireAfterWrite(Duration.ofHours(cacheProperties.ttlHours()))
            .build();

    LOGGER.info(
        "Initialized transcript store: maxSize={}, ttlHours={}",
        cacheProperties.maxSize(),
        cacheProperties.ttlHours());
  }

  @Override
  public Optional<IngestResult> find(String audioId) {
    IngestResult result = cache.getIfPresent(audioId);
    if (result != null) {
      LOGGER.debug("Store hit: audioId={}", audioId);
      return Optional.of(result);
    }
    LOGGER.debug("Store miss: audioId={}", audioId);
    return Optional.empty();
  }

  @Override
  public void save(String audioId, IngestResult result) {
    cache.put(audioId, result);
    LOGGER.debug("Stored transcript: audioId={}, segments={}", audioId, result.segments().size());
  }

  @Override
  public void evict(String audioId) {
    cache.invalidate(audioId);
    LOGGER.debug("Evicted transcript: audioId={}", audioId);
  }
}
