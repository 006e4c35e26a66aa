package com.scholary.audio.ingest.cache;

import com.scholary.audio.ingest.service.IngestResult;
import java.util.Optional;

/**
 * Lookup of previously computed transcripts by audio id.
 *
 * <p>Keys are {@link AudioFingerprint#sha256Hex(byte[])} of the original upload. Entries expire
 * after a fixed time; retention beyond that is not this store's concern.
 */
public interface TranscriptStore {

  /**
   * Find the result of an earlier ingestion of the same audio.
   *
   * @param audioId the audio's content hash
   * @return the stored result, or empty if unknown or expired
   */
  Optional<IngestResult> find(String audioId);

  /**
   * Store a completed ingestion result.
   *
   * @param audioId the audio's content hash
   * @param result the result to store
   */
  void save(String audioId, IngestResult result);

  /**
   * Forget a stored result, e.g. to force re-processing.
   *
   * @param audioId the audio's content hash
   */
  void evict(String audioId);
}
