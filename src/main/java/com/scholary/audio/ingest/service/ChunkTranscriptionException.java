package com.scholary.audio.ingest.service;

/** Thrown when the recognition call for one chunk fails. The remaining chunks are abandoned. */
public class ChunkTranscriptionException extends IngestException {

  public ChunkTranscriptionException(int chunkIndex, String message, Throwable cause) {
    super(
        IngestErrorKind.CHUNK_TRANSCRIPTION,
        chunkIndex,
        String.format("Chunk %d: %s", chunkIndex, message),
        cause);
  }

  public int chunkIndex() {
    return getChunkIndex().orElseThrow();
  }
}
