package com.scholary.audio.ingest.service;

/** The pipeline phase an ingestion failed in. */
public enum IngestErrorKind {
  WORKSPACE,
  INVALID_AUDIO,
  PROBE,
  COMPRESSION,
  SPLIT,
  CHUNK_TRANSCRIPTION,
  STITCH_INVARIANT,
  DEADLINE_EXCEEDED
}
