package com.scholary.audio.ingest.service;

/** Lifecycle of one chunk in the transcription driver. */
public enum ChunkState {
  PENDING,
  CALLING,
  SUCCEEDED,
  FAILED
}
