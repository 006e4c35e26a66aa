package com.scholary.audio.ingest.whisper;

/**
 * Interface for the external speech-recognition capability.
 *
 * <p>This abstraction allows us to swap transcription providers without changing the pipeline.
 * Implementations make exactly one request per call and never retry: a retry re-consumes the
 * service's quota.
 */
public interface WhisperService {

  /**
   * Transcribe audio.
   *
   * @param audioBytes the audio to transcribe; must be under the service's payload ceiling
   * @param fileName name sent with the upload; its extension tells the service the format
   * @param options request options
   * @return the transcription response
   * @throws WhisperException if transcription fails
   */
  WhisperResponse transcribe(byte[] audioBytes, String fileName, TranscribeOptions options);
}
