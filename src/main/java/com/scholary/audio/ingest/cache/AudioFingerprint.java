package com.scholary.audio.ingest.cache;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Content identity for uploaded audio.
 *
 * <p>The SHA-256 of the raw bytes is used as the audio id and as the idempotency key: uploading
 * byte-identical audio again finds the earlier result instead of re-running the pipeline.
 */
public final class AudioFingerprint {

  private AudioFingerprint() {}

  /**
   * Hash raw audio bytes.
   *
   * @param audioBytes the original upload
   * @return lowercase hex SHA-256
   */
  public static String sha256Hex(byte[] audioBytes) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return HexFormat.of().formatHex(digest.digest(audioBytes));
    } catch (NoSuchAlgorithmException e) {
      // Every JRE is required to ship SHA-256
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }
}
