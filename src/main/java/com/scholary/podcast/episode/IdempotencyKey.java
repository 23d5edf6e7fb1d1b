package com.scholary.podcast.episode;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Deterministic episode identity derived from the audio URL.
 *
 * <p>The same URL always yields the same id, so two ingestors that discover the same episode
 * concurrently race on one document instead of creating two. The URL is hashed as-is: no
 * normalization, so URLs that differ only in query parameters are different episodes.
 */
public final class IdempotencyKey {

  private IdempotencyKey() {}

  /**
   * Hash an audio URL into an episode id.
   *
   * @param audioUrl the episode's audio URL
   * @return lowercase hex SHA-256 of the URL's UTF-8 bytes (64 characters)
   */
  public static String forAudioUrl(String audioUrl) {
    if (audioUrl == null || audioUrl.isEmpty()) {
      throw new IllegalArgumentException("Audio URL is required to derive an episode id");
    }
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return HexFormat.of().formatHex(digest.digest(audioUrl.getBytes(StandardCharsets.UTF_8)));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 is unavailable", e);
    }
  }
}
