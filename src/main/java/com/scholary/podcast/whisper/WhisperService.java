package com.scholary.podcast.whisper;

import java.time.Duration;

/**
 * Speech-to-text backend.
 *
 * <p>Every call is a pure request/response; resending the same request is safe.
 */
public interface WhisperService {

  /**
   * Transcribe an audio payload already in memory.
   *
   * @param filename name reported to the backend
   * @param audio the audio bytes
   * @param timeout upper bound for the whole request
   * @return the plain-text transcript
   * @throws WhisperException if transcription fails
   */
  String transcribe(String filename, byte[] audio, Duration timeout);

  /**
   * Download audio from a URL and transcribe it.
   *
   * @throws WhisperException if the download or transcription fails
   */
  String transcribeUrl(String audioUrl, Duration timeout);

  /** @return true if the backend answered its health endpoint with 200 */
  boolean isHealthy();
}
