package com.scholary.podcast.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Each event puts its fields in the MDC for the duration of one log call so they can be queried
 * in Kibana. Context fields (job, episode, podcast) live for a whole unit of work and are managed
 * with the static helpers.
 */
public class StructuredLogger {

  public static final String JOB_ID = "jobId";
  public static final String EPISODE_ID = "episodeId";
  public static final String PODCAST_ID = "podcastId";

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log a newly registered episode. */
  public void logEpisodeDiscovered(String podcastId, String episodeId, String audioUrl) {
    try {
      MDC.put("event_type", "episode_discovered");
      MDC.put("discoveredEpisodeId", episodeId);
      MDC.put("audioUrl", audioUrl);

      logger.info(
          "Episode discovered: podcast={}, episodeId={}, audioUrl={}",
          podcastId,
          episodeId,
          audioUrl);
    } finally {
      clearEventFields();
    }
  }

  /** Log chunk started event. */
  public void logChunkStarted(int chunkIndex, double startSeconds, String storageKey) {
    try {
      MDC.put("event_type", "chunk_started");
      MDC.put("chunk_index", String.valueOf(chunkIndex));
      MDC.put("start", String.valueOf(startSeconds));

      logger.debug(
          "Chunk started: index={}, start={}s, key={}", chunkIndex, startSeconds, storageKey);
    } finally {
      clearEventFields();
    }
  }

  /** Log chunk finished event. */
  public void logChunkFinished(int chunkIndex, double startSeconds, long transcribeMs, boolean cached) {
    try {
      MDC.put("event_type", "chunk_finished");
      MDC.put("chunk_index", String.valueOf(chunkIndex));
      MDC.put("start", String.valueOf(startSeconds));
      MDC.put("transcribeMs", String.valueOf(transcribeMs));
      MDC.put("cached", String.valueOf(cached));

      logger.debug(
          "Chunk finished: index={}, start={}s, transcribe={}ms, cached={}",
          chunkIndex,
          startSeconds,
          transcribeMs,
          cached);
    } finally {
      clearEventFields();
    }
  }

  /** Log transcription failure event. */
  public void logTranscribeFailed(int chunkIndex, int maxAttempts, String errorType, String message) {
    try {
      MDC.put("event_type", "transcribe_failed");
      MDC.put("chunk_index", String.valueOf(chunkIndex));
      MDC.put("maxAttempts", String.valueOf(maxAttempts));
      MDC.put("errorType", errorType);

      logger.error(
          "Transcribe failed: chunk={}, maxAttempts={}, error={}, message={}",
          chunkIndex,
          maxAttempts,
          errorType,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Log bulk job progress event. */
  public void logJobProgress(
      String jobId, int processed, int total, int successful, int failed, String phase) {
    try {
      MDC.put("event_type", "job_progress");
      MDC.put("processed", String.valueOf(processed));
      MDC.put("total", String.valueOf(total));
      MDC.put("successful", String.valueOf(successful));
      MDC.put("failed", String.valueOf(failed));
      MDC.put("phase", phase);

      logger.info(
          "Job progress: jobId={}, phase={}, episodes={}/{}, successful={}, failed={}",
          jobId,
          phase,
          processed,
          total,
          successful,
          failed);
    } finally {
      clearEventFields();
    }
  }

  /** Log a stored final transcript. */
  public void logMergeCompleted(String episodeId, int chunks, int words, String transcriptKey) {
    try {
      MDC.put("event_type", "merge_completed");
      MDC.put("chunks", String.valueOf(chunks));
      MDC.put("words", String.valueOf(words));
      MDC.put("transcriptKey", transcriptKey);

      logger.info(
          "Merge completed: episodeId={}, chunks={}, words={}, key={}",
          episodeId,
          chunks,
          words,
          transcriptKey);
    } finally {
      clearEventFields();
    }
  }

  public static void setJobContext(String jobId) {
    MDC.put(JOB_ID, jobId);
  }

  public static void clearJobContext() {
    MDC.remove(JOB_ID);
  }

  public static void setEpisodeContext(String episodeId) {
    MDC.put(EPISODE_ID, episodeId);
  }

  public static void clearEpisodeContext() {
    MDC.remove(EPISODE_ID);
  }

  public static void setPodcastContext(String podcastId) {
    MDC.put(PODCAST_ID, podcastId);
  }

  public static void clearPodcastContext() {
    MDC.remove(PODCAST_ID);
  }

  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("discoveredEpisodeId");
    MDC.remove("audioUrl");
    MDC.remove("chunk_index");
    MDC.remove("start");
    MDC.remove("transcribeMs");
    MDC.remove("cached");
    MDC.remove("maxAttempts");
    MDC.remove("errorType");
    MDC.remove("processed");
    MDC.remove("total");
    MDC.remove("successful");
    MDC.remove("failed");
    MDC.remove("phase");
    MDC.remove("chunks");
    MDC.remove("words");
    MDC.remove("transcriptKey");
  }
}
