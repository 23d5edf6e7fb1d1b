package com.scholary.podcast.episode;

import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

/**
 * Writes episode status transitions on behalf of the pipeline stages.
 *
 * <p>A failed status write is logged and reported through the return value, never thrown: the
 * stage's own outcome (an uploaded transcript, a recorded error) stays the result of record.
 */
@Component
public class EpisodeStatusUpdater {

  private static final Logger LOGGER = LoggerFactory.getLogger(EpisodeStatusUpdater.class);

  private final EpisodeRepository episodeRepository;

  public EpisodeStatusUpdater(EpisodeRepository episodeRepository) {
    this.episodeRepository = episodeRepository;
  }

  public boolean markProcessing(String episodeId) {
    try {
      return episodeRepository.markProcessing(episodeId);
    } catch (DataAccessException e) {
      LOGGER.warn("Failed to mark episode {} as processing: {}", episodeId, e.getMessage());
      return false;
    }
  }

  public boolean markFailed(String episodeId, String errorMessage) {
    try {
      return episodeRepository.markFailed(episodeId, errorMessage);
    } catch (DataAccessException e) {
      LOGGER.warn(
          "Failed to mark episode {} as failed ({}): {}", episodeId, errorMessage, e.getMessage());
      return false;
    }
  }

  public boolean markCompleted(String episodeId, String transcriptKey, int wordCount) {
    try {
      return episodeRepository.markCompleted(episodeId, transcriptKey, wordCount, Instant.now());
    } catch (DataAccessException e) {
      LOGGER.warn(
          "Transcript {} stored but episode {} status update failed: {}",
          transcriptKey,
          episodeId,
          e.getMessage());
      return false;
    }
  }
}
