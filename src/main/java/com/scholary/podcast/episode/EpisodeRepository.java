package com.scholary.podcast.episode;

import java.time.Instant;
import java.util.Optional;

/**
 * Persistence for episode documents.
 *
 * <p>Each update touches one document and is atomic for that document only. Implementations throw
 * Spring's {@link org.springframework.dao.DuplicateKeyException} when an insert hits a uniqueness
 * constraint, and other {@link org.springframework.dao.DataAccessException}s for everything else,
 * so callers can tell a lost race from a broken store.
 */
public interface EpisodeRepository {

  Optional<Episode> findByAudioUrl(String audioUrl);

  Optional<Episode> findByEpisodeId(String episodeId);

  /**
   * Insert a new episode.
   *
   * @throws org.springframework.dao.DuplicateKeyException if the episode id or audio URL exists
   */
  void insert(Episode episode);

  /** @return true if an episode matched */
  boolean markProcessing(String episodeId);

  /** @return true if an episode matched */
  boolean markFailed(String episodeId, String errorMessage);

  /** @return true if an episode matched */
  boolean markCompleted(
      String episodeId, String transcriptKey, int wordCount, Instant processedAt);
}
