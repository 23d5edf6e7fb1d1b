package com.scholary.podcast.ingestion;

import java.util.List;

/**
 * Outcome for a single podcast.
 *
 * @param duplicateEpisodes items already registered, including inserts that lost a race
 */
public record PodcastIngestionResult(
    String podcastId,
    String podcastTitle,
    int newEpisodes,
    int duplicateEpisodes,
    List<String> errors) {

  public PodcastIngestionResult {
    errors = List.copyOf(errors);
  }
}
