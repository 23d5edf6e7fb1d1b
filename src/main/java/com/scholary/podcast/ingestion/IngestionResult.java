package com.scholary.podcast.ingestion;

import java.util.List;

/** Aggregate outcome of one ingestion run. */
public record IngestionResult(
    String message,
    int totalPodcasts,
    int processedPodcasts,
    int totalNewEpisodes,
    List<String> errors,
    List<PodcastIngestionResult> podcastResults) {

  public IngestionResult {
    errors = List.copyOf(errors);
    podcastResults = List.copyOf(podcastResults);
  }

  static IngestionResult empty(String message) {
    return new IngestionResult(message, 0, 0, 0, List.of(), List.of());
  }
}
