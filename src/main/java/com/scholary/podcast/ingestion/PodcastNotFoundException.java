package com.scholary.podcast.ingestion;

public class PodcastNotFoundException extends RuntimeException {

  public PodcastNotFoundException(String podcastId) {
    super("Podcast not found or not active: " + podcastId);
  }
}
