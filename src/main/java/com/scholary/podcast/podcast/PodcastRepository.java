package com.scholary.podcast.podcast;

import java.time.Instant;
import java.util.List;

/** Read access to podcast subscriptions plus the poll bookkeeping written by ingestion. */
public interface PodcastRepository {

  List<Podcast> findActive();

  /** Active podcasts matching the id; empty if it doesn't exist or isn't active. */
  List<Podcast> findActiveByPodcastId(String podcastId);

  void markPolled(String podcastId, Instant polledAt);
}
