package com.scholary.podcast.ingestion;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Polls every active podcast on a fixed delay. Off unless ingestion.schedule.enabled is set. */
@Component
@ConditionalOnProperty(prefix = "ingestion.schedule", name = "enabled", havingValue = "true")
public class FeedPollingScheduler {

  private static final Logger LOGGER = LoggerFactory.getLogger(FeedPollingScheduler.class);

  private final FeedIngestor feedIngestor;

  public FeedPollingScheduler(FeedIngestor feedIngestor) {
    this.feedIngestor = feedIngestor;
  }

  @Scheduled(
      fixedDelayString = "${ingestion.schedule.fixedDelayMinutes:60}",
      initialDelayString = "${ingestion.schedule.fixedDelayMinutes:60}",
      timeUnit = java.util.concurrent.TimeUnit.MINUTES)
  public void poll() {
    try {
      IngestionResult result = feedIngestor.ingest((String) null);
      LOGGER.info(
          "Scheduled poll finished: podcasts={}, newEpisodes={}, errors={}",
          result.processedPodcasts(),
          result.totalNewEpisodes(),
          result.errors().size());
    } catch (RuntimeException e) {
      LOGGER.error("Scheduled poll failed", e);
    }
  }
}
