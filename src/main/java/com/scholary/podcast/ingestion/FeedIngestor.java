package com.scholary.podcast.ingestion;

import com.scholary.podcast.episode.Episode;
import com.scholary.podcast.episode.EpisodeRepository;
import com.scholary.podcast.episode.EpisodeStatusUpdater;
import com.scholary.podcast.episode.IdempotencyKey;
import com.scholary.podcast.feed.AudioUrlExtractor;
import com.scholary.podcast.feed.EpisodeItem;
import com.scholary.podcast.feed.FeedException;
import com.scholary.podcast.feed.FeedParser;
import com.scholary.podcast.feed.ParsedFeed;
import com.scholary.podcast.logging.StructuredLogger;
import com.scholary.podcast.podcast.Podcast;
import com.scholary.podcast.podcast.PodcastRepository;
import com.scholary.podcast.workflow.WorkflowTrigger;
import com.scholary.podcast.workflow.WorkflowTriggerException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

/**
 * Discovers new episodes in subscribed feeds and hands them to the transcription workflow.
 *
 * <p>Podcasts are processed in parallel, at most {@code maxConcurrency} at a time: a permit is
 * taken before a podcast is submitted and returned when it finishes. The call returns once every
 * podcast is done. One podcast's failure is recorded in the result and never affects the others.
 *
 * <p>Deduplication is by audio URL. A lookup avoids most duplicate work; the unique index settles
 * races between concurrent runs, and losing that race counts as a duplicate, not an error.
 */
@Service
public class FeedIngestor {

  private static final Logger LOGGER = LoggerFactory.getLogger(FeedIngestor.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final PodcastRepository podcastRepository;
  private final EpisodeRepository episodeRepository;
  private final EpisodeStatusUpdater statusUpdater;
  private final FeedParser feedParser;
  private final WorkflowTrigger workflowTrigger;
  private final Executor executor;
  private final int maxConcurrency;
  private final int maxItemsPerFeed;
  private final String bucket;

  public FeedIngestor(
      PodcastRepository podcastRepository,
      EpisodeRepository episodeRepository,
      EpisodeStatusUpdater statusUpdater,
      FeedParser feedParser,
      WorkflowTrigger workflowTrigger,
      @Qualifier("ingestionExecutor") Executor executor,
      IngestionProperties properties,
      @Value("${objectstore.bucket}") String bucket) {
    this.podcastRepository = podcastRepository;
    this.episodeRepository = episodeRepository;
    this.statusUpdater = statusUpdater;
    this.feedParser = feedParser;
    this.workflowTrigger = workflowTrigger;
    this.executor = executor;
    this.maxConcurrency = properties.maxConcurrency();
    this.maxItemsPerFeed = properties.maxItemsPerFeed();
    this.bucket = bucket;
  }

  /**
   * Poll the active podcasts, or only the given one.
   *
   * @param podcastId restricts the run to one podcast when not null
   * @throws PodcastNotFoundException if a podcast id was given and no active podcast matches
   */
  public IngestionResult ingest(String podcastId) {
    List<Podcast> podcasts;
    if (podcastId != null && !podcastId.isBlank()) {
      LOGGER.info("Polling specific podcast: {}", podcastId);
      podcasts = podcastRepository.findActiveByPodcastId(podcastId);
      if (podcasts.isEmpty()) {
        throw new PodcastNotFoundException(podcastId);
      }
    } else {
      podcasts = podcastRepository.findActive();
      if (podcasts.isEmpty()) {
        LOGGER.info("No active podcasts to process");
        return IngestionResult.empty("No active podcasts to process");
      }
    }

    LOGGER.info("Found {} active podcasts", podcasts.size());
    IngestionResult result = ingest(podcasts);
    String message =
        podcastId != null && !podcastId.isBlank()
            ? "Polling completed for podcast " + podcastId
            : result.message();
    return new IngestionResult(
        message,
        result.totalPodcasts(),
        result.processedPodcasts(),
        result.totalNewEpisodes(),
        result.errors(),
        result.podcastResults());
  }

  /** Process the given podcasts; inactive ones are ignored. */
  public IngestionResult ingest(List<Podcast> podcasts) {
    List<Podcast> active = podcasts.stream().filter(Podcast::isActive).toList();
    Accumulator accumulator = new Accumulator();
    Semaphore permits = new Semaphore(maxConcurrency);
    CountDownLatch done = new CountDownLatch(active.size());

    try {
      for (Podcast podcast : active) {
        permits.acquire();
        try {
          executor.execute(
              () -> {
                try {
                  accumulator.add(processPodcast(podcast));
                } finally {
                  permits.release();
                  done.countDown();
                }
              });
        } catch (RejectedExecutionException e) {
          permits.release();
          done.countDown();
          accumulator.add(
              failedResult(podcast, "Podcast " + podcast.getPodcastId() + " was not scheduled"));
        }
      }
      done.await();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      LOGGER.warn("Ingestion interrupted; returning partial results");
    }

    IngestionResult result = accumulator.toResult(active.size());
    LOGGER.info(
        "RSS polling complete. Processed {} podcasts, found {} new episodes",
        result.processedPodcasts(),
        result.totalNewEpisodes());
    return result;
  }

  PodcastIngestionResult processPodcast(Podcast podcast) {
    StructuredLogger.setPodcastContext(podcast.getPodcastId());
    try {
      return doProcessPodcast(podcast);
    } catch (RuntimeException e) {
      LOGGER.error("Unexpected error processing podcast {}", podcast.getPodcastId(), e);
      return failedResult(podcast, "Unexpected error: " + e.getMessage());
    } finally {
      StructuredLogger.clearPodcastContext();
    }
  }

  private PodcastIngestionResult doProcessPodcast(Podcast podcast) {
    String podcastId = podcast.getPodcastId();
    String feedUrl = podcast.getRssUrl();
    if (feedUrl == null || feedUrl.isBlank()) {
      String error = "No feed URL found for podcast " + podcastId;
      LOGGER.error(error);
      return failedResult(podcast, error);
    }

    LOGGER.info("Processing podcast: {} ({})", podcast.getTitle(), podcastId);

    ParsedFeed feed;
    try {
      feed = feedParser.parse(feedUrl);
    } catch (FeedException e) {
      String error = String.format("Failed to parse feed %s: %s", feedUrl, e.getMessage());
      LOGGER.error(error);
      return failedResult(podcast, error);
    }

    List<EpisodeItem> items = feed.episodes();
    if (items.isEmpty()) {
      LOGGER.info("No items found in feed for podcast {}", podcast.getTitle());
    } else if (items.size() > maxItemsPerFeed) {
      LOGGER.info(
          "Limiting to {} most recent episodes out of {} total for podcast {}",
          maxItemsPerFeed,
          items.size(),
          podcast.getTitle());
      items = items.subList(0, maxItemsPerFeed);
    } else {
      LOGGER.debug("Feed for podcast {} has {} items", podcast.getTitle(), items.size());
    }

    int newEpisodes = 0;
    int duplicates = 0;
    List<String> errors = new ArrayList<>();

    for (EpisodeItem item : items) {
      Optional<String> audioUrl = AudioUrlExtractor.extract(item);
      if (audioUrl.isEmpty()) {
        LOGGER.info("No audio URL found for episode: {}", item.title());
        continue;
      }

      switch (registerEpisode(podcast, item, audioUrl.get(), errors)) {
        case NEW:
          newEpisodes++;
          break;
        case DUPLICATE:
          duplicates++;
          break;
        default:
          break;
      }
    }

    markPolled(podcastId);
    String title = feed.metadata().title() != null ? feed.metadata().title() : podcast.getTitle();
    return new PodcastIngestionResult(podcastId, title, newEpisodes, duplicates, errors);
  }

  private Registration registerEpisode(
      Podcast podcast, EpisodeItem item, String audioUrl, List<String> errors) {
    String episodeId = IdempotencyKey.forAudioUrl(audioUrl);

    try {
      if (episodeRepository.findByAudioUrl(audioUrl).isPresent()) {
        LOGGER.debug("Episode already registered: {}", episodeId);
        return Registration.DUPLICATE;
      }
    } catch (DataAccessException e) {
      errors.add("Database error checking episode: " + e.getMessage());
      return Registration.ERROR;
    }

    Episode episode =
        Episode.discovered(
            podcast.getPodcastId(), item.title(), item.description(), audioUrl, item.publishedDate());
    try {
      episodeRepository.insert(episode);
    } catch (DuplicateKeyException e) {
      LOGGER.info("Duplicate episode detected (race condition): {}", episodeId);
      return Registration.DUPLICATE;
    } catch (DataAccessException e) {
      errors.add(String.format("Failed to insert episode %s: %s", episodeId, e.getMessage()));
      return Registration.ERROR;
    }

    structuredLogger.logEpisodeDiscovered(podcast.getPodcastId(), episodeId, audioUrl);

    try {
      workflowTrigger.start(episodeId, audioUrl, bucket);
      LOGGER.info("Triggered workflow for episode {}", episodeId);
    } catch (WorkflowTriggerException e) {
      String error =
          String.format("Failed to trigger workflow for %s: %s", episodeId, e.getMessage());
      LOGGER.error(error);
      errors.add(error);
      // the episode stays registered; only its dispatch failed
      statusUpdater.markFailed(episodeId, e.getMessage());
    }
    return Registration.NEW;
  }

  private void markPolled(String podcastId) {
    try {
      podcastRepository.markPolled(podcastId, Instant.now());
    } catch (DataAccessException e) {
      LOGGER.warn("Failed to update last poll time for podcast {}: {}", podcastId, e.getMessage());
    }
  }

  private static PodcastIngestionResult failedResult(Podcast podcast, String error) {
    return new PodcastIngestionResult(
        podcast.getPodcastId(), podcast.getTitle(), 0, 0, List.of(error));
  }

  private enum Registration {
    NEW,
    DUPLICATE,
    ERROR
  }

  /** Shared across podcast workers; every access holds the lock. */
  private static final class Accumulator {

    private final ReentrantLock lock = new ReentrantLock();
    private final List<PodcastIngestionResult> results = new ArrayList<>();
    private final List<String> errors = new ArrayList<>();
    private int processed;
    private int newEpisodes;

    void add(PodcastIngestionResult result) {
      lock.lock();
      try {
        results.add(result);
        processed++;
        newEpisodes += result.newEpisodes();
        errors.addAll(result.errors());
      } finally {
        lock.unlock();
      }
    }

    IngestionResult toResult(int totalPodcasts) {
      lock.lock();
      try {
        return new IngestionResult(
            "RSS polling completed", totalPodcasts, processed, newEpisodes, errors, results);
      } finally {
        lock.unlock();
      }
    }
  }
}
