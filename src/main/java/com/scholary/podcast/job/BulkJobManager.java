package com.scholary.podcast.job;

import com.scholary.podcast.episode.IdempotencyKey;
import com.scholary.podcast.feed.AudioUrlExtractor;
import com.scholary.podcast.feed.EpisodeItem;
import com.scholary.podcast.feed.FeedParser;
import com.scholary.podcast.feed.ParsedFeed;
import com.scholary.podcast.logging.StructuredLogger;
import com.scholary.podcast.retry.Sleeper;
import com.scholary.podcast.service.ChunkTranscriptionCoordinator;
import com.scholary.podcast.service.TranscriptWriter;
import java.security.SecureRandom;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * Runs a whole feed through transcription as one tracked, cancellable job.
 *
 * <p>Each job is processed by one background task, one episode at a time, oldest episode first.
 * Cancellation is cooperative: it is observed between episodes, so the episode in flight always
 * finishes and is recorded first. Jobs do not share state apart from the live-job registry.
 */
@Service
public class BulkJobManager {

  private static final Logger LOGGER = LoggerFactory.getLogger(BulkJobManager.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private static final SecureRandom RANDOM = new SecureRandom();

  private final FeedParser feedParser;
  private final ChunkTranscriptionCoordinator coordinator;
  private final TranscriptWriter transcriptWriter;
  private final BulkJobRepository jobRepository;
  private final LiveJobRegistry liveJobs;
  private final Executor executor;
  private final BulkJobProperties properties;
  private final String bucket;
  private final Sleeper sleeper;

  @Autowired
  public BulkJobManager(
      FeedParser feedParser,
      ChunkTranscriptionCoordinator coordinator,
      TranscriptWriter transcriptWriter,
      BulkJobRepository jobRepository,
      LiveJobRegistry liveJobs,
      @Qualifier("bulkJobExecutor") Executor executor,
      BulkJobProperties properties,
      @Value("${objectstore.bucket}") String bucket) {
    this(
        feedParser,
        coordinator,
        transcriptWriter,
        jobRepository,
        liveJobs,
        executor,
        properties,
        bucket,
        Sleeper.THREAD);
  }

  BulkJobManager(
      FeedParser feedParser,
      ChunkTranscriptionCoordinator coordinator,
      TranscriptWriter transcriptWriter,
      BulkJobRepository jobRepository,
      LiveJobRegistry liveJobs,
      Executor executor,
      BulkJobProperties properties,
      String bucket,
      Sleeper sleeper) {
    this.feedParser = feedParser;
    this.coordinator = coordinator;
    this.transcriptWriter = transcriptWriter;
    this.jobRepository = jobRepository;
    this.liveJobs = liveJobs;
    this.executor = executor;
    this.properties = properties;
    this.bucket = bucket;
    this.sleeper = sleeper;
  }

  /**
   * Parse the feed and persist a PENDING job over its episodes, oldest first.
   *
   * @param maxEpisodes keep only the earliest episodes when set
   * @throws IllegalArgumentException if the feed has no episodes
   * @throws com.scholary.podcast.feed.FeedException if the feed can't be fetched or parsed
   */
  public BulkJob createJob(String feedUrl, Integer maxEpisodes) {
    LOGGER.info("Creating bulk transcribe job for: {}", feedUrl);

    ParsedFeed feed = feedParser.parse(feedUrl);
    if (feed.episodes().isEmpty()) {
      throw new IllegalArgumentException("No episodes found in RSS feed");
    }

    List<EpisodeItem> items = chronological(feed.episodes());
    if (maxEpisodes != null && maxEpisodes > 0 && maxEpisodes < items.size()) {
      items = items.subList(0, maxEpisodes);
    }

    List<EpisodeProgress> progress = new ArrayList<>(items.size());
    for (EpisodeItem item : items) {
      String audioUrl = AudioUrlExtractor.extract(item).orElse(null);
      String episodeId = audioUrl != null ? IdempotencyKey.forAudioUrl(audioUrl) : null;
      progress.add(new EpisodeProgress(episodeId, item.title(), audioUrl, item.durationSeconds()));
    }

    BulkJob job = BulkJob.pending(generateJobId(), feedUrl, feed.metadata().title(), progress);
    jobRepository.save(job);

    LOGGER.info("Created job {} with {} episodes", job.getJobId(), progress.size());
    return job;
  }

  /** Process the job on the background executor. */
  public void startJob(String jobId) {
    executor.execute(() -> processJob(jobId));
  }

  /**
   * Process every episode of the job in order, unless cancelled. Only a PENDING job is
   * processed; any other status is left untouched.
   *
   * @throws JobNotFoundException if the job doesn't exist
   */
  public void processJob(String jobId) {
    BulkJob job = getJob(jobId);
    if (job.getStatus() != BulkJobStatus.PENDING) {
      LOGGER.warn("Not processing job {}: status is {}, expected PENDING", jobId, job.getStatus());
      return;
    }
    CancellationToken token = liveJobs.register(jobId);
    StructuredLogger.setJobContext(jobId);
    try {
      LOGGER.info("Starting to process job {}", jobId);
      job.setStatus(BulkJobStatus.RUNNING);
      jobRepository.save(job);

      runEpisodes(job, token);

    } catch (RuntimeException e) {
      LOGGER.error("Job {} failed", jobId, e);
      job.setErrorMessage(e.getMessage());
      job.finish(BulkJobStatus.FAILED, Instant.now());
      saveQuietly(job);
    } finally {
      liveJobs.unregister(jobId);
      StructuredLogger.clearJobContext();
    }
  }

  /**
   * Request cancellation of a running job.
   *
   * @return true if the job was running
   */
  public boolean cancelJob(String jobId) {
    boolean cancelled = liveJobs.cancel(jobId);
    if (cancelled) {
      LOGGER.info("Cancelled job {}", jobId);
    }
    return cancelled;
  }

  public BulkJob getJob(String jobId) {
    return jobRepository.findByJobId(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
  }

  /** Most recent jobs first. */
  public List<BulkJob> listJobs() {
    return jobRepository.findRecent(properties.listLimit());
  }

  private void runEpisodes(BulkJob job, CancellationToken token) {
    List<EpisodeProgress> episodes = job.getEpisodes();

    for (int i = 0; i < episodes.size(); i++) {
      if (token.isCancellationRequested()) {
        cancel(job);
        return;
      }

      EpisodeProgress episode = episodes.get(i);
      episode.markProcessing(Instant.now());
      job.setCurrentEpisode(episode.getTitle());
      jobRepository.save(job);

      LOGGER.info("Processing episode {}/{}: {}", i + 1, episodes.size(), episode.getTitle());
      transcribe(job.getJobId(), i, episode);

      job.recordOutcome(episode);
      jobRepository.save(job);
      structuredLogger.logJobProgress(
          job.getJobId(),
          job.getProcessedEpisodes(),
          job.getTotalEpisodes(),
          job.getSuccessfulEpisodes(),
          job.getFailedEpisodes(),
          "transcribing");

      if (i < episodes.size() - 1 && !coolDown()) {
        cancel(job);
        return;
      }
    }

    job.finish(BulkJobStatus.COMPLETED, Instant.now());
    jobRepository.save(job);
    LOGGER.info(
        "Job {} completed. Success: {}, Failed: {}",
        job.getJobId(),
        job.getSuccessfulEpisodes(),
        job.getFailedEpisodes());
  }

  private void transcribe(String jobId, int index, EpisodeProgress episode) {
    if (episode.getAudioUrl() == null) {
      episode.markFailed("No audio URL found for episode", Instant.now());
      return;
    }

    String transcript;
    try {
      transcript =
          coordinator.transcribeEpisode(episode.getAudioUrl(), episode.getDurationSeconds());
    } catch (RuntimeException e) {
      LOGGER.error("Error transcribing episode {}: {}", index + 1, e.getMessage());
      episode.markFailed(e.getMessage(), Instant.now());
      return;
    }

    if (transcript == null || transcript.isBlank()) {
      episode.markFailed("Transcription returned empty result", Instant.now());
      return;
    }

    String transcriptKey = null;
    try {
      transcriptKey = transcriptWriter.writeBulkTranscript(bucket, jobId, index, transcript);
    } catch (RuntimeException e) {
      LOGGER.warn("Transcribed episode {} but could not store it: {}", index + 1, e.getMessage());
    }
    episode.markCompleted(transcriptKey, Instant.now());
    LOGGER.info("Successfully transcribed episode {}", index + 1);
  }

  /** @return false if interrupted, which is treated as a cancellation */
  private boolean coolDown() {
    if (properties.cooldownSeconds() <= 0) {
      return true;
    }
    try {
      sleeper.sleep(Duration.ofSeconds(properties.cooldownSeconds()));
      return true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  private void cancel(BulkJob job) {
    LOGGER.info("Job {} was cancelled", job.getJobId());
    job.setStatus(BulkJobStatus.CANCELLED);
    job.setCurrentEpisode(null);
    jobRepository.save(job);
  }

  private void saveQuietly(BulkJob job) {
    try {
      jobRepository.save(job);
    } catch (DataAccessException e) {
      LOGGER.error("Failed to record failure of job {}: {}", job.getJobId(), e.getMessage());
    }
  }

  static List<EpisodeItem> chronological(List<EpisodeItem> items) {
    List<EpisodeItem> sorted = new ArrayList<>(items);
    // List.sort is stable, so undated items keep their feed order among themselves
    sorted.sort(
        Comparator.comparing(
            EpisodeItem::publishedDate, Comparator.nullsLast(Comparator.naturalOrder())));
    return sorted;
  }

  static String generateJobId() {
    byte[] bytes = new byte[16];
    RANDOM.nextBytes(bytes);
    return "job_" + Base64.getUrlEncoder().encodeToString(bytes).substring(0, 16);
  }
}
