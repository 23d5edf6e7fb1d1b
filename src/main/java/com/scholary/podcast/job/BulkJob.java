package com.scholary.podcast.job;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.scholary.podcast.episode.TranscriptStatus;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

/**
 * A bulk transcription run over one feed.
 *
 * <p>Owned by the single task processing it; the document is rewritten whole after every step.
 * {@code processedEpisodes} always equals the number of episodes in a terminal status.
 */
@Document(collection = "bulk_transcribe_jobs")
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BulkJob {

  @Id @JsonIgnore private String id;

  @Field("job_id")
  @JsonProperty("job_id")
  private String jobId;

  @Field("rss_url")
  @JsonProperty("rss_url")
  private String rssUrl;

  @Field("podcast_title")
  @JsonProperty("podcast_title")
  private String podcastTitle;

  private BulkJobStatus status;

  @Field("total_episodes")
  @JsonProperty("total_episodes")
  private int totalEpisodes;

  @Field("processed_episodes")
  @JsonProperty("processed_episodes")
  private int processedEpisodes;

  @Field("successful_episodes")
  @JsonProperty("successful_episodes")
  private int successfulEpisodes;

  @Field("failed_episodes")
  @JsonProperty("failed_episodes")
  private int failedEpisodes;

  private List<EpisodeProgress> episodes = new ArrayList<>();

  @Field("current_episode")
  @JsonProperty("current_episode")
  private String currentEpisode;

  @Field("error_message")
  @JsonProperty("error_message")
  private String errorMessage;

  @Field("created_at")
  @JsonProperty("created_at")
  private Instant createdAt;

  @Field("updated_at")
  @JsonProperty("updated_at")
  private Instant updatedAt;

  @Field("completed_at")
  @JsonProperty("completed_at")
  private Instant completedAt;

  public BulkJob() {}

  public static BulkJob pending(
      String jobId, String rssUrl, String podcastTitle, List<EpisodeProgress> episodes) {
    Instant now = Instant.now();
    BulkJob job = new BulkJob();
    job.id = jobId;
    job.jobId = jobId;
    job.rssUrl = rssUrl;
    job.podcastTitle = podcastTitle;
    job.status = BulkJobStatus.PENDING;
    job.episodes = new ArrayList<>(episodes);
    job.totalEpisodes = episodes.size();
    job.createdAt = now;
    job.updatedAt = now;
    return job;
  }

  /** Count a finished episode towards the job totals. */
  public void recordOutcome(EpisodeProgress episode) {
    processedEpisodes++;
    if (episode.getStatus() == TranscriptStatus.COMPLETED) {
      successfulEpisodes++;
    } else {
      failedEpisodes++;
    }
  }

  public void finish(BulkJobStatus terminalStatus, Instant now) {
    status = terminalStatus;
    currentEpisode = null;
    completedAt = now;
  }

  public String getId() {
    return id;
  }

  public void setId(String id) {
    this.id = id;
  }

  public String getJobId() {
    return jobId;
  }

  public void setJobId(String jobId) {
    this.jobId = jobId;
  }

  public String getRssUrl() {
    return rssUrl;
  }

  public void setRssUrl(String rssUrl) {
    this.rssUrl = rssUrl;
  }

  public String getPodcastTitle() {
    return podcastTitle;
  }

  public void setPodcastTitle(String podcastTitle) {
    this.podcastTitle = podcastTitle;
  }

  public BulkJobStatus getStatus() {
    return status;
  }

  public void setStatus(BulkJobStatus status) {
    this.status = status;
  }

  public int getTotalEpisodes() {
    return totalEpisodes;
  }

  public void setTotalEpisodes(int totalEpisodes) {
    this.totalEpisodes = totalEpisodes;
  }

  public int getProcessedEpisodes() {
    return processedEpisodes;
  }

  public void setProcessedEpisodes(int processedEpisodes) {
    this.processedEpisodes = processedEpisodes;
  }

  public int getSuccessfulEpisodes() {
    return successfulEpisodes;
  }

  public void setSuccessfulEpisodes(int successfulEpisodes) {
    this.successfulEpisodes = successfulEpisodes;
  }

  public int getFailedEpisodes() {
    return failedEpisodes;
  }

  public void setFailedEpisodes(int failedEpisodes) {
    this.failedEpisodes = failedEpisodes;
  }

  public List<EpisodeProgress> getEpisodes() {
    return episodes;
  }

  public void setEpisodes(List<EpisodeProgress> episodes) {
    this.episodes = episodes;
  }

  public String getCurrentEpisode() {
    return currentEpisode;
  }

  public void setCurrentEpisode(String currentEpisode) {
    this.currentEpisode = currentEpisode;
  }

  public String getErrorMessage() {
    return errorMessage;
  }

  public void setErrorMessage(String errorMessage) {
    this.errorMessage = errorMessage;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public void setCreatedAt(Instant createdAt) {
    this.createdAt = createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  public void setUpdatedAt(Instant updatedAt) {
    this.updatedAt = updatedAt;
  }

  public Instant getCompletedAt() {
    return completedAt;
  }

  public void setCompletedAt(Instant completedAt) {
    this.completedAt = completedAt;
  }
}
