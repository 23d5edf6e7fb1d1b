package com.scholary.podcast.job;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.scholary.podcast.episode.TranscriptStatus;
import java.time.Instant;
import org.springframework.data.mongodb.core.mapping.Field;

/** Progress of one episode inside a bulk job. Embedded in the job document. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class EpisodeProgress {

  @Field("episode_id")
  @JsonProperty("episode_id")
  private String episodeId;

  private String title;

  @Field("audio_url")
  @JsonProperty("audio_url")
  private String audioUrl;

  @Field("duration_seconds")
  @JsonProperty("duration_seconds")
  private Integer durationSeconds;

  private TranscriptStatus status;

  @Field("error_message")
  @JsonProperty("error_message")
  private String errorMessage;

  @Field("transcript_key")
  @JsonProperty("transcript_key")
  private String transcriptKey;

  @Field("started_at")
  @JsonProperty("started_at")
  private Instant startedAt;

  @Field("completed_at")
  @JsonProperty("completed_at")
  private Instant completedAt;

  public EpisodeProgress() {}

  public EpisodeProgress(
      String episodeId, String title, String audioUrl, Integer durationSeconds) {
    this.episodeId = episodeId;
    this.title = title;
    this.audioUrl = audioUrl;
    this.durationSeconds = durationSeconds;
    this.status = TranscriptStatus.PENDING;
  }

  public void markProcessing(Instant now) {
    status = TranscriptStatus.PROCESSING;
    startedAt = now;
  }

  public void markCompleted(String transcriptKey, Instant now) {
    status = TranscriptStatus.COMPLETED;
    this.transcriptKey = transcriptKey;
    completedAt = now;
  }

  public void markFailed(String errorMessage, Instant now) {
    status = TranscriptStatus.FAILED;
    this.errorMessage = errorMessage;
    completedAt = now;
  }

  public String getEpisodeId() {
    return episodeId;
  }

  public void setEpisodeId(String episodeId) {
    this.episodeId = episodeId;
  }

  public String getTitle() {
    return title;
  }

  public void setTitle(String title) {
    this.title = title;
  }

  public String getAudioUrl() {
    return audioUrl;
  }

  public void setAudioUrl(String audioUrl) {
    this.audioUrl = audioUrl;
  }

  public Integer getDurationSeconds() {
    return durationSeconds;
  }

  public void setDurationSeconds(Integer durationSeconds) {
    this.durationSeconds = durationSeconds;
  }

  public TranscriptStatus getStatus() {
    return status;
  }

  public void setStatus(TranscriptStatus status) {
    this.status = status;
  }

  public String getErrorMessage() {
    return errorMessage;
  }

  public void setErrorMessage(String errorMessage) {
    this.errorMessage = errorMessage;
  }

  public String getTranscriptKey() {
    return transcriptKey;
  }

  public void setTranscriptKey(String transcriptKey) {
    this.transcriptKey = transcriptKey;
  }

  public Instant getStartedAt() {
    return startedAt;
  }

  public void setStartedAt(Instant startedAt) {
    this.startedAt = startedAt;
  }

  public Instant getCompletedAt() {
    return completedAt;
  }

  public void setCompletedAt(Instant completedAt) {
    this.completedAt = completedAt;
  }
}
