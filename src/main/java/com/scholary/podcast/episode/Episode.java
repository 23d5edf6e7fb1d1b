package com.scholary.podcast.episode;

import java.time.Instant;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

/**
 * An episode discovered in a podcast feed.
 *
 * <p>Created once per audio URL by the feed ingestor, then mutated by the transcription stages.
 * The document id is the episode id, so the primary key doubles as the dedup constraint.
 */
@Document(collection = "episodes")
public class Episode {

  @Id private String id;

  @Field("episode_id")
  private String episodeId;

  @Field("podcast_id")
  private String podcastId;

  private String title;
  private String description;

  @Field("audio_url")
  private String audioUrl;

  @Field("published_date")
  private Instant publishedDate;

  @Field("transcript_status")
  private TranscriptStatus transcriptStatus;

  @Field("transcript_s3_key")
  private String transcriptKey;

  @Field("transcript_word_count")
  private Integer transcriptWordCount;

  @Field("error_message")
  private String errorMessage;

  @Field("created_at")
  private Instant createdAt;

  @Field("updated_at")
  private Instant updatedAt;

  @Field("processed_at")
  private Instant processedAt;

  public Episode() {}

  /** Build a freshly discovered episode in PENDING state. */
  public static Episode discovered(
      String podcastId, String title, String description, String audioUrl, Instant publishedDate) {
    Instant now = Instant.now();
    Episode episode = new Episode();
    String episodeId = IdempotencyKey.forAudioUrl(audioUrl);
    episode.id = episodeId;
    episode.episodeId = episodeId;
    episode.podcastId = podcastId;
    episode.title = title;
    episode.description = description;
    episode.audioUrl = audioUrl;
    episode.publishedDate = publishedDate;
    episode.transcriptStatus = TranscriptStatus.PENDING;
    episode.createdAt = now;
    episode.updatedAt = now;
    return episode;
  }

  public String getId() {
    return id;
  }

  public void setId(String id) {
    this.id = id;
  }

  public String getEpisodeId() {
    return episodeId;
  }

  public void setEpisodeId(String episodeId) {
    this.episodeId = episodeId;
  }

  public String getPodcastId() {
    return podcastId;
  }

  public void setPodcastId(String podcastId) {
    this.podcastId = podcastId;
  }

  public String getTitle() {
    return title;
  }

  public void setTitle(String title) {
    this.title = title;
  }

  public String getDescription() {
    return description;
  }

  public void setDescription(String description) {
    this.description = description;
  }

  public String getAudioUrl() {
    return audioUrl;
  }

  public void setAudioUrl(String audioUrl) {
    this.audioUrl = audioUrl;
  }

  public Instant getPublishedDate() {
    return publishedDate;
  }

  public void setPublishedDate(Instant publishedDate) {
    this.publishedDate = publishedDate;
  }

  public TranscriptStatus getTranscriptStatus() {
    return transcriptStatus;
  }

  public void setTranscriptStatus(TranscriptStatus transcriptStatus) {
    this.transcriptStatus = transcriptStatus;
  }

  public String getTranscriptKey() {
    return transcriptKey;
  }

  public void setTranscriptKey(String transcriptKey) {
    this.transcriptKey = transcriptKey;
  }

  public Integer getTranscriptWordCount() {
    return transcriptWordCount;
  }

  public void setTranscriptWordCount(Integer transcriptWordCount) {
    this.transcriptWordCount = transcriptWordCount;
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

  public Instant getProcessedAt() {
    return processedAt;
  }

  public void setProcessedAt(Instant processedAt) {
    this.processedAt = processedAt;
  }
}
