package com.scholary.podcast.podcast;

import java.time.Instant;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

/** A podcast subscription. Read-only input to feed ingestion apart from the poll timestamp. */
@Document(collection = "podcasts")
public class Podcast {

  @Id private String id;

  @Field("podcast_id")
  private String podcastId;

  @Field("rss_url")
  private String rssUrl;

  private String title;

  private boolean active;

  @Field("last_polled_at")
  private Instant lastPolledAt;

  public Podcast() {}

  public Podcast(String podcastId, String rssUrl, String title, boolean active) {
    this.podcastId = podcastId;
    this.rssUrl = rssUrl;
    this.title = title;
    this.active = active;
  }

  public String getId() {
    return id;
  }

  public void setId(String id) {
    this.id = id;
  }

  public String getPodcastId() {
    return podcastId;
  }

  public void setPodcastId(String podcastId) {
    this.podcastId = podcastId;
  }

  public String getRssUrl() {
    return rssUrl;
  }

  public void setRssUrl(String rssUrl) {
    this.rssUrl = rssUrl;
  }

  public String getTitle() {
    return title;
  }

  public void setTitle(String title) {
    this.title = title;
  }

  public boolean isActive() {
    return active;
  }

  public void setActive(boolean active) {
    this.active = active;
  }

  public Instant getLastPolledAt() {
    return lastPolledAt;
  }

  public void setLastPolledAt(Instant lastPolledAt) {
    this.lastPolledAt = lastPolledAt;
  }
}
