package com.scholary.podcast.feed;

import java.time.Instant;
import java.util.List;

/**
 * One feed item.
 *
 * @param publishedDate null when the item carries no usable date
 * @param durationSeconds from itunes:duration, null when absent
 */
public record EpisodeItem(
    String title,
    String description,
    String link,
    List<Enclosure> enclosures,
    Instant publishedDate,
    Integer durationSeconds) {

  public EpisodeItem {
    enclosures = enclosures == null ? List.of() : List.copyOf(enclosures);
  }

  /** @param type declared media type, may be null */
  public record Enclosure(String url, String type) {}
}
