package com.scholary.podcast.feed;

import java.util.Optional;

/** Picks the audio URL of a feed item. */
public final class AudioUrlExtractor {

  private AudioUrlExtractor() {}

  /**
   * The first enclosure whose type starts with {@code audio/}; failing that the item link; failing
   * that nothing.
   */
  public static Optional<String> extract(EpisodeItem item) {
    for (EpisodeItem.Enclosure enclosure : item.enclosures()) {
      if (enclosure.type() != null
          && enclosure.type().startsWith("audio/")
          && hasText(enclosure.url())) {
        return Optional.of(enclosure.url());
      }
    }
    if (hasText(item.link())) {
      return Optional.of(item.link());
    }
    return Optional.empty();
  }

  private static boolean hasText(String value) {
    return value != null && !value.isBlank();
  }
}
