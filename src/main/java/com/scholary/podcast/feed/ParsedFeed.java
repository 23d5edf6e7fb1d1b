package com.scholary.podcast.feed;

import java.util.List;

public record ParsedFeed(PodcastMetadata metadata, List<EpisodeItem> episodes) {

  public ParsedFeed {
    episodes = List.copyOf(episodes);
  }
}
