package com.scholary.podcast.feed;

/** Channel-level fields of a feed. Any of them may be null. */
public record PodcastMetadata(
    String title,
    String description,
    String imageUrl,
    String author,
    String language,
    String websiteUrl) {}
