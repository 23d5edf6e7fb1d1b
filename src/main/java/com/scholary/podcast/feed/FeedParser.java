package com.scholary.podcast.feed;

/** Fetches and parses a podcast feed. */
public interface FeedParser {

  /**
   * Fetch the feed at the URL and parse it.
   *
   * @return channel metadata plus items in feed order
   * @throws FeedException with kind FETCH for I/O, timeout or non-2xx, PARSE for malformed XML
   */
  ParsedFeed parse(String feedUrl);
}
