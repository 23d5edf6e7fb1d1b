package com.scholary.podcast.feed;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RomeFeedParserTest {

  private RomeFeedParser parser;

  @BeforeEach
  void setUp() {
    parser = new RomeFeedParser(Duration.ofSeconds(1), Duration.ofSeconds(1));
  }

  @Test
  void parse_shouldReadMetadataIncludingItunesAuthor() {
    ParsedFeed feed = parser.parse(sampleFeed());

    PodcastMetadata metadata = feed.metadata();
    assertThat(metadata.title()).isEqualTo("Test Show");
    assertThat(metadata.description()).isEqualTo("A show about tests");
    assertThat(metadata.author()).isEqualTo("Jane Host");
    assertThat(metadata.language()).isEqualTo("en-us");
    assertThat(metadata.websiteUrl()).isEqualTo("https://example.com/show");
  }

  @Test
  void parse_shouldKeepFeedOrderAndReadEnclosuresAndDuration() {
    ParsedFeed feed = parser.parse(sampleFeed());

    assertThat(feed.episodes()).extracting(EpisodeItem::title).containsExactly("Episode 2", "Episode 1");

    EpisodeItem latest = feed.episodes().get(0);
    assertThat(latest.enclosures())
        .containsExactly(new EpisodeItem.Enclosure("https://cdn.example.com/2.mp3", "audio/mpeg"));
    assertThat(latest.durationSeconds()).isEqualTo(3723);
    assertThat(latest.publishedDate()).isEqualTo(Instant.parse("2024-01-02T10:00:00Z"));

    EpisodeItem oldest = feed.episodes().get(1);
    assertThat(oldest.enclosures()).isEmpty();
    assertThat(oldest.durationSeconds()).isNull();
    assertThat(AudioUrlExtractor.extract(oldest)).contains("https://example.com/show/1");
  }

  @Test
  void parse_shouldReportMalformedXmlAsParseError() {
    assertThatThrownBy(() -> parser.parse(stream("<rss><channel><title>broken")))
        .isInstanceOf(FeedException.class)
        .satisfies(e -> assertThat(((FeedException) e).getKind()).isEqualTo(FeedException.Kind.PARSE));
  }

  @Test
  void parse_shouldReportInvalidUrlAsFetchError() {
    assertThatThrownBy(() -> parser.parse("not a url"))
        .isInstanceOf(FeedException.class)
        .satisfies(e -> assertThat(((FeedException) e).getKind()).isEqualTo(FeedException.Kind.FETCH));
  }

  private static InputStream sampleFeed() {
    return RomeFeedParserTest.class.getResourceAsStream("/feeds/sample-feed.xml");
  }

  private static InputStream stream(String xml) {
    return new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8));
  }
}
