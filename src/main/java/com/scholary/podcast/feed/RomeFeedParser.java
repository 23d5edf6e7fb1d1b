package com.scholary.podcast.feed;

import com.rometools.modules.itunes.EntryInformation;
import com.rometools.modules.itunes.FeedInformation;
import com.rometools.modules.itunes.ITunes;
import com.rometools.rome.feed.module.Module;
import com.rometools.rome.feed.synd.SyndContent;
import com.rometools.rome.feed.synd.SyndEnclosure;
import com.rometools.rome.feed.synd.SyndEntry;
import com.rometools.rome.feed.synd.SyndFeed;
import com.rometools.rome.io.SyndFeedInput;
import com.rometools.rome.io.XmlReader;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Feed parser backed by ROME, with rome-modules for the iTunes namespace.
 *
 * <p>The feed is fetched with the JDK HttpClient under explicit connect and request timeouts.
 */
public class RomeFeedParser implements FeedParser {

  private static final Logger LOGGER = LoggerFactory.getLogger(RomeFeedParser.class);

  private static final String USER_AGENT = "podcast-transcriber/1.0";

  private final HttpClient httpClient;
  private final Duration requestTimeout;

  public RomeFeedParser(Duration connectTimeout, Duration requestTimeout) {
    this(
        HttpClient.newBuilder()
            .connectTimeout(connectTimeout)
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build(),
        requestTimeout);
  }

  RomeFeedParser(HttpClient httpClient, Duration requestTimeout) {
    this.httpClient = httpClient;
    this.requestTimeout = requestTimeout;
  }

  @Override
  public ParsedFeed parse(String feedUrl) {
    LOGGER.info("Fetching feed: {}", feedUrl);

    HttpRequest request;
    try {
      request =
          HttpRequest.newBuilder()
              .uri(URI.create(feedUrl))
              .timeout(requestTimeout)
              .header("User-Agent", USER_AGENT)
              .header("Accept", "application/rss+xml, application/xml, text/xml, */*")
              .GET()
              .build();
    } catch (IllegalArgumentException e) {
      throw new FeedException(FeedException.Kind.FETCH, "Invalid feed URL: " + feedUrl, e);
    }

    try {
      HttpResponse<InputStream> response =
          httpClient.send(request, HttpResponse.BodyHandlers.ofInputStream());
      try (InputStream body = response.body()) {
        if (response.statusCode() < 200 || response.statusCode() >= 300) {
          throw new FeedException(
              FeedException.Kind.FETCH,
              String.format("Feed %s returned status %d", feedUrl, response.statusCode()));
        }
        return parse(body);
      }
    } catch (HttpTimeoutException e) {
      throw new FeedException(FeedException.Kind.FETCH, "Timed out fetching feed " + feedUrl, e);
    } catch (IOException e) {
      throw new FeedException(
          FeedException.Kind.FETCH, "Failed to fetch feed " + feedUrl + ": " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new FeedException(FeedException.Kind.FETCH, "Interrupted fetching feed " + feedUrl, e);
    }
  }

  /** Parse an already fetched feed document. */
  ParsedFeed parse(InputStream xml) {
    SyndFeed feed;
    try {
      feed = new SyndFeedInput().build(new XmlReader(xml));
    } catch (com.rometools.rome.io.FeedException | IllegalArgumentException e) {
      throw new FeedException(FeedException.Kind.PARSE, "Malformed feed: " + e.getMessage(), e);
    } catch (IOException e) {
      throw new FeedException(FeedException.Kind.PARSE, "Unreadable feed: " + e.getMessage(), e);
    }

    List<EpisodeItem> episodes = new ArrayList<>();
    for (SyndEntry entry : feed.getEntries()) {
      episodes.add(toEpisodeItem(entry));
    }

    LOGGER.debug("Parsed feed '{}' with {} entries", feed.getTitle(), episodes.size());
    return new ParsedFeed(toMetadata(feed), episodes);
  }

  private PodcastMetadata toMetadata(SyndFeed feed) {
    String author = feed.getAuthor();
    Module feedModule = feed.getModule(ITunes.URI);
    if (isBlank(author) && feedModule instanceof FeedInformation) {
      author = ((FeedInformation) feedModule).getAuthor();
    }
    String imageUrl = feed.getImage() != null ? feed.getImage().getUrl() : null;

    return new PodcastMetadata(
        feed.getTitle(), feed.getDescription(), imageUrl, author, feed.getLanguage(), feed.getLink());
  }

  private EpisodeItem toEpisodeItem(SyndEntry entry) {
    List<EpisodeItem.Enclosure> enclosures = new ArrayList<>();
    for (SyndEnclosure enclosure : entry.getEnclosures()) {
      enclosures.add(new EpisodeItem.Enclosure(enclosure.getUrl(), enclosure.getType()));
    }

    Date date = entry.getPublishedDate() != null ? entry.getPublishedDate() : entry.getUpdatedDate();
    Instant publishedDate = date != null ? date.toInstant() : null;

    Integer durationSeconds = null;
    Module entryModule = entry.getModule(ITunes.URI);
    if (entryModule instanceof EntryInformation) {
      EntryInformation iTunes = (EntryInformation) entryModule;
      if (iTunes.getDuration() != null) {
        durationSeconds = (int) (iTunes.getDuration().getMilliseconds() / 1000L);
      }
    }

    SyndContent description = entry.getDescription();
    return new EpisodeItem(
        entry.getTitle(),
        description != null ? description.getValue() : null,
        entry.getLink(),
        enclosures,
        publishedDate,
        durationSeconds);
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
