package com.scholary.podcast.config;

import com.scholary.podcast.feed.FeedParser;
import com.scholary.podcast.feed.RomeFeedParser;
import com.scholary.podcast.ingestion.IngestionProperties;
import com.scholary.podcast.job.BulkJobProperties;
import java.time.Duration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Feed parsing and the properties of the two feed consumers. */
@Configuration
@EnableConfigurationProperties({IngestionProperties.class, BulkJobProperties.class})
public class IngestionConfig {

  @Bean
  public FeedParser feedParser(IngestionProperties properties) {
    return new RomeFeedParser(
        Duration.ofSeconds(properties.feedConnectTimeout()),
        Duration.ofSeconds(properties.feedRequestTimeout()));
  }
}
