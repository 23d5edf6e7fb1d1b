package com.scholary.podcast.config;

import com.scholary.podcast.retry.RetryPolicy;
import com.scholary.podcast.transcript.TranscriptMerger;
import java.time.Duration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Transcription-related beans built from the transcription.* properties. */
@Configuration
@EnableConfigurationProperties(TranscriptionProperties.class)
public class TranscriptionConfig {

  @Bean
  public RetryPolicy retryPolicy(TranscriptionProperties properties) {
    TranscriptionProperties.RetryProperties retry = properties.retry();
    return new RetryPolicy(
        retry.maxAttempts(),
        Duration.ofSeconds(retry.initialBackoffSeconds()),
        retry.multiplier());
  }

  @Bean
  public TranscriptMerger transcriptMerger(TranscriptionProperties properties) {
    return new TranscriptMerger(properties.merge().timestampIntervalSeconds());
  }
}
