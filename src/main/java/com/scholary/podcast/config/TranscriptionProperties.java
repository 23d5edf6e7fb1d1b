package com.scholary.podcast.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for transcription processing.
 *
 * <p>Controls chunk parallelism, the retry policy around remote calls, merging and the chunk
 * cache.
 */
@ConfigurationProperties(prefix = "transcription")
@Validated
public record TranscriptionProperties(
    @Positive int chunkConcurrency,
    @Valid RetryProperties retry,
    @Valid MergeProperties merge,
    @Valid CacheProperties cache) {

  public record RetryProperties(
      @Positive int maxAttempts, @Positive int initialBackoffSeconds, @Positive double multiplier) {}

  public record MergeProperties(@Positive int timestampIntervalSeconds, boolean addTimestamps) {}

  public record CacheProperties(@Positive int maxSize, @Positive int ttlHours) {}
}
