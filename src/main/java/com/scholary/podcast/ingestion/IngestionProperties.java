package com.scholary.podcast.ingestion;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for feed ingestion. Timeouts are in seconds.
 */
@ConfigurationProperties(prefix = "ingestion")
@Validated
public record IngestionProperties(
    @Positive int maxConcurrency,
    @Positive int maxItemsPerFeed,
    @Positive int feedConnectTimeout,
    @Positive int feedRequestTimeout,
    @Valid ScheduleProperties schedule) {

  public record ScheduleProperties(boolean enabled, @Positive long fixedDelayMinutes) {}
}
