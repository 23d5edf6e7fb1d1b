package com.scholary.podcast.job;

import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/** Configuration properties for bulk jobs. */
@ConfigurationProperties(prefix = "bulk")
@Validated
public record BulkJobProperties(@PositiveOrZero int cooldownSeconds, @Positive int listLimit) {}
