package com.scholary.podcast.whisper;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the Whisper ASR client.
 *
 * <p>All timeouts are in seconds. {@code readTimeout} bounds a single chunk request; whole-episode
 * requests get {@code episodeBaseTimeout + episodeTimeoutFactor * duration}, capped at {@code
 * maxEpisodeTimeout}.
 */
@ConfigurationProperties(prefix = "whisper")
@Validated
public record WhisperProperties(
    @NotBlank String baseUrl,
    @Positive int connectTimeout,
    @Positive int readTimeout,
    @Positive int healthTimeout,
    @Positive int episodeBaseTimeout,
    @Positive double episodeTimeoutFactor,
    @Positive int maxEpisodeTimeout,
    @NotBlank String language,
    @NotBlank String outputFormat) {}
