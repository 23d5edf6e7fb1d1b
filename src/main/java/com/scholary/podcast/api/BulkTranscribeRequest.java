package com.scholary.podcast.api;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

/**
 * Request for a bulk transcription run over a whole feed.
 *
 * <p>Episodes are processed oldest first; {@code maxEpisodes} keeps only the earliest ones.
 */
public record BulkTranscribeRequest(@NotBlank String rssUrl, @Min(1) Integer maxEpisodes) {}
