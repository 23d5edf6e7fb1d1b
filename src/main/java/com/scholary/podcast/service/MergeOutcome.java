package com.scholary.podcast.service;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.scholary.podcast.episode.TranscriptStatus;

/** What happened to an episode at the end of the merge stage. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MergeOutcome(
    @JsonProperty("episode_id") String episodeId,
    TranscriptStatus status,
    @JsonProperty("transcript_s3_key") String transcriptKey,
    @JsonProperty("total_words") int totalWords,
    @JsonProperty("error_message") String errorMessage) {

  public static MergeOutcome completed(String episodeId, String transcriptKey, int totalWords) {
    return new MergeOutcome(episodeId, TranscriptStatus.COMPLETED, transcriptKey, totalWords, null);
  }

  public static MergeOutcome failed(String episodeId, String errorMessage) {
    return new MergeOutcome(episodeId, TranscriptStatus.FAILED, null, 0, errorMessage);
  }

  public boolean isCompleted() {
    return status == TranscriptStatus.COMPLETED;
  }
}
