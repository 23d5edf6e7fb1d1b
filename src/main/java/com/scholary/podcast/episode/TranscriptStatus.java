package com.scholary.podcast.episode;

/** Transcript lifecycle of an episode, also reused for per-episode progress inside bulk jobs. */
public enum TranscriptStatus {
  PENDING,
  PROCESSING,
  COMPLETED,
  FAILED;

  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED;
  }
}
