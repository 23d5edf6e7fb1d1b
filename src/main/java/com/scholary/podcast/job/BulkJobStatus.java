package com.scholary.podcast.job;

/**
 * Lifecycle of a bulk job: PENDING, then RUNNING, then one of the terminal states.
 *
 * <p>PAUSED is kept for compatibility with stored documents; nothing transitions into it.
 */
public enum BulkJobStatus {
  PENDING,
  RUNNING,
  PAUSED,
  COMPLETED,
  FAILED,
  CANCELLED;

  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED || this == CANCELLED;
  }
}
