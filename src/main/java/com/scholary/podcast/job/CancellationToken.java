package com.scholary.podcast.job;

/**
 * Cancellation flag bound to one job.
 *
 * <p>Only polled between episodes. An ASR call already in flight always runs to completion.
 */
public interface CancellationToken {

  String jobId();

  boolean isCancellationRequested();
}
