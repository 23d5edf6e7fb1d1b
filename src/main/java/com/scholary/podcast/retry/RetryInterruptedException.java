package com.scholary.podcast.retry;

/** Thrown when the operation was interrupted while waiting between attempts. */
public class RetryInterruptedException extends RuntimeException {

  public RetryInterruptedException(String operation, InterruptedException cause) {
    super("Interrupted while retrying " + operation, cause);
  }
}
