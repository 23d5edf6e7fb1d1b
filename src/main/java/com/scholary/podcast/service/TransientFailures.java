package com.scholary.podcast.service;

import com.scholary.podcast.objectstore.ObjectStoreException;
import com.scholary.podcast.whisper.WhisperException;

/** Classifies failures of the pipeline's remote calls for the retry policy. */
final class TransientFailures {

  private TransientFailures() {}

  static boolean isTransient(Throwable failure) {
    if (failure instanceof WhisperException) {
      return ((WhisperException) failure).isTransient();
    }
    if (failure instanceof ObjectStoreException) {
      return ((ObjectStoreException) failure).isTransient();
    }
    return false;
  }
}
