package com.scholary.podcast.transcript;

/** A chunk index in {@code [0, n-1]} has no transcript. Nothing was merged. */
public class MissingChunkException extends RuntimeException {

  private final int missingIndex;

  public MissingChunkException(int missingIndex) {
    super(String.format("Missing chunk at index: %d", missingIndex));
    this.missingIndex = missingIndex;
  }

  public int getMissingIndex() {
    return missingIndex;
  }
}
