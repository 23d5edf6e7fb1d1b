package com.scholary.podcast.service;

/** A chunk could not be transcribed; the whole episode's transcription fails with it. */
public class ChunkTranscriptionException extends RuntimeException {

  private final int chunkIndex;

  public ChunkTranscriptionException(int chunkIndex, Throwable cause) {
    super(
        String.format("Transcription failed for chunk %d: %s", chunkIndex, cause.getMessage()),
        cause);
    this.chunkIndex = chunkIndex;
  }

  public int getChunkIndex() {
    return chunkIndex;
  }
}
