package com.scholary.podcast.transcript;

/**
 * Transcript of one chunk.
 *
 * @param transcriptKey object key of the stored chunk transcript JSON
 */
public record TranscriptChunkResult(
    int chunkIndex, double startTimeSeconds, String text, String transcriptKey) {

  public ChunkResultWithTiming withTiming() {
    return new ChunkResultWithTiming(chunkIndex, startTimeSeconds, text);
  }
}
