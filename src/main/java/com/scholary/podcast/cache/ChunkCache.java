package com.scholary.podcast.cache;

import com.scholary.podcast.transcript.TranscriptChunkResult;
import java.util.Optional;

/**
 * Cache of chunk transcripts.
 *
 * <p>Lets a re-run of an episode (a workflow retry, a repeated local run) skip chunks that were
 * already transcribed. Keys are episode id + chunk index.
 */
public interface ChunkCache {

  void put(String cacheKey, TranscriptChunkResult result);

  Optional<TranscriptChunkResult> get(String cacheKey);

  /** Drop every cached chunk of one episode. */
  void evictEpisode(String episodeId);

  static String generateKey(String episodeId, int chunkIndex) {
    return String.format("%s:chunk-%d", episodeId, chunkIndex);
  }
}
