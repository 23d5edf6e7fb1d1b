package com.scholary.podcast.service;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Input of the merge stage when chunk transcripts are already in the object store.
 *
 * @param bucket bucket holding the chunk transcripts; the configured bucket when null
 * @param totalChunks expected chunk count, optional
 */
public record MergeRequest(
    @JsonProperty("episode_id") String episodeId,
    @JsonProperty("s3_bucket") String bucket,
    @JsonProperty("total_chunks") Integer totalChunks,
    List<StoredChunk> transcripts) {

  public record StoredChunk(
      @JsonProperty("chunk_index") int chunkIndex,
      @JsonProperty("transcript_s3_key") String transcriptKey,
      @JsonProperty("start_time_seconds") double startTimeSeconds) {}
}
