package com.scholary.podcast.workflow;

import com.scholary.podcast.transcript.ChunkReference;
import java.util.List;

/** Splits an episode's audio into chunks stored in the object store. */
public interface AudioChunker {

  /**
   * @return chunk references ordered by index, never empty
   * @throws ChunkingException if the audio could not be chunked
   */
  List<ChunkReference> split(String episodeId, String audioUrl, String bucket);
}
