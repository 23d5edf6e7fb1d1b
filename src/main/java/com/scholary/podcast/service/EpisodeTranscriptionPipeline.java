package com.scholary.podcast.service;

import com.scholary.podcast.cache.ChunkCache;
import com.scholary.podcast.episode.EpisodeStatusUpdater;
import com.scholary.podcast.logging.StructuredLogger;
import com.scholary.podcast.transcript.ChunkReference;
import com.scholary.podcast.transcript.TranscriptChunkResult;
import com.scholary.podcast.workflow.AudioChunker;
import com.scholary.podcast.workflow.ChunkingException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Split, transcribe and merge one episode in-process.
 *
 * <p>Stands in for the external workflow engine when running locally. Every failure ends with the
 * episode marked FAILED and is reported through the returned outcome.
 */
public class EpisodeTranscriptionPipeline {

  private static final Logger LOGGER = LoggerFactory.getLogger(EpisodeTranscriptionPipeline.class);

  private final AudioChunker audioChunker;
  private final ChunkTranscriptionCoordinator coordinator;
  private final TranscriptMergeService mergeService;
  private final EpisodeStatusUpdater statusUpdater;
  private final ChunkCache chunkCache;

  public EpisodeTranscriptionPipeline(
      AudioChunker audioChunker,
      ChunkTranscriptionCoordinator coordinator,
      TranscriptMergeService mergeService,
      EpisodeStatusUpdater statusUpdater,
      ChunkCache chunkCache) {
    this.audioChunker = audioChunker;
    this.coordinator = coordinator;
    this.mergeService = mergeService;
    this.statusUpdater = statusUpdater;
    this.chunkCache = chunkCache;
  }

  public MergeOutcome run(String episodeId, String audioUrl, String bucket) {
    StructuredLogger.setEpisodeContext(episodeId);
    try {
      LOGGER.info("Starting transcription workflow for episode {}", episodeId);
      statusUpdater.markProcessing(episodeId);

      List<ChunkReference> chunks = audioChunker.split(episodeId, audioUrl, bucket);
      List<TranscriptChunkResult> results =
          coordinator.transcribeChunks(episodeId, bucket, chunks);

      MergeOutcome outcome =
          mergeService.completeEpisode(
              episodeId,
              bucket,
              results.stream().map(TranscriptChunkResult::withTiming).toList(),
              chunks.size());
      if (outcome.isCompleted()) {
        chunkCache.evictEpisode(episodeId);
      }
      return outcome;

    } catch (ChunkingException | ChunkTranscriptionException e) {
      LOGGER.error("Transcription failed for episode {}: {}", episodeId, e.getMessage());
      statusUpdater.markFailed(episodeId, e.getMessage());
      return MergeOutcome.failed(episodeId, e.getMessage());
    } catch (RuntimeException e) {
      LOGGER.error("Unexpected error transcribing episode {}", episodeId, e);
      String message = "Unexpected error: " + e.getMessage();
      statusUpdater.markFailed(episodeId, message);
      return MergeOutcome.failed(episodeId, message);
    } finally {
      StructuredLogger.clearEpisodeContext();
    }
  }
}
