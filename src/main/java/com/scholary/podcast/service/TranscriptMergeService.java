package com.scholary.podcast.service;

import com.scholary.podcast.episode.EpisodeStatusUpdater;
import com.scholary.podcast.logging.StructuredLogger;
import com.scholary.podcast.retry.RetryPolicy;
import com.scholary.podcast.transcript.ChunkResultWithTiming;
import com.scholary.podcast.transcript.MergedTranscript;
import com.scholary.podcast.transcript.MissingChunkException;
import com.scholary.podcast.transcript.TranscriptMerger;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * The merge stage: merges chunk transcripts, stores the result and records the episode outcome.
 *
 * <p>Nothing is uploaded when the merge itself fails. Once the transcript is uploaded the episode
 * counts as completed even if the status write afterwards fails.
 */
@Service
public class TranscriptMergeService {

  private static final Logger LOGGER = LoggerFactory.getLogger(TranscriptMergeService.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final TranscriptMerger merger;
  private final TranscriptWriter transcriptWriter;
  private final EpisodeStatusUpdater statusUpdater;
  private final RetryPolicy retryPolicy;
  private final boolean addTimestamps;
  private final String defaultBucket;

  public TranscriptMergeService(
      TranscriptMerger merger,
      TranscriptWriter transcriptWriter,
      EpisodeStatusUpdater statusUpdater,
      RetryPolicy retryPolicy,
      @Value("${transcription.merge.addTimestamps:true}") boolean addTimestamps,
      @Value("${objectstore.bucket}") String defaultBucket) {
    this.merger = merger;
    this.transcriptWriter = transcriptWriter;
    this.statusUpdater = statusUpdater;
    this.retryPolicy = retryPolicy;
    this.addTimestamps = addTimestamps;
    this.defaultBucket = defaultBucket;
  }

  /** Merge transcripts held in memory and record the result. */
  public MergeOutcome completeEpisode(
      String episodeId, String bucket, List<ChunkResultWithTiming> chunks, Integer expectedTotal) {
    MergedTranscript merged;
    try {
      merged = merger.merge(chunks, addTimestamps, expectedTotal);
    } catch (MissingChunkException | IllegalArgumentException e) {
      return fail(episodeId, e.getMessage());
    }

    String transcriptKey;
    try {
      transcriptKey =
          retryPolicy.execute(
              "upload transcript",
              () -> transcriptWriter.writeFinalTranscript(bucket, episodeId, merged.text()),
              TransientFailures::isTransient);
    } catch (RuntimeException e) {
      return fail(episodeId, "Failed to upload transcript: " + e.getMessage());
    }

    statusUpdater.markCompleted(episodeId, transcriptKey, merged.wordCount());
    structuredLogger.logMergeCompleted(episodeId, chunks.size(), merged.wordCount(), transcriptKey);
    return MergeOutcome.completed(episodeId, transcriptKey, merged.wordCount());
  }

  /**
   * Fetch stored chunk transcripts, then merge them.
   *
   * @throws IllegalArgumentException if the request has no episode id or no transcripts; nothing
   *     is written in that case
   */
  public MergeOutcome mergeStoredChunks(MergeRequest request) {
    if (request.episodeId() == null || request.episodeId().isBlank()) {
      throw new IllegalArgumentException("episode_id is required");
    }
    if (request.transcripts() == null || request.transcripts().isEmpty()) {
      throw new IllegalArgumentException("No transcripts provided");
    }

    String episodeId = request.episodeId();
    String bucket = request.bucket() != null ? request.bucket() : defaultBucket;
    LOGGER.info(
        "Merging {} stored transcripts for episode {}", request.transcripts().size(), episodeId);

    List<ChunkResultWithTiming> chunks = new ArrayList<>();
    for (MergeRequest.StoredChunk stored : request.transcripts()) {
      try {
        String text =
            retryPolicy.execute(
                "fetch chunk transcript " + stored.chunkIndex(),
                () -> transcriptWriter.readChunkText(bucket, stored.transcriptKey()),
                TransientFailures::isTransient);
        chunks.add(new ChunkResultWithTiming(stored.chunkIndex(), stored.startTimeSeconds(), text));
      } catch (RuntimeException e) {
        return fail(
            episodeId,
            String.format(
                "Failed to fetch transcript for chunk %d: %s", stored.chunkIndex(), e.getMessage()));
      }
    }

    return completeEpisode(episodeId, bucket, chunks, request.totalChunks());
  }

  private MergeOutcome fail(String episodeId, String message) {
    LOGGER.error("Merge failed for episode {}: {}", episodeId, message);
    statusUpdater.markFailed(episodeId, message);
    return MergeOutcome.failed(episodeId, message);
  }
}
