package com.scholary.podcast.service;

import com.scholary.podcast.cache.ChunkCache;
import com.scholary.podcast.logging.StructuredLogger;
import com.scholary.podcast.objectstore.ObjectStoreClient;
import com.scholary.podcast.retry.RetryPolicy;
import com.scholary.podcast.transcript.ChunkReference;
import com.scholary.podcast.transcript.TranscriptChunkResult;
import com.scholary.podcast.whisper.WhisperException;
import com.scholary.podcast.whisper.WhisperProperties;
import com.scholary.podcast.whisper.WhisperService;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Drives the ASR backend over an episode's chunks, or over a whole episode in bulk mode.
 *
 * <p>Chunks are transcribed in parallel, at most {@code chunkConcurrency} at a time. Each remote
 * call runs under the retry policy. A chunk that still fails fails the whole invocation: the
 * remaining chunks are cancelled and no partial result is returned.
 */
@Service
public class ChunkTranscriptionCoordinator {

  private static final Logger LOGGER = LoggerFactory.getLogger(ChunkTranscriptionCoordinator.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final ObjectStoreClient objectStoreClient;
  private final WhisperService whisperService;
  private final ChunkCache chunkCache;
  private final TranscriptWriter transcriptWriter;
  private final RetryPolicy retryPolicy;
  private final WhisperProperties whisperProperties;
  private final int chunkConcurrency;

  public ChunkTranscriptionCoordinator(
      ObjectStoreClient objectStoreClient,
      WhisperService whisperService,
      ChunkCache chunkCache,
      TranscriptWriter transcriptWriter,
      RetryPolicy retryPolicy,
      WhisperProperties whisperProperties,
      @Value("${transcription.chunkConcurrency}") int chunkConcurrency) {
    this.objectStoreClient = objectStoreClient;
    this.whisperService = whisperService;
    this.chunkCache = chunkCache;
    this.transcriptWriter = transcriptWriter;
    this.retryPolicy = retryPolicy;
    this.whisperProperties = whisperProperties;
    this.chunkConcurrency = chunkConcurrency;
  }

  /**
   * Transcribe every chunk of an episode.
   *
   * @return one result per chunk, ordered by chunk index
   * @throws ChunkTranscriptionException naming the first chunk that failed
   */
  public List<TranscriptChunkResult> transcribeChunks(
      String episodeId, String bucket, List<ChunkReference> chunks) {
    if (chunks.isEmpty()) {
      return List.of();
    }

    int threads = Math.min(chunkConcurrency, chunks.size());
    LOGGER.info(
        "Transcribing {} chunks for episode {} with {} workers", chunks.size(), episodeId, threads);

    String threadPrefix = "chunk-" + episodeId.substring(0, Math.min(8, episodeId.length())) + "-";
    AtomicInteger threadCounter = new AtomicInteger();
    ExecutorService executor =
        Executors.newFixedThreadPool(
            threads,
            runnable -> {
              Thread thread = new Thread(runnable, threadPrefix + threadCounter.incrementAndGet());
              thread.setDaemon(true);
              return thread;
            });
    CompletionService<TranscriptChunkResult> completionService =
        new ExecutorCompletionService<>(executor);
    List<Future<TranscriptChunkResult>> futures = new ArrayList<>();

    try {
      for (ChunkReference chunk : chunks) {
        futures.add(completionService.submit(() -> transcribeChunk(episodeId, bucket, chunk)));
      }

      List<TranscriptChunkResult> results = new ArrayList<>(chunks.size());
      for (int i = 0; i < chunks.size(); i++) {
        Future<TranscriptChunkResult> done = completionService.take();
        try {
          results.add(done.get());
        } catch (ExecutionException e) {
          futures.forEach(f -> f.cancel(true));
          Throwable cause = e.getCause();
          if (cause instanceof ChunkTranscriptionException) {
            throw (ChunkTranscriptionException) cause;
          }
          throw new IllegalStateException("Chunk worker failed unexpectedly", cause);
        }
      }

      results.sort(Comparator.comparingInt(TranscriptChunkResult::chunkIndex));
      LOGGER.info("Transcribed all {} chunks for episode {}", results.size(), episodeId);
      return results;

    } catch (InterruptedException e) {
      futures.forEach(f -> f.cancel(true));
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted while transcribing episode " + episodeId, e);
    } finally {
      executor.shutdownNow();
    }
  }

  /**
   * Transcribe a whole episode in one ASR call.
   *
   * @param durationSeconds episode length if known; sizes the request timeout
   * @return the transcript text
   * @throws WhisperException if transcription still fails after retries
   */
  public String transcribeEpisode(String audioUrl, Integer durationSeconds) {
    Duration timeout = episodeTimeout(durationSeconds);
    LOGGER.info(
        "Transcribing episode audio: url={}, duration={}s, timeout={}s",
        audioUrl,
        durationSeconds,
        timeout.toSeconds());

    return retryPolicy.execute(
        "transcribe episode",
        () -> whisperService.transcribeUrl(audioUrl, timeout),
        TransientFailures::isTransient);
  }

  /** {@code min(max, base + factor * duration)}; the cap when the duration is unknown. */
  Duration episodeTimeout(Integer durationSeconds) {
    long max = whisperProperties.maxEpisodeTimeout();
    if (durationSeconds == null || durationSeconds <= 0) {
      return Duration.ofSeconds(max);
    }
    long scaled =
        whisperProperties.episodeBaseTimeout()
            + (long) Math.ceil(whisperProperties.episodeTimeoutFactor() * durationSeconds);
    return Duration.ofSeconds(Math.min(max, scaled));
  }

  private TranscriptChunkResult transcribeChunk(
      String episodeId, String bucket, ChunkReference chunk) {
    StructuredLogger.setEpisodeContext(episodeId);
    int index = chunk.chunkIndex();
    try {
      String cacheKey = ChunkCache.generateKey(episodeId, index);
      Optional<TranscriptChunkResult> cached = chunkCache.get(cacheKey);
      if (cached.isPresent()) {
        structuredLogger.logChunkFinished(index, chunk.startTimeSeconds(), 0L, true);
        return cached.get();
      }

      structuredLogger.logChunkStarted(index, chunk.startTimeSeconds(), chunk.storageKey());
      long startTime = System.currentTimeMillis();

      byte[] audio =
          retryPolicy.execute(
              "fetch chunk " + index,
              () -> objectStoreClient.getObjectBytes(bucket, chunk.storageKey()),
              TransientFailures::isTransient);

      Duration timeout = Duration.ofSeconds(whisperProperties.readTimeout());
      String text =
          retryPolicy.execute(
              "transcribe chunk " + index,
              () -> whisperService.transcribe(filename(chunk), audio, timeout),
              TransientFailures::isTransient);

      String transcriptKey =
          retryPolicy.execute(
              "store chunk transcript " + index,
              () ->
                  transcriptWriter.writeChunkTranscript(
                      bucket, episodeId, index, chunk.startTimeSeconds(), text),
              TransientFailures::isTransient);

      TranscriptChunkResult result =
          new TranscriptChunkResult(index, chunk.startTimeSeconds(), text, transcriptKey);
      chunkCache.put(cacheKey, result);

      structuredLogger.logChunkFinished(
          index, chunk.startTimeSeconds(), System.currentTimeMillis() - startTime, false);
      return result;

    } catch (RuntimeException e) {
      String errorType =
          e instanceof WhisperException
              ? ((WhisperException) e).getKind().name()
              : e.getClass().getSimpleName();
      structuredLogger.logTranscribeFailed(
          index, retryPolicy.maxAttempts(), errorType, e.getMessage());
      throw new ChunkTranscriptionException(index, e);
    } finally {
      StructuredLogger.clearEpisodeContext();
    }
  }

  private static String filename(ChunkReference chunk) {
    String key = chunk.storageKey();
    int slash = key.lastIndexOf('/');
    return slash >= 0 ? key.substring(slash + 1) : key;
  }
}
