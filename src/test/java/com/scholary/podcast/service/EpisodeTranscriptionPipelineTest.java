package com.scholary.podcast.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.scholary.podcast.cache.ChunkCache;
import com.scholary.podcast.episode.EpisodeStatusUpdater;
import com.scholary.podcast.transcript.ChunkReference;
import com.scholary.podcast.transcript.ChunkResultWithTiming;
import com.scholary.podcast.transcript.TranscriptChunkResult;
import com.scholary.podcast.whisper.WhisperException;
import com.scholary.podcast.workflow.AudioChunker;
import com.scholary.podcast.workflow.ChunkingException;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class EpisodeTranscriptionPipelineTest {

  private static final String EPISODE = "ep123";
  private static final String AUDIO = "https://cdn/ep.mp3";

  @Mock private AudioChunker audioChunker;
  @Mock private ChunkTranscriptionCoordinator coordinator;
  @Mock private TranscriptMergeService mergeService;
  @Mock private EpisodeStatusUpdater statusUpdater;
  @Mock private ChunkCache chunkCache;

  private EpisodeTranscriptionPipeline pipeline;

  @BeforeEach
  void setUp() {
    pipeline =
        new EpisodeTranscriptionPipeline(
            audioChunker, coordinator, mergeService, statusUpdater, chunkCache);
  }

  @Test
  void run_shouldChunkTranscribeAndMerge() {
    List<ChunkReference> chunks =
        List.of(new ChunkReference(0, "c0.mp3", 0), new ChunkReference(1, "c1.mp3", 600));
    when(audioChunker.split(EPISODE, AUDIO, "bucket")).thenReturn(chunks);
    when(coordinator.transcribeChunks(EPISODE, "bucket", chunks))
        .thenReturn(
            List.of(
                new TranscriptChunkResult(0, 0, "a", "k0"),
                new TranscriptChunkResult(1, 600, "b", "k1")));
    MergeOutcome completed = MergeOutcome.completed(EPISODE, "final", 2);
    when(mergeService.completeEpisode(
            EPISODE,
            "bucket",
            List.of(new ChunkResultWithTiming(0, 0, "a"), new ChunkResultWithTiming(1, 600, "b")),
            2))
        .thenReturn(completed);

    MergeOutcome outcome = pipeline.run(EPISODE, AUDIO, "bucket");

    assertThat(outcome).isEqualTo(completed);
    verify(statusUpdater).markProcessing(EPISODE);
    verify(chunkCache).evictEpisode(EPISODE);
  }

  @Test
  void run_shouldMarkFailedWhenChunkingFails() {
    when(audioChunker.split(EPISODE, AUDIO, "bucket"))
        .thenThrow(new ChunkingException("No chunks returned from chunking service"));

    MergeOutcome outcome = pipeline.run(EPISODE, AUDIO, "bucket");

    assertThat(outcome.isCompleted()).isFalse();
    verify(statusUpdater).markFailed(EPISODE, "No chunks returned from chunking service");
    verify(mergeService, never()).completeEpisode(any(), any(), anyList(), any());
  }

  @Test
  void run_shouldMarkFailedWhenAChunkFails() {
    List<ChunkReference> chunks = List.of(new ChunkReference(0, "c0.mp3", 0));
    when(audioChunker.split(EPISODE, AUDIO, "bucket")).thenReturn(chunks);
    when(coordinator.transcribeChunks(EPISODE, "bucket", chunks))
        .thenThrow(
            new ChunkTranscriptionException(
                0, new WhisperException(WhisperException.Kind.CLIENT_ERROR, "bad audio")));

    MergeOutcome outcome = pipeline.run(EPISODE, AUDIO, "bucket");

    assertThat(outcome.errorMessage()).isEqualTo("Transcription failed for chunk 0: bad audio");
    verify(statusUpdater).markFailed(eq(EPISODE), eq("Transcription failed for chunk 0: bad audio"));
    verify(chunkCache, never()).evictEpisode(any());
  }
}
