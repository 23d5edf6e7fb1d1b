package com.scholary.podcast.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.scholary.podcast.episode.EpisodeStatusUpdater;
import com.scholary.podcast.episode.TranscriptStatus;
import com.scholary.podcast.objectstore.ObjectNotFoundException;
import com.scholary.podcast.objectstore.ObjectStoreException;
import com.scholary.podcast.retry.RetryPolicy;
import com.scholary.podcast.transcript.ChunkResultWithTiming;
import com.scholary.podcast.transcript.TranscriptMerger;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TranscriptMergeServiceTest {

  private static final String EPISODE = "ep123";
  private static final String FINAL_KEY = "transcripts/ep123/final.txt";

  @Mock private TranscriptWriter transcriptWriter;
  @Mock private EpisodeStatusUpdater statusUpdater;

  private TranscriptMergeService service;

  @BeforeEach
  void setUp() {
    service =
        new TranscriptMergeService(
            new TranscriptMerger(),
            transcriptWriter,
            statusUpdater,
            new RetryPolicy(3, Duration.ofSeconds(2), 2.0, d -> {}),
            false,
            "default-bucket");
  }

  @Test
  void completeEpisode_shouldUploadThenMarkCompleted() {
    when(transcriptWriter.writeFinalTranscript("bucket", EPISODE, "Hello\n\nworld"))
        .thenReturn(FINAL_KEY);
    when(statusUpdater.markCompleted(EPISODE, FINAL_KEY, 2)).thenReturn(true);

    MergeOutcome outcome =
        service.completeEpisode(
            EPISODE,
            "bucket",
            List.of(
                new ChunkResultWithTiming(1, 600, "world"),
                new ChunkResultWithTiming(0, 0, "  Hello ")),
            2);

    assertThat(outcome).isEqualTo(MergeOutcome.completed(EPISODE, FINAL_KEY, 2));
    verify(statusUpdater).markCompleted(EPISODE, FINAL_KEY, 2);
  }

  @Test
  void completeEpisode_shouldFailWithoutUploadingWhenChunkMissing() {
    MergeOutcome outcome =
        service.completeEpisode(
            EPISODE,
            "bucket",
            List.of(new ChunkResultWithTiming(0, 0, "a"), new ChunkResultWithTiming(2, 600, "c")),
            3);

    assertThat(outcome.status()).isEqualTo(TranscriptStatus.FAILED);
    assertThat(outcome.errorMessage()).isEqualTo("Missing chunk at index: 1");
    verify(statusUpdater).markFailed(EPISODE, "Missing chunk at index: 1");
    verifyNoInteractions(transcriptWriter);
  }

  @Test
  void completeEpisode_shouldFailEpisodeWhenUploadKeepsFailing() {
    when(transcriptWriter.writeFinalTranscript(eq("bucket"), eq(EPISODE), anyString()))
        .thenThrow(new ObjectStoreException("connection reset"));

    MergeOutcome outcome =
        service.completeEpisode(
            EPISODE, "bucket", List.of(new ChunkResultWithTiming(0, 0, "text")), 1);

    assertThat(outcome.isCompleted()).isFalse();
    assertThat(outcome.errorMessage()).isEqualTo("Failed to upload transcript: connection reset");
    verify(transcriptWriter, times(3)).writeFinalTranscript(eq("bucket"), eq(EPISODE), anyString());
    verify(statusUpdater).markFailed(EPISODE, "Failed to upload transcript: connection reset");
    verify(statusUpdater, never()).markCompleted(anyString(), anyString(), eq(1));
  }

  @Test
  void completeEpisode_shouldStayCompletedWhenStatusUpdateFails() {
    when(transcriptWriter.writeFinalTranscript("bucket", EPISODE, "text")).thenReturn(FINAL_KEY);
    when(statusUpdater.markCompleted(EPISODE, FINAL_KEY, 1)).thenReturn(false);

    MergeOutcome outcome =
        service.completeEpisode(
            EPISODE, "bucket", List.of(new ChunkResultWithTiming(0, 0, "text")), 1);

    assertThat(outcome.isCompleted()).isTrue();
    verify(statusUpdater, never()).markFailed(anyString(), anyString());
  }

  @Test
  void mergeStoredChunks_shouldRejectRequestWithoutTranscripts() {
    assertThatThrownBy(() -> service.mergeStoredChunks(new MergeRequest(EPISODE, null, 0, List.of())))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("No transcripts provided");
    assertThatThrownBy(() -> service.mergeStoredChunks(new MergeRequest(" ", null, 0, List.of())))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("episode_id is required");
    verifyNoInteractions(transcriptWriter, statusUpdater);
  }

  @Test
  void mergeStoredChunks_shouldFetchFromDefaultBucketAndMerge() {
    when(transcriptWriter.readChunkText("default-bucket", "k0")).thenReturn("first");
    when(transcriptWriter.readChunkText("default-bucket", "k1")).thenReturn("second");
    when(transcriptWriter.writeFinalTranscript("default-bucket", EPISODE, "first\n\nsecond"))
        .thenReturn(FINAL_KEY);

    MergeOutcome outcome =
        service.mergeStoredChunks(
            new MergeRequest(
                EPISODE,
                null,
                2,
                List.of(
                    new MergeRequest.StoredChunk(1, "k1", 600),
                    new MergeRequest.StoredChunk(0, "k0", 0))));

    assertThat(outcome).isEqualTo(MergeOutcome.completed(EPISODE, FINAL_KEY, 2));
  }

  @Test
  void mergeStoredChunks_shouldFailEpisodeWhenChunkTranscriptIsGone() {
    when(transcriptWriter.readChunkText("bucket", "k0")).thenReturn("first");
    when(transcriptWriter.readChunkText("bucket", "k1"))
        .thenThrow(new ObjectNotFoundException("Object not found: k1", null));

    MergeOutcome outcome =
        service.mergeStoredChunks(
            new MergeRequest(
                EPISODE,
                "bucket",
                2,
                List.of(
                    new MergeRequest.StoredChunk(0, "k0", 0),
                    new MergeRequest.StoredChunk(1, "k1", 600))));

    assertThat(outcome.errorMessage())
        .isEqualTo("Failed to fetch transcript for chunk 1: Object not found: k1");
    verify(transcriptWriter, times(1)).readChunkText("bucket", "k1");
    verify(transcriptWriter, never()).writeFinalTranscript(anyString(), anyString(), anyString());
  }
}
