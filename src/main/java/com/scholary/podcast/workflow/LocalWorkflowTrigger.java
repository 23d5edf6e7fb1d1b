package com.scholary.podcast.workflow;

import com.scholary.podcast.service.EpisodeTranscriptionPipeline;
import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Runs the transcription pipeline on a bounded in-process executor. */
public class LocalWorkflowTrigger implements WorkflowTrigger {

  private static final Logger LOGGER = LoggerFactory.getLogger(LocalWorkflowTrigger.class);

  private final EpisodeTranscriptionPipeline pipeline;
  private final Executor executor;

  public LocalWorkflowTrigger(EpisodeTranscriptionPipeline pipeline, Executor executor) {
    this.pipeline = pipeline;
    this.executor = executor;
  }

  @Override
  public WorkflowHandle start(String episodeId, String audioUrl, String bucket) {
    String runId = "local-" + UUID.randomUUID();
    try {
      executor.execute(() -> pipeline.run(episodeId, audioUrl, bucket));
    } catch (RejectedExecutionException e) {
      throw new WorkflowTriggerException(
          "Workflow queue is full, episode " + episodeId + " was not started", e);
    }
    LOGGER.info("Queued local workflow run {} for episode {}", runId, episodeId);
    return new WorkflowHandle(runId, Instant.now());
  }
}
