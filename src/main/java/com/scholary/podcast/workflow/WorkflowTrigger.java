package com.scholary.podcast.workflow;

/** Hands a newly discovered episode to the transcription workflow. */
public interface WorkflowTrigger {

  /**
   * Start transcribing an episode. Returns once the workflow has accepted the work.
   *
   * @throws WorkflowTriggerException if the workflow could not be started
   */
  WorkflowHandle start(String episodeId, String audioUrl, String bucket);
}
