package com.scholary.podcast.workflow;

public class WorkflowTriggerException extends RuntimeException {

  public WorkflowTriggerException(String message, Throwable cause) {
    super(message, cause);
  }
}
