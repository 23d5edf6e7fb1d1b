package com.scholary.podcast.workflow;

import java.time.Instant;

/** @param executionId execution ARN or local run id */
public record WorkflowHandle(String executionId, Instant startedAt) {}
