package com.scholary.podcast.workflow;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the transcription workflow.
 *
 * <p>{@code mode} is {@code local} (pipeline runs in this process) or {@code step-functions}
 * (executions are started on {@code stateMachineArn}).
 */
@ConfigurationProperties(prefix = "workflow")
@Validated
public record WorkflowProperties(
    @NotBlank String mode,
    String stateMachineArn,
    String region,
    String chunkerBaseUrl,
    @Positive int chunkerTimeoutSeconds,
    @Positive int executorThreads,
    @Positive int executorQueueSize) {}
