package com.scholary.podcast.api;

/**
 * Result of a cancellation request.
 *
 * <p>{@code cancelled} is false when the job was not running in this instance, e.g. it already
 * finished.
 */
public record CancelJobResponse(String jobId, boolean cancelled, String message) {}
