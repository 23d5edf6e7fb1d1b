package com.scholary.podcast.api;

/** Reachability of the ASR backend. */
public record HealthResponse(String status, boolean whisperHealthy) {}
