package com.scholary.podcast.transcript;

/** Merge input: a chunk's text and where it starts in the episode. */
public record ChunkResultWithTiming(int chunkIndex, double startTimeSeconds, String text) {}
