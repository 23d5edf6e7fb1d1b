package com.scholary.podcast.transcript;

/**
 * One slice of an episode's audio as produced by the chunker.
 *
 * @param chunkIndex 0-based, contiguous per episode
 * @param storageKey object key of the chunk audio
 * @param startTimeSeconds offset of the chunk within the episode
 */
public record ChunkReference(int chunkIndex, String storageKey, double startTimeSeconds) {}
