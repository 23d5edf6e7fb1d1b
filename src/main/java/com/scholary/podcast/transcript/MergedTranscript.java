package com.scholary.podcast.transcript;

/** Result of merging chunk transcripts. */
public record MergedTranscript(String text, int wordCount) {}
