package com.scholary.podcast.api;

/** Optional body of a manual poll; a null podcastId polls every active podcast. */
public record PollRequest(String podcastId) {}
