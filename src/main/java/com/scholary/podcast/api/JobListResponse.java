package com.scholary.podcast.api;

import com.scholary.podcast.job.BulkJob;
import java.util.List;

/** Most recent bulk jobs first. */
public record JobListResponse(List<BulkJob> jobs, int total) {}
