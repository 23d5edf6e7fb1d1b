package com.scholary.podcast.job;

import java.util.List;
import java.util.Optional;

/** Persistence for bulk jobs. */
public interface BulkJobRepository {

  /** Insert or replace the whole job document, refreshing its updated timestamp. */
  void save(BulkJob job);

  Optional<BulkJob> findByJobId(String jobId);

  /** Most recently created first. */
  List<BulkJob> findRecent(int limit);
}
