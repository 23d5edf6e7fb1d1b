package com.scholary.podcast.job;

import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import org.springframework.stereotype.Component;

/**
 * The set of jobs currently being processed.
 *
 * <p>A job that is no longer in the set has been cancelled. Every read and write holds the same
 * lock.
 */
@Component
public class LiveJobRegistry {

  private final ReentrantLock lock = new ReentrantLock();
  private final Set<String> liveJobs = new HashSet<>();

  public CancellationToken register(String jobId) {
    lock.lock();
    try {
      liveJobs.add(jobId);
    } finally {
      lock.unlock();
    }
    return new CancellationToken() {
      @Override
      public String jobId() {
        return jobId;
      }

      @Override
      public boolean isCancellationRequested() {
        return !isLive(jobId);
      }
    };
  }

  /** @return true if the job was live, i.e. the cancellation took effect */
  public boolean cancel(String jobId) {
    lock.lock();
    try {
      return liveJobs.remove(jobId);
    } finally {
      lock.unlock();
    }
  }

  public void unregister(String jobId) {
    lock.lock();
    try {
      liveJobs.remove(jobId);
    } finally {
      lock.unlock();
    }
  }

  public boolean isLive(String jobId) {
    lock.lock();
    try {
      return liveJobs.contains(jobId);
    } finally {
      lock.unlock();
    }
  }
}
