package com.scholary.podcast.retry;

import java.time.Duration;

/** Blocking pause, swappable in tests. */
@FunctionalInterface
public interface Sleeper {

  Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

  void sleep(Duration duration) throws InterruptedException;
}
