package com.scholary.videoask.handler.retry;

import java.time.Duration;

/** Blocks the calling thread. Swapped out in tests so that waits are instantaneous. */
@FunctionalInterface
public interface Sleeper {

  void sleep(Duration duration) throws InterruptedException;

  static Sleeper threadSleep() {
    return duration -> Thread.sleep(duration.toMillis());
  }
}
