package com.scholary.audio.ingest.ratelimit;

import java.time.Duration;

/** Blocks the current thread. Abstracted so rate limiting can be tested without real waits. */
@FunctionalInterface
public interface Sleeper {

  Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

  void sleep(Duration duration) throws InterruptedException;
}
