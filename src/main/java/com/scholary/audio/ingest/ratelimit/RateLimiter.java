package com.scholary.audio.ingest.ratelimit;

import java.time.Instant;

/**
 * Gate in front of a quota-limited external service.
 *
 * <p>One instance is shared by every caller of the service in the process; a per-caller instance
 * would let concurrent callers exceed the global quota together.
 */
public interface RateLimiter {

  /**
   * Block until a call is permitted, then record it.
   *
   * @throws InterruptedException if interrupted while waiting
   */
  void acquire() throws InterruptedException;

  /**
   * Block until a call is permitted, unless that would pass the deadline.
   *
   * @param deadline latest moment the call may be permitted
   * @return true if the call was permitted and recorded, false if the wait would pass the deadline
   *     (nothing is recorded)
   * @throws InterruptedException if interrupted while waiting
   */
  boolean acquire(Instant deadline) throws InterruptedException;
}
