package com.scholary.audio.ingest.ratelimit;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sliding-window limiter: at most {@code maxRequests} calls in any trailing {@code window}.
 *
 * <p>The timestamps of recent calls live in a deque guarded by a single lock, and a call is only
 * recorded while holding it, so the window can never be overfilled by a race. A caller that finds
 * the window full releases the lock and sleeps until the oldest call leaves the window (plus a
 * small padding against clock skew with the service), then checks again. The lock is never held
 * across a wait, so every caller judges its own deadline against the window as it stands.
 */
public class SlidingWindowRateLimiter implements RateLimiter {

  private static final Logger LOGGER = LoggerFactory.getLogger(SlidingWindowRateLimiter.class);

  private final int maxRequests;
  private final Duration window;
  private final Duration padding;
  private final Clock clock;
  private final Sleeper sleeper;

  private final ReentrantLock lock = new ReentrantLock(true);
  private final Deque<Instant> recentCalls = new ArrayDeque<>();

  public SlidingWindowRateLimiter(
      int maxRequests, Duration window, Duration padding, Clock clock, Sleeper sleeper) {
    if (maxRequests <= 0) {
      throw new IllegalArgumentException("maxRequests must be positive");
    }
    if (window.isNegative() || window.isZero()) {
      throw new IllegalArgumentException("window must be positive");
    }
    if (padding.isNegative()) {
      throw new IllegalArgumentException("padding cannot be negative");
    }
    this.maxRequests = maxRequests;
    this.window = window;
    this.padding = padding;
    this.clock = clock;
    this.sleeper = sleeper;
  }

  @Override
  public void acquire() throws InterruptedException {
    acquire(Instant.MAX);
  }

  @Override
  public boolean acquire(Instant deadline) throws InterruptedException {
    while (true) {
      Duration wait;
      lock.lockInterruptibly();
      try {
        Instant now = clock.instant();
        evictExpired(now);

        if (recentCalls.size() < maxRequests) {
          recentCalls.addLast(now);
          return true;
        }

        Instant permittedAt = recentCalls.peekFirst().plus(window).plus(padding);
        if (permittedAt.isAfter(deadline)) {
          LOGGER.warn("Rate limit wait until {} would pass deadline {}", permittedAt, deadline);
          return false;
        }

        wait = Duration.between(now, permittedAt);
        LOGGER.info(
            "Rate limit reached ({} calls in {}s). Waiting {}ms...",
            recentCalls.size(),
            window.toSeconds(),
            wait.toMillis());
      } finally {
        lock.unlock();
      }

      // Another caller may take the freed slot first; re-check against the deadline after waking
      sleeper.sleep(wait);
    }
  }

  /** Number of calls currently counted against the window. */
  public int recentCallCount() {
    lock.lock();
    try {
      evictExpired(clock.instant());
      return recentCalls.size();
    } finally {
      lock.unlock();
    }
  }

  private void evictExpired(Instant now) {
    Instant windowStart = now.minus(window);
    while (!recentCalls.isEmpty() && !recentCalls.peekFirst().isAfter(windowStart)) {
      recentCalls.removeFirst();
    }
  }
}
