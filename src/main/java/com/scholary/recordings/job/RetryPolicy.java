package com.scholary.recordings.job;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential backoff with jitter for failed ingestion attempts.
 *
 * <p>Attempt {@code n} waits {@code base * 2^(n-1)} plus up to one {@code base} of random jitter.
 */
public class RetryPolicy {

  private final int maxAttempts;
  private final Duration backoffBase;
  private final DoubleSupplier jitter;

  public RetryPolicy(int maxAttempts, Duration backoffBase) {
    this(maxAttempts, backoffBase, () -> ThreadLocalRandom.current().nextDouble());
  }

  RetryPolicy(int maxAttempts, Duration backoffBase, DoubleSupplier jitter) {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1");
    }
    this.maxAttempts = maxAttempts;
    this.backoffBase = backoffBase;
    this.jitter = jitter;
  }

  public int maxAttempts() {
    return maxAttempts;
  }

  /** Whether another attempt may follow the given (failed) attempt. */
  public boolean canRetry(int attempt) {
    return attempt < maxAttempts;
  }

  /** Delay before the attempt following {@code attempt}. */
  public Duration backoff(int attempt) {
    long baseMs = backoffBase.toMillis();
    int exponent = Math.max(0, Math.min(attempt - 1, 20));
    long delayMs = baseMs * (1L << exponent) + (long) (jitter.getAsDouble() * baseMs);
    return Duration.ofMillis(delayMs);
  }
}
