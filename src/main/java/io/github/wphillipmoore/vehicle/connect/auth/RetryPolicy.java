package io.github.wphillipmoore.vehicle.connect.auth;

import java.time.Duration;
import java.util.Objects;

/**
 * Bounds for the login retry loop.
 *
 * <p>Only the number of attempts and the pause between them are bounded. The wall-clock time of a
 * single attempt is left to the service client.
 *
 * @param maxAttempts the maximum number of login attempts (must be &gt;= 1)
 * @param retryDelay the pause between attempts (must not be negative)
 * @param logging how non-final failures are logged
 */
public record RetryPolicy(int maxAttempts, Duration retryDelay, RetryLogging logging) {

  /** Default number of login attempts (3). */
  public static final int DEFAULT_MAX_ATTEMPTS = 3;

  /** Default pause between login attempts (10 seconds). */
  public static final Duration DEFAULT_RETRY_DELAY = Duration.ofSeconds(10);

  /**
   * Creates a retry policy.
   *
   * @throws IllegalArgumentException if maxAttempts is below 1 or retryDelay is negative
   */
  public RetryPolicy {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1");
    }
    Objects.requireNonNull(retryDelay, "retryDelay");
    if (retryDelay.isNegative()) {
      throw new IllegalArgumentException("retryDelay must not be negative");
    }
    Objects.requireNonNull(logging, "logging");
  }

  /** Creates a retry policy that logs every failed attempt. */
  public RetryPolicy(int maxAttempts, Duration retryDelay) {
    this(maxAttempts, retryDelay, RetryLogging.EVERY_ATTEMPT);
  }

  /** Creates a retry policy with default values (3 attempts, 10s delay). */
  public RetryPolicy() {
    this(DEFAULT_MAX_ATTEMPTS, DEFAULT_RETRY_DELAY);
  }
}
