package io.github.wphillipmoore.vehicle.connect.auth;

/**
 * How loudly non-final login failures are logged.
 *
 * <p>The final failure and throttling are always logged at ERROR.
 */
public enum RetryLogging {

  /** Each failed attempt that will be retried is logged at WARN. */
  EVERY_ATTEMPT,

  /** Failed attempts that will be retried are logged at DEBUG only. */
  FINAL_ONLY
}
