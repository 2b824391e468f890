package io.github.wphillipmoore.vehicle.connect.exception;

/**
 * Structured classification of a vehicle service fault.
 *
 * <p>{@link #UNCLASSIFIED} means the service did not say what went wrong. Callers then fall back to
 * inspecting the fault message.
 */
public enum FaultKind {

  /** The account is rate limited. Retrying makes the lockout worse. */
  THROTTLED,

  /** A temporary failure that may succeed on retry. */
  TRANSIENT,

  /** A definite failure that is not throttling. */
  OTHER,

  /** The service gave no structured reason. */
  UNCLASSIFIED
}
