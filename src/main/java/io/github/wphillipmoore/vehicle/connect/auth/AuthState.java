package io.github.wphillipmoore.vehicle.connect.auth;

/** Lifecycle states of an {@link AuthSession}. */
public enum AuthState {

  /** No login has been attempted. */
  IDLE,

  /** A login sequence is in progress. */
  AUTHENTICATING,

  /** A login attempt succeeded. */
  AUTHENTICATED,

  /** The service reported account throttling. Terminal. */
  THROTTLED,

  /** Every attempt failed. Terminal. */
  FAILED
}
