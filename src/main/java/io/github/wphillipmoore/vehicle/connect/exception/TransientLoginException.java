package io.github.wphillipmoore.vehicle.connect.exception;

/** A login attempt failed for a reason that a later attempt may not share. */
public final class TransientLoginException extends VehicleConnectException {

  private static final long serialVersionUID = 1L;

  /** Creates a transient login exception. */
  public TransientLoginException(String message) {
    super(message);
  }

  /** Creates a transient login exception with a cause. */
  public TransientLoginException(String message, Throwable cause) {
    super(message, cause);
  }
}
