package io.github.wphillipmoore.vehicle.connect.exception;

/** Thrown when the login sequence is interrupted. The thread's interrupt flag stays set. */
public final class LoginCancelledException extends VehicleConnectException {

  private static final long serialVersionUID = 1L;

  private final int attempts;

  /**
   * Creates a cancellation exception.
   *
   * @param attempts the number of login attempts made before cancellation
   */
  public LoginCancelledException(int attempts) {
    super("Login cancelled after " + attempts + " attempt(s)");
    this.attempts = attempts;
  }

  /**
   * Creates a cancellation exception with a cause.
   *
   * @param attempts the number of login attempts made before cancellation
   * @param cause the interruption
   */
  public LoginCancelledException(int attempts, Throwable cause) {
    super("Login cancelled after " + attempts + " attempt(s)", cause);
    this.attempts = attempts;
  }

  /** Returns the number of login attempts made before cancellation. */
  public int getAttempts() {
    return attempts;
  }
}
