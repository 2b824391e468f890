package io.github.wphillipmoore.vehicle.connect.exception;

import java.util.Objects;

/** Thrown when every login attempt failed. The last underlying failure is the cause. */
public final class ExhaustedRetriesException extends VehicleConnectException {

  private static final long serialVersionUID = 1L;

  private final int attempts;

  /**
   * Creates an exhausted retries exception.
   *
   * @param attempts the number of login attempts made
   * @param lastError the failure of the final attempt
   */
  public ExhaustedRetriesException(int attempts, Throwable lastError) {
    super(
        "Failed to log in after "
            + attempts
            + " attempt(s): "
            + describe(Objects.requireNonNull(lastError, "lastError"))
            + ". Check your credentials; you may need to open the vehicle app or log in via a web"
            + " browser to accept updated terms and conditions.",
        lastError);
    this.attempts = attempts;
  }

  /** Returns the number of login attempts made. */
  public int getAttempts() {
    return attempts;
  }

  private static String describe(Throwable error) {
    String message = error.getMessage();
    return message != null ? message : error.getClass().getSimpleName();
  }
}
