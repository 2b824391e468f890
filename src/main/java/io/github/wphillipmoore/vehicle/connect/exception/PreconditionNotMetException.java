package io.github.wphillipmoore.vehicle.connect.exception;

import java.util.Objects;

/**
 * Thrown when a command cannot run because a required credential is missing.
 *
 * <p>Raised before any network call. Never retried.
 */
public final class PreconditionNotMetException extends VehicleConnectException {

  private static final long serialVersionUID = 1L;

  private final String requirement;

  /**
   * Creates a precondition exception.
   *
   * @param requirement the missing requirement, e.g. {@code "S-PIN"}
   * @param action the CLI name of the action that needed it
   */
  public PreconditionNotMetException(String requirement, String action) {
    super(
        Objects.requireNonNull(requirement, "requirement")
            + " required for "
            + Objects.requireNonNull(action, "action"));
    this.requirement = requirement;
  }

  /** Returns the missing requirement. */
  public String getRequirement() {
    return requirement;
  }
}
