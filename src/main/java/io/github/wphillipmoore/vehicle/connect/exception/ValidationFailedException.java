package io.github.wphillipmoore.vehicle.connect.exception;

import java.util.Objects;
import org.jspecify.annotations.Nullable;

/** Thrown when a command parameter violates its constraint. Raised before dispatch. */
public final class ValidationFailedException extends VehicleConnectException {

  private static final long serialVersionUID = 1L;

  private final String parameter;
  private final String constraint;
  private final @Nullable Object value;

  /**
   * Creates a validation exception.
   *
   * @param parameter the parameter name
   * @param constraint a description of the violated constraint, e.g. {@code "between 20 and 100"}
   * @param value the rejected value, or {@code null} if it was absent
   */
  public ValidationFailedException(String parameter, String constraint, @Nullable Object value) {
    super(
        Objects.requireNonNull(parameter, "parameter")
            + " must be "
            + Objects.requireNonNull(constraint, "constraint")
            + " (got "
            + value
            + ")");
    this.parameter = parameter;
    this.constraint = constraint;
    this.value = value;
  }

  /** Returns the parameter name. */
  public String getParameter() {
    return parameter;
  }

  /** Returns the violated constraint. */
  public String getConstraint() {
    return constraint;
  }

  /** Returns the rejected value, or {@code null} if it was absent. */
  public @Nullable Object getValue() {
    return value;
  }
}
