package io.github.wphillipmoore.vehicle.connect.command;

import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Classified result of a vehicle action.
 *
 * <p>{@link Disabled} is distinct from {@link Failed}: it reports a server-side policy state,
 * not an error.
 */
public sealed interface CommandOutcome
    permits CommandOutcome.Succeeded, CommandOutcome.Failed, CommandOutcome.Disabled {

  /** Returns the action this outcome belongs to. */
  VehicleAction action();

  /**
   * The service accepted the action.
   *
   * @param action the action that ran
   */
  record Succeeded(VehicleAction action) implements CommandOutcome {

    /** Validates non-null fields. */
    public Succeeded {
      Objects.requireNonNull(action, "action");
    }
  }

  /**
   * The action failed, either rejected by the service or because the call raised a fault.
   *
   * @param action the action that ran
   * @param message description of the failure
   * @param cause the raised fault, or {@code null} if the service answered with a failure
   */
  record Failed(VehicleAction action, String message, @Nullable Throwable cause)
      implements CommandOutcome {

    /** Validates non-null fields. */
    public Failed {
      Objects.requireNonNull(action, "action");
      Objects.requireNonNull(message, "message");
    }
  }

  /**
   * The action is disabled for this vehicle.
   *
   * @param action the action that ran
   */
  record Disabled(VehicleAction action) implements CommandOutcome {

    /** Validates non-null fields. */
    public Disabled {
      Objects.requireNonNull(action, "action");
    }
  }
}
