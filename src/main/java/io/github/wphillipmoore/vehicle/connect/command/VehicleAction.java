package io.github.wphillipmoore.vehicle.connect.command;

import java.util.Objects;

/**
 * Vehicle actions that change vehicle state.
 *
 * <p>Each action carries its command name (used on the command line and in the service URL),
 * whether it needs the security PIN, and whether the service may answer it with {@link
 * ActionResult#DISABLED}.
 */
public enum VehicleAction {
  LOCK("lock", true, false),
  UNLOCK("unlock", true, false),
  CLIMATE_START("climate-start", false, false),
  CLIMATE_STOP("climate-stop", false, false),
  CHARGE_START("charge-start", false, false),
  SET_CHARGE_TARGET("set-charge-target", false, false),
  SET_CHARGING_MODE("set-charging-mode", false, false),
  PREHEATER_START("preheater-start", true, false),
  PREHEATER_STOP("preheater-stop", true, false),
  WINDOW_HEATING_START("window-heating-start", false, false),
  WINDOW_HEATING_STOP("window-heating-stop", false, false),
  REFRESH_DATA("refresh-data", false, true);

  private final String commandName;
  private final boolean requiresPin;
  private final boolean reportsDisabled;

  VehicleAction(String commandName, boolean requiresPin, boolean reportsDisabled) {
    this.commandName = commandName;
    this.requiresPin = requiresPin;
    this.reportsDisabled = reportsDisabled;
  }

  /** Returns the command name, e.g. {@code "set-charge-target"}. */
  public String commandName() {
    return commandName;
  }

  /** Returns whether the action needs the security PIN. */
  public boolean requiresPin() {
    return requiresPin;
  }

  /** Returns whether a disabled answer is a valid outcome for this action. */
  public boolean reportsDisabled() {
    return reportsDisabled;
  }

  /**
   * Looks up an action by its command name.
   *
   * @param commandName the command name, e.g. {@code "lock"}
   * @return the matching action
   * @throws IllegalArgumentException if no action has that name
   */
  public static VehicleAction fromCommandName(String commandName) {
    Objects.requireNonNull(commandName, "commandName");
    for (VehicleAction action : values()) {
      if (action.commandName.equals(commandName)) {
        return action;
      }
    }
    throw new IllegalArgumentException("Unknown vehicle action: " + commandName);
  }
}
