package io.github.wphillipmoore.vehicle.connect.command;

import java.util.Map;
import java.util.Objects;

/**
 * A single vehicle action to run through the {@link CommandGate}.
 *
 * <p>Parameters are copied into an unmodifiable map, so absent optional values must be left out
 * rather than mapped to {@code null}.
 *
 * @param vin the target vehicle identifier, never null
 * @param action the action to run, never null
 * @param parameters the action parameters, never null
 * @param requiresPin whether the security PIN must be configured
 */
public record CommandRequest(
    String vin, VehicleAction action, Map<String, Object> parameters, boolean requiresPin) {

  /** Target state of charge in percent. */
  public static final String TARGET_SOC = "target_soc";

  /** Charging mode, {@code manual} or {@code timer}. */
  public static final String MODE = "mode";

  /** Pre-heater run time in minutes. */
  public static final String DURATION = "duration";

  /** Whether charging is started by the timer. */
  public static final String TIMER = "timer";

  /** Climate target temperature in degrees Celsius. */
  public static final String TEMPERATURE_C = "temperature_c";

  /** Climate target temperature in degrees Fahrenheit. */
  public static final String TEMPERATURE_F = "temperature_f";

  /** Validates non-null fields and defensively copies the parameters. */
  public CommandRequest {
    Objects.requireNonNull(vin, "vin");
    Objects.requireNonNull(action, "action");
    parameters = Map.copyOf(Objects.requireNonNull(parameters, "parameters"));
  }

  /** Creates a request whose PIN requirement is taken from the action. */
  public CommandRequest(String vin, VehicleAction action, Map<String, Object> parameters) {
    this(vin, action, parameters, action.requiresPin());
  }

  /** Creates a request without parameters. */
  public CommandRequest(String vin, VehicleAction action) {
    this(vin, action, Map.of());
  }
}
