package io.github.wphillipmoore.vehicle.connect.command;

import io.github.wphillipmoore.vehicle.connect.VehicleServiceClient;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * The vehicle action catalog.
 *
 * <p>Each method builds the request for one action and runs it through the {@link CommandGate},
 * which owns PIN checks, validation and result classification.
 */
public final class VehicleActions {

  private final CommandGate gate;
  private final VehicleServiceClient client;

  /**
   * Creates the catalog.
   *
   * @param gate the gate every action runs through
   * @param client the client that performs the actions
   */
  public VehicleActions(CommandGate gate, VehicleServiceClient client) {
    this.gate = Objects.requireNonNull(gate, "gate");
    this.client = Objects.requireNonNull(client, "client");
  }

  /** Locks the vehicle. Requires the S-PIN. */
  public CommandOutcome lock(String vin) {
    return run(new CommandRequest(vin, VehicleAction.LOCK));
  }

  /** Unlocks the vehicle. Requires the S-PIN. */
  public CommandOutcome unlock(String vin) {
    return run(new CommandRequest(vin, VehicleAction.UNLOCK));
  }

  /** Starts climate control. */
  public CommandOutcome startClimate(String vin, ClimateSettings settings) {
    Objects.requireNonNull(settings, "settings");
    return run(new CommandRequest(vin, VehicleAction.CLIMATE_START, settings.toParameters()));
  }

  /** Stops climate control. */
  public CommandOutcome stopClimate(String vin) {
    return run(new CommandRequest(vin, VehicleAction.CLIMATE_STOP));
  }

  /**
   * Starts charging.
   *
   * @param vin the vehicle
   * @param timer {@code true} for timer charging, {@code false} for manual charging
   */
  public CommandOutcome startCharging(String vin, boolean timer) {
    return run(
        new CommandRequest(vin, VehicleAction.CHARGE_START, Map.of(CommandRequest.TIMER, timer)));
  }

  /** Sets the target state of charge in percent (20 to 100). */
  public CommandOutcome setChargeTarget(String vin, int targetSoc) {
    return run(
        new CommandRequest(
            vin, VehicleAction.SET_CHARGE_TARGET, Map.of(CommandRequest.TARGET_SOC, targetSoc)));
  }

  /** Sets the charging mode ({@code manual} or {@code timer}) without starting charging. */
  public CommandOutcome setChargingMode(String vin, @Nullable String mode) {
    Map<String, Object> parameters = new LinkedHashMap<>();
    if (mode != null) {
      parameters.put(CommandRequest.MODE, mode);
    }
    return run(new CommandRequest(vin, VehicleAction.SET_CHARGING_MODE, parameters));
  }

  /** Starts the pre-heater for the given number of minutes. Requires the S-PIN. */
  public CommandOutcome startPreheater(String vin, int durationMinutes) {
    return run(
        new CommandRequest(
            vin, VehicleAction.PREHEATER_START, Map.of(CommandRequest.DURATION, durationMinutes)));
  }

  /** Stops the pre-heater. Requires the S-PIN. */
  public CommandOutcome stopPreheater(String vin) {
    return run(new CommandRequest(vin, VehicleAction.PREHEATER_STOP));
  }

  /** Starts window heating. */
  public CommandOutcome startWindowHeating(String vin) {
    return run(new CommandRequest(vin, VehicleAction.WINDOW_HEATING_START));
  }

  /** Stops window heating. */
  public CommandOutcome stopWindowHeating(String vin) {
    return run(new CommandRequest(vin, VehicleAction.WINDOW_HEATING_STOP));
  }

  /** Asks the vehicle to report fresh data. May come back {@link CommandOutcome.Disabled}. */
  public CommandOutcome refreshData(String vin) {
    return run(new CommandRequest(vin, VehicleAction.REFRESH_DATA));
  }

  private CommandOutcome run(CommandRequest request) {
    return gate.execute(
        request,
        validated ->
            client.executeAction(validated.vin(), validated.action(), validated.parameters()));
  }
}
