package io.github.wphillipmoore.vehicle.connect.cli;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import io.github.wphillipmoore.vehicle.connect.command.CommandOutcome;
import io.github.wphillipmoore.vehicle.connect.command.VehicleAction;
import java.io.PrintWriter;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/** Writes command outcomes and query results as plain text or pretty-printed JSON. */
final class OutcomeRenderer {

  private static final Gson PRETTY_GSON =
      new GsonBuilder().setPrettyPrinting().serializeNulls().create();

  private static final List<String> SUMMARY_KEYS =
      List.of("vin", "title", "model", "model_year", "csid");

  /** Success and failure text per action. */
  private static final Map<VehicleAction, String[]> PHRASES =
      Map.ofEntries(
          Map.entry(
              VehicleAction.LOCK,
              new String[] {"Vehicle locked successfully", "Failed to lock vehicle"}),
          Map.entry(
              VehicleAction.UNLOCK,
              new String[] {"Vehicle unlocked successfully", "Failed to unlock vehicle"}),
          Map.entry(
              VehicleAction.CLIMATE_START,
              new String[] {
                "Climate control started successfully", "Failed to start climate control"
              }),
          Map.entry(
              VehicleAction.CLIMATE_STOP,
              new String[] {
                "Climate control stopped successfully", "Failed to stop climate control"
              }),
          Map.entry(
              VehicleAction.CHARGE_START,
              new String[] {"Charging started successfully", "Failed to start charging"}),
          Map.entry(
              VehicleAction.SET_CHARGE_TARGET,
              new String[] {"Target charge set successfully", "Failed to set target charge"}),
          Map.entry(
              VehicleAction.SET_CHARGING_MODE,
              new String[] {"Charging mode set successfully", "Failed to set charging mode"}),
          Map.entry(
              VehicleAction.PREHEATER_START,
              new String[] {"Pre-heater started successfully", "Failed to start pre-heater"}),
          Map.entry(
              VehicleAction.PREHEATER_STOP,
              new String[] {"Pre-heater stopped successfully", "Failed to stop pre-heater"}),
          Map.entry(
              VehicleAction.WINDOW_HEATING_START,
              new String[] {
                "Window heating started successfully", "Failed to start window heating"
              }),
          Map.entry(
              VehicleAction.WINDOW_HEATING_STOP,
              new String[] {
                "Window heating stopped successfully", "Failed to stop window heating"
              }),
          Map.entry(
              VehicleAction.REFRESH_DATA,
              new String[] {
                "Data refresh initiated successfully", "Failed to refresh vehicle data"
              }));

  /** Subject of the disabled message for actions that can be disabled. */
  private static final Map<VehicleAction, String> DISABLED_PHRASES =
      Map.of(VehicleAction.REFRESH_DATA, "Data refresh");

  private final PrintWriter out;

  OutcomeRenderer(PrintWriter out) {
    this.out = Objects.requireNonNull(out, "out");
  }

  /**
   * Prints an action outcome.
   *
   * @return the exit code for the outcome
   */
  int render(CommandOutcome outcome) {
    String[] phrases = PHRASES.get(outcome.action());
    if (outcome instanceof CommandOutcome.Succeeded) {
      out.println(phrases[0]);
      out.flush();
      return ExitCodes.OK;
    }
    if (outcome instanceof CommandOutcome.Disabled) {
      out.println(DISABLED_PHRASES.getOrDefault(outcome.action(), outcome.action().commandName())
          + " is disabled for this vehicle");
      out.flush();
      return ExitCodes.OK;
    }
    CommandOutcome.Failed failed = (CommandOutcome.Failed) outcome;
    if (failed.cause() != null) {
      out.println(phrases[1] + ": " + failed.message());
    } else {
      out.println(phrases[1]);
    }
    out.flush();
    return ExitCodes.FAILURE;
  }

  void error(String message) {
    out.println("ERROR: " + message);
    out.flush();
  }

  void info(String message) {
    out.println(message);
    out.flush();
  }

  void printVehicles(List<Map<String, Object>> vehicles, boolean raw) {
    if (vehicles.isEmpty()) {
      info("No vehicles found.");
      return;
    }
    for (int index = 0; index < vehicles.size(); index++) {
      Map<String, Object> vehicle = vehicles.get(index);
      out.printf("%n--- Vehicle %d ---%n", index + 1);
      printSummary(vehicle);
      if (raw) {
        printJson("Raw Data for " + vehicle.getOrDefault("vin", "vehicle " + (index + 1)), vehicle);
      }
    }
    out.flush();
  }

  void printStatus(String vin, Map<String, Object> status, boolean raw) {
    out.printf("%n=== Vehicle Status: %s ===%n", vin);
    if (raw) {
      printJson("Raw Vehicle Data", status);
      return;
    }
    new TreeMap<>(status).forEach((key, value) -> out.printf("%s: %s%n", key, value));
    out.flush();
  }

  void printTrips(String vin, Map<String, Object> trips) {
    if (trips.isEmpty()) {
      info("No trip data available");
      return;
    }
    new TreeMap<>(trips).forEach((section, data) -> printJson(section + " (" + vin + ")", data));
  }

  void printJson(String title, Object data) {
    out.printf("%n=== %s ===%n", title);
    out.println(PRETTY_GSON.toJson(data));
    out.flush();
  }

  private void printSummary(Map<String, Object> vehicle) {
    for (String key : SUMMARY_KEYS) {
      Object value = vehicle.get(key);
      if (value != null) {
        out.printf("%s: %s%n", key, value);
      }
    }
  }
}
