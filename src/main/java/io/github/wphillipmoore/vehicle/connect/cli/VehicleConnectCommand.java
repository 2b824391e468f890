package io.github.wphillipmoore.vehicle.connect.cli;

import io.github.wphillipmoore.vehicle.connect.VehicleDataKind;
import io.github.wphillipmoore.vehicle.connect.VehicleServiceClient;
import io.github.wphillipmoore.vehicle.connect.auth.RetryLogging;
import io.github.wphillipmoore.vehicle.connect.command.ClimateSettings;
import io.github.wphillipmoore.vehicle.connect.command.CommandOutcome;
import io.github.wphillipmoore.vehicle.connect.command.VehicleActions;
import io.github.wphillipmoore.vehicle.connect.exception.ConfigurationException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.function.Function;
import org.jspecify.annotations.Nullable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

/**
 * Command-line entry point: global account options plus one subcommand per vehicle action or
 * query.
 */
@Command(
    name = "vehicle-connect",
    mixinStandardHelpOptions = true,
    version = "vehicle-connect 0.1.0",
    description = "Vehicle cloud CLI - direct vehicle control and monitoring",
    footer = {
      "",
      "Examples:",
      "  vehicle-connect list-vehicles",
      "  vehicle-connect -u user@example.com -p secret -c DE status WAUZZZ8V5KA000000",
      "  vehicle-connect lock WAUZZZ8V5KA000000",
      "  vehicle-connect climate-start WAUZZZ8V5KA000000 --temp 22 --glass-heating"
    })
public final class VehicleConnectCommand implements Callable<Integer> {

  private static final String VIN_LABEL = "VIN";

  @Spec private CommandSpec spec;

  @Option(
      names = {"-u", "--username"},
      description = "Account username (e-mail). Falls back to the config file.")
  private String username;

  @Option(
      names = {"-p", "--password"},
      description = "Account password. Falls back to the config file.")
  private String password;

  @Option(
      names = {"-c", "--country"},
      description = "Country code: DE, US, CA or CN. Falls back to the config file.")
  private String country;

  @Option(names = "--spin", description = "Security PIN for lock and pre-heater actions.")
  private String spin;

  @Option(names = "--api-level", description = "API level (0 or 1). Defaults to 0.")
  private Integer apiLevel;

  @Option(names = "--base-url", description = "Base URL of the vehicle service.")
  private String baseUrl;

  @Option(names = "--max-attempts", description = "Maximum login attempts. Defaults to 3.")
  private Integer maxAttempts;

  @Option(
      names = "--retry-delay",
      description = "Seconds to wait between login attempts. Defaults to 10.")
  private Integer retryDelaySeconds;

  @Option(
      names = "--retry-logging",
      description = "Logging of failed login attempts: ${COMPLETION-CANDIDATES}.")
  private RetryLogging retryLogging;

  @Option(
      names = "--config",
      defaultValue = ConfigFile.DEFAULT_PATH,
      description = "Path to the config file (default: ${DEFAULT-VALUE}).")
  private Path configPath;

  @Option(names = "--debug", description = "Enable debug logging.")
  private boolean debug;

  private final Function<InvocationSettings, VehicleServiceClient> clientFactory;

  /**
   * Creates the command.
   *
   * @param clientFactory builds the vehicle service client for the resolved settings
   */
  public VehicleConnectCommand(Function<InvocationSettings, VehicleServiceClient> clientFactory) {
    this.clientFactory = Objects.requireNonNull(clientFactory, "clientFactory");
  }

  @Override
  public Integer call() {
    spec.commandLine().usage(out());
    return ExitCodes.OK;
  }

  @Command(name = "list-vehicles", description = "List all vehicles")
  int listVehicles(@Option(names = "--raw", description = "Show raw API data") boolean raw) {
    return query(
        (client, renderer) -> {
          renderer.info("Fetching vehicle list...");
          renderer.printVehicles(client.listVehicles(), raw);
        });
  }

  @Command(name = "status", description = "Get vehicle status")
  int status(
      @Parameters(paramLabel = VIN_LABEL, description = "Vehicle VIN") String vin,
      @Option(names = "--raw", description = "Show raw API data") boolean raw) {
    return query(
        (client, renderer) -> {
          renderer.info("Fetching status for VIN: " + vin);
          renderer.printStatus(vin, client.fetchVehicleData(vin, VehicleDataKind.STATUS), raw);
        });
  }

  @Command(name = "trip-data", description = "Get trip data")
  int tripData(@Parameters(paramLabel = VIN_LABEL, description = "Vehicle VIN") String vin) {
    return query(
        (client, renderer) -> {
          renderer.info("Fetching trip data for " + vin + "...");
          renderer.printTrips(vin, client.fetchVehicleData(vin, VehicleDataKind.TRIPS));
        });
  }

  @Command(name = "lock", description = "Lock vehicle (requires S-PIN)")
  int lock(@Parameters(paramLabel = VIN_LABEL, description = "Vehicle VIN") String vin) {
    return action(actions -> actions.lock(vin));
  }

  @Command(name = "unlock", description = "Unlock vehicle (requires S-PIN)")
  int unlock(@Parameters(paramLabel = VIN_LABEL, description = "Vehicle VIN") String vin) {
    return action(actions -> actions.unlock(vin));
  }

  @Command(name = "climate-start", description = "Start climate control")
  int climateStart(
      @Parameters(paramLabel = VIN_LABEL, description = "Vehicle VIN") String vin,
      @Option(
              names = "--temp",
              defaultValue = "21",
              description = "Temperature in Celsius (default: ${DEFAULT-VALUE})")
          int temperatureC,
      @Option(names = "--temp-f", description = "Temperature in Fahrenheit") Integer temperatureF,
      @Option(names = "--glass-heating", description = "Enable glass heating") boolean glass,
      @Option(names = "--seat-fl", description = "Front left seat heating") boolean seatFl,
      @Option(names = "--seat-fr", description = "Front right seat heating") boolean seatFr,
      @Option(names = "--seat-rl", description = "Rear left seat heating") boolean seatRl,
      @Option(names = "--seat-rr", description = "Rear right seat heating") boolean seatRr,
      @Option(
              names = "--climatisation-at-unlock",
              description = "Start climate control when the vehicle is unlocked")
          boolean atUnlock) {
    ClimateSettings settings =
        new ClimateSettings(
            temperatureC, temperatureF, glass, seatFl, seatFr, seatRl, seatRr, atUnlock);
    return action(actions -> actions.startClimate(vin, settings));
  }

  @Command(name = "climate-stop", description = "Stop climate control")
  int climateStop(@Parameters(paramLabel = VIN_LABEL, description = "Vehicle VIN") String vin) {
    return action(actions -> actions.stopClimate(vin));
  }

  @Command(name = "charge-start", description = "Start charging")
  int chargeStart(
      @Parameters(paramLabel = VIN_LABEL, description = "Vehicle VIN") String vin,
      @Option(names = "--timer", description = "Start timer charging") boolean timer) {
    return action(actions -> actions.startCharging(vin, timer));
  }

  @Command(name = "set-charge-target", description = "Set target state of charge")
  int setChargeTarget(
      @Parameters(index = "0", paramLabel = VIN_LABEL, description = "Vehicle VIN") String vin,
      @Parameters(index = "1", paramLabel = "TARGET", description = "Target charge (20-100)")
          int target) {
    return action(actions -> actions.setChargeTarget(vin, target));
  }

  @Command(name = "set-charging-mode", description = "Set charging mode")
  int setChargingMode(
      @Parameters(index = "0", paramLabel = VIN_LABEL, description = "Vehicle VIN") String vin,
      @Parameters(index = "1", paramLabel = "MODE", description = "manual or timer") String mode) {
    return action(actions -> actions.setChargingMode(vin, mode));
  }

  @Command(name = "preheater-start", description = "Start pre-heater (requires S-PIN)")
  int preheaterStart(
      @Parameters(paramLabel = VIN_LABEL, description = "Vehicle VIN") String vin,
      @Option(
              names = "--duration",
              defaultValue = "30",
              description = "Duration in minutes (default: ${DEFAULT-VALUE})")
          int duration) {
    return action(actions -> actions.startPreheater(vin, duration));
  }

  @Command(name = "preheater-stop", description = "Stop pre-heater (requires S-PIN)")
  int preheaterStop(@Parameters(paramLabel = VIN_LABEL, description = "Vehicle VIN") String vin) {
    return action(actions -> actions.stopPreheater(vin));
  }

  @Command(name = "window-heating-start", description = "Start window heating")
  int windowHeatingStart(
      @Parameters(paramLabel = VIN_LABEL, description = "Vehicle VIN") String vin) {
    return action(actions -> actions.startWindowHeating(vin));
  }

  @Command(name = "window-heating-stop", description = "Stop window heating")
  int windowHeatingStop(
      @Parameters(paramLabel = VIN_LABEL, description = "Vehicle VIN") String vin) {
    return action(actions -> actions.stopWindowHeating(vin));
  }

  @Command(name = "refresh-data", description = "Request fresh data from vehicle")
  int refreshData(@Parameters(paramLabel = VIN_LABEL, description = "Vehicle VIN") String vin) {
    return action(actions -> actions.refreshData(vin));
  }

  private int action(Function<VehicleActions, CommandOutcome> step) {
    OutcomeRenderer renderer = new OutcomeRenderer(out());
    InvocationSettings settings = resolveSettings(renderer);
    if (settings == null) {
      return ExitCodes.USAGE;
    }
    return new Invoker(clientFactory, renderer).runAction(settings, step);
  }

  private int query(Invoker.Query step) {
    OutcomeRenderer renderer = new OutcomeRenderer(out());
    InvocationSettings settings = resolveSettings(renderer);
    if (settings == null) {
      return ExitCodes.USAGE;
    }
    return new Invoker(clientFactory, renderer).runQuery(settings, step);
  }

  private @Nullable InvocationSettings resolveSettings(OutcomeRenderer renderer) {
    CredentialResolver.Explicit explicit =
        new CredentialResolver.Explicit(
            username,
            password,
            country,
            spin,
            apiLevel,
            baseUrl,
            maxAttempts,
            retryDelaySeconds,
            retryLogging);
    InvocationSettings settings;
    try {
      settings = CredentialResolver.resolve(explicit, ConfigFile.load(configPath));
    } catch (ConfigurationException e) {
      renderer.error(e.getMessage());
      return null;
    }
    if (debug) {
      renderer.info("Using config from: " + (username != null ? "command-line" : configPath));
      renderer.info("Username: " + settings.credentials().identity());
      renderer.info("Country: " + settings.credentials().region());
      renderer.info("API Level: " + settings.credentials().apiLevel());
      boolean pinConfigured = settings.credentials().hasSecurityPin();
      renderer.info("S-PIN configured: " + (pinConfigured ? "Yes" : "No"));
      renderer.info("");
    }
    return settings;
  }

  private PrintWriter out() {
    return spec.commandLine().getOut();
  }
}
