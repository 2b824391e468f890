package io.github.wphillipmoore.vehicle.connect.cli;

import io.github.wphillipmoore.vehicle.connect.HttpClientTransport;
import io.github.wphillipmoore.vehicle.connect.RestVehicleServiceClient;
import io.github.wphillipmoore.vehicle.connect.VehicleServiceClient;
import java.util.Arrays;
import java.util.concurrent.atomic.AtomicBoolean;
import picocli.CommandLine;

/**
 * Process entry point.
 *
 * <p>Holds no logger: {@code --debug} has to raise the log level before the first logger exists.
 */
public final class Main {

  static final String LOG_LEVEL_PROPERTY = "org.slf4j.simpleLogger.defaultLogLevel";

  private Main() {}

  /** Entry point. */
  public static void main(String[] args) {
    if (Arrays.asList(args).contains("--debug")) {
      System.setProperty(LOG_LEVEL_PROPERTY, "debug");
    }

    AtomicBoolean finished = new AtomicBoolean();
    Thread mainThread = Thread.currentThread();
    Runtime.getRuntime()
        .addShutdownHook(
            new Thread(
                () -> {
                  if (!finished.get()) {
                    mainThread.interrupt();
                    try {
                      mainThread.join(2000);
                    } catch (InterruptedException e) {
                      Thread.currentThread().interrupt();
                    }
                  }
                },
                "vehicle-connect-cancel"));

    int exitCode = newCommandLine().execute(args);
    finished.set(true);
    System.exit(exitCode);
  }

  static CommandLine newCommandLine() {
    return new CommandLine(new VehicleConnectCommand(Main::createClient))
        .setCaseInsensitiveEnumValuesAllowed(true);
  }

  static VehicleServiceClient createClient(InvocationSettings settings) {
    return new RestVehicleServiceClient.Builder(settings.baseUrl())
        .transport(new HttpClientTransport())
        .securityPin(settings.credentials().securityPin())
        .apiLevel(settings.credentials().apiLevel())
        .build();
  }
}
