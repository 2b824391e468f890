package io.github.wphillipmoore.vehicle.connect.exception;

/** Thrown when the invocation parameters and config file do not yield usable settings. */
public final class ConfigurationException extends VehicleConnectException {

  private static final long serialVersionUID = 1L;

  /** Creates a configuration exception. */
  public ConfigurationException(String message) {
    super(message);
  }

  /** Creates a configuration exception with a cause. */
  public ConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
