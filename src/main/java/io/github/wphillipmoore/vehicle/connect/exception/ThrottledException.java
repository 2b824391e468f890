package io.github.wphillipmoore.vehicle.connect.exception;

/**
 * Thrown when the account is throttled by the vehicle service.
 *
 * <p>Terminal for the process run. The user has to wait before trying again.
 */
public final class ThrottledException extends VehicleConnectException {

  private static final long serialVersionUID = 1L;

  private final String serviceMessage;

  /**
   * Creates a throttled exception.
   *
   * @param serviceMessage the fault message reported by the service
   */
  public ThrottledException(String serviceMessage) {
    super("Account is throttled. Please wait before trying again. (" + serviceMessage + ")");
    this.serviceMessage = serviceMessage;
  }

  /** Returns the fault message reported by the service. */
  public String getServiceMessage() {
    return serviceMessage;
  }
}
