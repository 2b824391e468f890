package io.github.wphillipmoore.vehicle.connect.exception;

/**
 * Base exception for all vehicle connect errors.
 *
 * <p>This is an unchecked exception hierarchy. All vehicle connect errors extend this sealed class.
 */
public sealed class VehicleConnectException extends RuntimeException
    permits VehicleServiceException,
        VehicleTransportException,
        VehicleResponseException,
        TransientLoginException,
        ThrottledException,
        ExhaustedRetriesException,
        LoginCancelledException,
        PreconditionNotMetException,
        ValidationFailedException,
        ConfigurationException {

  /** Creates an exception with the given message. */
  public VehicleConnectException(String message) {
    super(message);
  }

  /** Creates an exception with the given message and cause. */
  public VehicleConnectException(String message, Throwable cause) {
    super(message, cause);
  }
}
