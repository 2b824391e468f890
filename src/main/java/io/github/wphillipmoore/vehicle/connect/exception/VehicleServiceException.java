package io.github.wphillipmoore.vehicle.connect.exception;

import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Thrown when the vehicle cloud service rejects a request.
 *
 * <p>The {@code statusCode} may be {@code null} if the fault did not come from an HTTP response.
 */
public final class VehicleServiceException extends VehicleConnectException {

  private static final long serialVersionUID = 1L;

  private final FaultKind kind;
  private final @Nullable Integer statusCode;

  /**
   * Creates a service exception.
   *
   * @param message the service's description of the failure
   * @param kind the structured fault classification
   * @param statusCode the HTTP status code, or {@code null} if unavailable
   */
  public VehicleServiceException(String message, FaultKind kind, @Nullable Integer statusCode) {
    super(message);
    this.kind = Objects.requireNonNull(kind, "kind");
    this.statusCode = statusCode;
  }

  /**
   * Creates a service exception with a cause.
   *
   * @param message the service's description of the failure
   * @param kind the structured fault classification
   * @param statusCode the HTTP status code, or {@code null} if unavailable
   * @param cause the underlying cause
   */
  public VehicleServiceException(
      String message, FaultKind kind, @Nullable Integer statusCode, Throwable cause) {
    super(message, cause);
    this.kind = Objects.requireNonNull(kind, "kind");
    this.statusCode = statusCode;
  }

  /** Returns the structured fault classification. */
  public FaultKind getKind() {
    return kind;
  }

  /**
   * Returns the HTTP status code, or {@code null} if the status code was not available.
   *
   * @return the status code, or {@code null}
   */
  public @Nullable Integer getStatusCode() {
    return statusCode;
  }
}
