package io.github.wphillipmoore.vehicle.connect;

import java.time.Duration;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Transport interface for HTTP communication with the vehicle service.
 *
 * <p>Implementations handle the actual HTTP communication and should throw {@link
 * io.github.wphillipmoore.vehicle.connect.exception.VehicleTransportException} for network or
 * connection failures. HTTP error statuses are returned, not thrown.
 */
public interface VehicleTransport {

  /**
   * Sends a JSON POST request.
   *
   * @param url fully-qualified URL to send the request to
   * @param payload JSON-serializable request body
   * @param headers HTTP headers to include in the request
   * @param timeout request timeout, or {@code null} for no timeout
   * @return the transport response
   */
  TransportResponse postJson(
      String url,
      Map<String, Object> payload,
      Map<String, String> headers,
      @Nullable Duration timeout);
}
