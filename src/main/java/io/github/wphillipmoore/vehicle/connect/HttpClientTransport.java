package io.github.wphillipmoore.vehicle.connect;

import com.google.gson.Gson;
import io.github.wphillipmoore.vehicle.connect.exception.VehicleTransportException;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * JDK {@link HttpClient}-based implementation of {@link VehicleTransport}.
 *
 * <p>Uses Gson for JSON serialization. An interrupted request re-asserts the thread's interrupt
 * flag and surfaces as a {@link VehicleTransportException} whose cause is the {@link
 * InterruptedException}.
 */
public final class HttpClientTransport implements VehicleTransport {

  static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);

  private final Gson gson = new Gson();
  private final HttpClient client;

  /** Creates a transport with a default TLS-verifying {@link HttpClient}. */
  public HttpClientTransport() {
    this.client =
        HttpClient.newBuilder()
            .connectTimeout(CONNECT_TIMEOUT)
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build();
  }

  /**
   * Creates a transport with an injected {@link HttpClient}. Package-private for testing.
   *
   * @param client the HTTP client to use
   */
  HttpClientTransport(HttpClient client) {
    this.client = Objects.requireNonNull(client, "client");
  }

  @Override
  public TransportResponse postJson(
      String url,
      Map<String, Object> payload,
      Map<String, String> headers,
      @Nullable Duration timeout) {
    String json = gson.toJson(payload);

    HttpRequest.Builder requestBuilder =
        HttpRequest.newBuilder()
            .uri(URI.create(url))
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(json));

    headers.forEach(requestBuilder::header);

    if (timeout != null) {
      requestBuilder.timeout(timeout);
    }

    HttpResponse<String> response;
    try {
      response = client.send(requestBuilder.build(), HttpResponse.BodyHandlers.ofString());
    } catch (IOException e) {
      throw new VehicleTransportException("HTTP request failed", url, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new VehicleTransportException("HTTP request interrupted", url, e);
    }

    return new TransportResponse(
        response.statusCode(), response.body(), flattenHeaders(response.headers()));
  }

  /**
   * Flattens {@link HttpHeaders} multi-value map to single-value map per RFC 9110 section 5.3.
   *
   * <p>Multiple values for the same header name are joined with {@code ", "}.
   *
   * @param httpHeaders the HTTP response headers
   * @return a flattened string-to-string header map
   */
  static Map<String, String> flattenHeaders(HttpHeaders httpHeaders) {
    Map<String, String> result = new LinkedHashMap<>();
    httpHeaders.map().forEach((name, values) -> result.put(name, String.join(", ", values)));
    return result;
  }
}
