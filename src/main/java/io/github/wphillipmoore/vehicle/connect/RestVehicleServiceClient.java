package io.github.wphillipmoore.vehicle.connect;

import com.google.gson.Gson;
import com.google.gson.JsonSyntaxException;
import io.github.wphillipmoore.vehicle.connect.auth.Region;
import io.github.wphillipmoore.vehicle.connect.command.ActionResult;
import io.github.wphillipmoore.vehicle.connect.command.VehicleAction;
import io.github.wphillipmoore.vehicle.connect.exception.FaultKind;
import io.github.wphillipmoore.vehicle.connect.exception.VehicleResponseException;
import io.github.wphillipmoore.vehicle.connect.exception.VehicleServiceException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link VehicleServiceClient} that talks JSON to a vehicle cloud REST endpoint.
 *
 * <p>Login stores the bearer token returned by the service; every later call sends it. The security
 * PIN, when configured, is only sent with actions that need it.
 *
 * <p>Instances are created via the {@link Builder}:
 *
 * <pre>{@code
 * RestVehicleServiceClient client = new RestVehicleServiceClient.Builder(
 *         "https://vehicle-gateway.example.com/api/v1")
 *     .transport(new HttpClientTransport())
 *     .securityPin("1234")
 *     .build();
 * }</pre>
 */
public final class RestVehicleServiceClient implements VehicleServiceClient {

  private static final Logger LOGGER = LoggerFactory.getLogger(RestVehicleServiceClient.class);

  static final String LOGIN_PATH = "/login";
  static final String VEHICLES_PATH = "/vehicles";
  static final String PIN_HEADER = "X-Security-Pin";
  static final String API_LEVEL_HEADER = "X-Api-Level";
  static final String DISABLED_RESULT = "disabled";

  private static final Gson GSON = new Gson();
  private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

  private final String baseUrl;
  private final VehicleTransport transport;
  private final @Nullable Duration timeout;
  private final @Nullable String securityPin;
  private final int apiLevel;

  private @Nullable String token;

  private RestVehicleServiceClient(Builder builder) {
    this.baseUrl = stripTrailingSlashes(builder.baseUrl);
    this.transport = Objects.requireNonNull(builder.transport, "transport");
    this.timeout = builder.timeout;
    this.securityPin = builder.securityPin;
    this.apiLevel = builder.apiLevel;
  }

  /** Returns whether a login has succeeded on this client. */
  public boolean hasToken() {
    return token != null;
  }

  @Override
  public boolean attemptLogin(String identity, String secret, Region region) {
    String url = baseUrl + LOGIN_PATH;
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("username", identity);
    payload.put("password", secret);
    payload.put("country", region.name());
    payload.put("api_level", apiLevel);

    TransportResponse response = transport.postJson(url, payload, baseHeaders(), timeout);
    if (response.isError()) {
      throw loginFault(response);
    }
    Map<String, Object> body = parseResponsePayload(response.body());
    Object value = body.get("token");
    if (value instanceof String s && !s.isBlank()) {
      token = s;
      return true;
    }
    LOGGER.debug("Login response carried no token");
    return false;
  }

  @Override
  public ActionResult executeAction(
      String vin, VehicleAction action, Map<String, Object> parameters) {
    String url = vehicleUrl(vin) + "/actions/" + action.commandName();
    Map<String, String> headers = authorizedHeaders();
    if (action.requiresPin() && securityPin != null) {
      headers.put(PIN_HEADER, securityPin);
    }
    TransportResponse response =
        transport.postJson(url, new LinkedHashMap<>(parameters), headers, timeout);
    raiseForServiceErrors(response);
    return parseActionResult(parseResponsePayload(response.body()), response.body());
  }

  @Override
  @SuppressWarnings("unchecked")
  public List<Map<String, Object>> listVehicles() {
    TransportResponse response =
        transport.postJson(baseUrl + VEHICLES_PATH, Map.of(), authorizedHeaders(), timeout);
    raiseForServiceErrors(response);
    Object vehicles = parseResponsePayload(response.body()).get("vehicles");
    if (vehicles == null) {
      return new ArrayList<>();
    }
    if (!(vehicles instanceof List)) {
      throw new VehicleResponseException("vehicles is not a list", response.body());
    }
    List<Map<String, Object>> result = new ArrayList<>();
    for (Object item : (List<Object>) vehicles) {
      if (!(item instanceof Map)) {
        throw new VehicleResponseException("vehicles item is not an object", response.body());
      }
      result.add(new LinkedHashMap<>((Map<String, Object>) item));
    }
    return result;
  }

  @Override
  public Map<String, Object> fetchVehicleData(String vin, VehicleDataKind kind) {
    String url = vehicleUrl(vin) + "/" + kind.path();
    TransportResponse response = transport.postJson(url, Map.of(), authorizedHeaders(), timeout);
    raiseForServiceErrors(response);
    return parseResponsePayload(response.body());
  }

  private String vehicleUrl(String vin) {
    return baseUrl + VEHICLES_PATH + "/" + normalizeVin(vin);
  }

  private Map<String, String> baseHeaders() {
    Map<String, String> headers = new LinkedHashMap<>();
    headers.put("Accept", "application/json");
    headers.put(API_LEVEL_HEADER, Integer.toString(apiLevel));
    return headers;
  }

  private Map<String, String> authorizedHeaders() {
    if (token == null) {
      throw new IllegalStateException("Not logged in to the vehicle service");
    }
    Map<String, String> headers = baseHeaders();
    headers.put("Authorization", "Bearer " + token);
    return headers;
  }

  static String normalizeVin(String vin) {
    return vin.strip().toLowerCase(Locale.ROOT);
  }

  static VehicleServiceException loginFault(TransportResponse response) {
    int status = response.statusCode();
    // only 429 is known to mean throttling; any other status may carry it in the error text
    FaultKind kind = status == 429 ? FaultKind.THROTTLED : FaultKind.UNCLASSIFIED;
    return new VehicleServiceException(errorText(response), kind, status);
  }

  static void raiseForServiceErrors(TransportResponse response) {
    if (!response.isError()) {
      return;
    }
    int status = response.statusCode();
    FaultKind kind;
    if (status == 429) {
      kind = FaultKind.THROTTLED;
    } else if (status >= 500) {
      kind = FaultKind.TRANSIENT;
    } else {
      kind = FaultKind.OTHER;
    }
    throw new VehicleServiceException(errorText(response), kind, status);
  }

  static String errorText(TransportResponse response) {
    String body = response.body();
    if (!body.isBlank()) {
      try {
        Object decoded = GSON.fromJson(body, Object.class);
        if (decoded instanceof Map<?, ?> map) {
          for (String key : List.of("error", "message", "error_description")) {
            if (map.get(key) instanceof String text && !text.isBlank()) {
              return text;
            }
          }
        }
      } catch (JsonSyntaxException e) {
        LOGGER.debug("Error response is not JSON", e);
      }
      return body.strip();
    }
    return "HTTP " + response.statusCode();
  }

  static ActionResult parseActionResult(Map<String, Object> payload, String responseText) {
    Object result = payload.get("result");
    if (result instanceof Boolean accepted) {
      return accepted ? ActionResult.SUCCESS : ActionResult.FAILURE;
    }
    if (result instanceof String text && DISABLED_RESULT.equalsIgnoreCase(text.strip())) {
      return ActionResult.DISABLED;
    }
    throw new VehicleResponseException("Unrecognized action result: " + result, responseText);
  }

  static Map<String, Object> parseResponsePayload(String text) {
    try {
      Object decoded = GSON.fromJson(text, Object.class);
      if (!(decoded instanceof Map)) {
        throw new VehicleResponseException("Response is not a JSON object", text);
      }
      @SuppressWarnings("unchecked")
      Map<String, Object> result = (Map<String, Object>) decoded;
      return result;
    } catch (JsonSyntaxException e) {
      throw new VehicleResponseException("Invalid JSON in response", text, e);
    }
  }

  private static String stripTrailingSlashes(String url) {
    while (url.endsWith("/")) {
      url = url.substring(0, url.length() - 1);
    }
    return url;
  }

  /** Builder for {@link RestVehicleServiceClient}. */
  public static final class Builder {

    private final String baseUrl;
    private @Nullable VehicleTransport transport;
    private @Nullable Duration timeout = DEFAULT_TIMEOUT;
    private @Nullable String securityPin;
    private int apiLevel;

    /**
     * Creates a builder.
     *
     * @param baseUrl the base URL of the vehicle service REST API
     */
    public Builder(String baseUrl) {
      this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl");
    }

    /** Sets the transport implementation. Required before calling {@link #build()}. */
    public Builder transport(VehicleTransport transport) {
      this.transport = Objects.requireNonNull(transport, "transport");
      return this;
    }

    /** Sets the request timeout. Defaults to 30 seconds. Pass {@code null} for no timeout. */
    public Builder timeout(@Nullable Duration timeout) {
      this.timeout = timeout;
      return this;
    }

    /** Sets the security PIN sent with PIN-protected actions. */
    public Builder securityPin(@Nullable String securityPin) {
      this.securityPin = securityPin;
      return this;
    }

    /** Sets the vehicle API level (0 or 1). Defaults to 0. */
    public Builder apiLevel(int apiLevel) {
      if (apiLevel != 0 && apiLevel != 1) {
        throw new IllegalArgumentException("apiLevel must be 0 or 1");
      }
      this.apiLevel = apiLevel;
      return this;
    }

    /**
     * Builds the client.
     *
     * @return the configured client
     * @throws NullPointerException if transport has not been set
     */
    public RestVehicleServiceClient build() {
      Objects.requireNonNull(transport, "transport");
      return new RestVehicleServiceClient(this);
    }
  }
}
