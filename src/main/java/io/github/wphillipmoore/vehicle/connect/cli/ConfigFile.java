package io.github.wphillipmoore.vehicle.connect.cli;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import io.github.wphillipmoore.vehicle.connect.exception.ConfigurationException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Persisted default settings, read from a JSON object file.
 *
 * <p>A missing file yields empty defaults. An unreadable or malformed file is logged and also
 * yields empty defaults, so explicit command-line values still work.
 */
public final class ConfigFile {

  private static final Logger LOGGER = LoggerFactory.getLogger(ConfigFile.class);
  private static final Gson GSON = new Gson();

  /** Default config file name, resolved against the working directory. */
  public static final String DEFAULT_PATH = "config.json";

  static final String USERNAME = "username";
  static final String PASSWORD = "password";
  static final String COUNTRY = "country";
  static final String SPIN = "spin";
  static final String API_LEVEL = "api_level";
  static final String BASE_URL = "base_url";
  static final String MAX_ATTEMPTS = "max_attempts";
  static final String RETRY_DELAY_SECONDS = "retry_delay_seconds";

  private final Map<String, Object> values;

  ConfigFile(Map<String, Object> values) {
    this.values = Map.copyOf(Objects.requireNonNull(values, "values"));
  }

  /** Returns a config with no values. */
  public static ConfigFile empty() {
    return new ConfigFile(Map.of());
  }

  /**
   * Loads a config file.
   *
   * @param path the file to read
   * @return the loaded config, or an empty one if the file is missing or unusable
   */
  public static ConfigFile load(Path path) {
    Objects.requireNonNull(path, "path");
    if (!Files.exists(path)) {
      LOGGER.debug("Config file {} not found, using command-line values only", path);
      return empty();
    }
    try {
      return parse(Files.readString(path, StandardCharsets.UTF_8));
    } catch (IOException | JsonParseException | ConfigurationException e) {
      LOGGER.warn("Failed to load config file {}: {}", path, e.getMessage());
      return empty();
    }
  }

  static ConfigFile parse(String json) {
    Object decoded = GSON.fromJson(json, Object.class);
    if (!(decoded instanceof Map<?, ?> map)) {
      throw new ConfigurationException("Config file is not a JSON object");
    }
    Map<String, Object> values = new LinkedHashMap<>();
    map.forEach(
        (key, value) -> {
          if (value != null) {
            values.put(String.valueOf(key), value);
          }
        });
    return new ConfigFile(values);
  }

  /** Returns a string value, or {@code null} if absent or blank. */
  public @Nullable String getString(String key) {
    Object value = values.get(key);
    if (value == null) {
      return null;
    }
    if (value instanceof Number number && number.doubleValue() == Math.rint(number.doubleValue())) {
      return Long.toString(number.longValue());
    }
    String text = String.valueOf(value).strip();
    return text.isEmpty() ? null : text;
  }

  /**
   * Returns an integer value, or {@code null} if absent.
   *
   * @throws ConfigurationException if the value is not a whole number
   */
  public @Nullable Integer getInt(String key) {
    Object value = values.get(key);
    if (value == null) {
      return null;
    }
    if (value instanceof Number number) {
      double d = number.doubleValue();
      if (d == Math.rint(d) && Math.abs(d) <= Integer.MAX_VALUE) {
        return (int) d;
      }
    }
    if (value instanceof String text) {
      try {
        return Integer.valueOf(text.strip());
      } catch (NumberFormatException e) {
        throw new ConfigurationException("Config value " + key + " is not an integer: " + text, e);
      }
    }
    throw new ConfigurationException("Config value " + key + " is not an integer: " + value);
  }
}
