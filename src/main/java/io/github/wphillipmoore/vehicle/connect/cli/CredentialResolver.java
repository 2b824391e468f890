package io.github.wphillipmoore.vehicle.connect.cli;

import io.github.wphillipmoore.vehicle.connect.auth.Credentials;
import io.github.wphillipmoore.vehicle.connect.auth.Region;
import io.github.wphillipmoore.vehicle.connect.auth.RetryLogging;
import io.github.wphillipmoore.vehicle.connect.auth.RetryPolicy;
import io.github.wphillipmoore.vehicle.connect.exception.ConfigurationException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/** Merges explicit invocation values over the config file. An explicit value always wins. */
public final class CredentialResolver {

  private CredentialResolver() {}

  /**
   * Values given on the command line. Any of them may be {@code null}.
   *
   * @param username account identity
   * @param password account password
   * @param country account country code
   * @param spin security PIN
   * @param apiLevel API level
   * @param baseUrl vehicle service base URL
   * @param maxAttempts maximum login attempts
   * @param retryDelaySeconds pause between login attempts
   * @param retryLogging how non-final login failures are logged
   */
  public record Explicit(
      @Nullable String username,
      @Nullable String password,
      @Nullable String country,
      @Nullable String spin,
      @Nullable Integer apiLevel,
      @Nullable String baseUrl,
      @Nullable Integer maxAttempts,
      @Nullable Integer retryDelaySeconds,
      @Nullable RetryLogging retryLogging) {}

  /**
   * Resolves the settings for one invocation.
   *
   * @param explicit the command-line values
   * @param config the config file defaults
   * @return the resolved settings
   * @throws ConfigurationException if a required value is missing or invalid
   */
  public static InvocationSettings resolve(Explicit explicit, ConfigFile config) {
    Objects.requireNonNull(explicit, "explicit");
    Objects.requireNonNull(config, "config");

    String username = pick(explicit.username(), config.getString(ConfigFile.USERNAME));
    String password = pick(explicit.password(), config.getString(ConfigFile.PASSWORD));
    String country = pick(explicit.country(), config.getString(ConfigFile.COUNTRY));
    String baseUrl = pick(explicit.baseUrl(), config.getString(ConfigFile.BASE_URL));
    String spin = pick(explicit.spin(), config.getString(ConfigFile.SPIN));
    Integer apiLevel = pick(explicit.apiLevel(), config.getInt(ConfigFile.API_LEVEL));
    Integer maxAttempts = pick(explicit.maxAttempts(), config.getInt(ConfigFile.MAX_ATTEMPTS));
    Integer retryDelay =
        pick(explicit.retryDelaySeconds(), config.getInt(ConfigFile.RETRY_DELAY_SECONDS));

    List<String> missing = new ArrayList<>();
    if (username == null) {
      missing.add(ConfigFile.USERNAME);
    }
    if (password == null) {
      missing.add(ConfigFile.PASSWORD);
    }
    if (country == null) {
      missing.add(ConfigFile.COUNTRY);
    }
    if (baseUrl == null) {
      missing.add(ConfigFile.BASE_URL);
    }
    if (!missing.isEmpty()) {
      throw new ConfigurationException(
          "Missing required settings: "
              + String.join(", ", missing)
              + ". Provide them on the command line or in the config file.");
    }

    try {
      Credentials credentials =
          new Credentials(
              username,
              password,
              Region.fromCode(country),
              spin,
              apiLevel != null ? apiLevel : 0);
      RetryPolicy retryPolicy =
          new RetryPolicy(
              maxAttempts != null ? maxAttempts : RetryPolicy.DEFAULT_MAX_ATTEMPTS,
              retryDelay != null ? Duration.ofSeconds(retryDelay) : RetryPolicy.DEFAULT_RETRY_DELAY,
              explicit.retryLogging() != null
                  ? explicit.retryLogging()
                  : RetryLogging.EVERY_ATTEMPT);
      return new InvocationSettings(credentials, baseUrl, retryPolicy);
    } catch (IllegalArgumentException e) {
      throw new ConfigurationException(e.getMessage(), e);
    }
  }

  private static @Nullable String pick(@Nullable String explicit, @Nullable String fallback) {
    return explicit != null && !explicit.isBlank() ? explicit.strip() : fallback;
  }

  private static @Nullable Integer pick(@Nullable Integer explicit, @Nullable Integer fallback) {
    return explicit != null ? explicit : fallback;
  }
}
