package io.github.wphillipmoore.vehicle.connect.cli;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.github.wphillipmoore.vehicle.connect.auth.Region;
import io.github.wphillipmoore.vehicle.connect.auth.RetryLogging;
import io.github.wphillipmoore.vehicle.connect.auth.RetryPolicy;
import io.github.wphillipmoore.vehicle.connect.exception.ConfigurationException;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CredentialResolverTest {

  private static final ConfigFile FULL_CONFIG =
      new ConfigFile(
          Map.of(
              "username", "config@example.com",
              "password", "config-secret",
              "country", "us",
              "spin", "1111",
              "api_level", 1.0,
              "base_url", "https://config-gateway",
              "max_attempts", 5.0,
              "retry_delay_seconds", 1.0));

  private static CredentialResolver.Explicit none() {
    return new CredentialResolver.Explicit(null, null, null, null, null, null, null, null, null);
  }

  @Test
  void configValuesUsedWhenNothingExplicit() {
    InvocationSettings settings = CredentialResolver.resolve(none(), FULL_CONFIG);

    assertThat(settings.credentials().identity()).isEqualTo("config@example.com");
    assertThat(settings.credentials().secret()).isEqualTo("config-secret");
    assertThat(settings.credentials().region()).isEqualTo(Region.US);
    assertThat(settings.credentials().securityPin()).isEqualTo("1111");
    assertThat(settings.credentials().apiLevel()).isEqualTo(1);
    assertThat(settings.baseUrl()).isEqualTo("https://config-gateway");
    assertThat(settings.retryPolicy())
        .isEqualTo(new RetryPolicy(5, Duration.ofSeconds(1), RetryLogging.EVERY_ATTEMPT));
  }

  @Test
  void explicitValuesWin() {
    CredentialResolver.Explicit explicit =
        new CredentialResolver.Explicit(
            "cli@example.com",
            "cli-secret",
            "DE",
            "2222",
            0,
            "https://cli-gateway",
            2,
            0,
            RetryLogging.FINAL_ONLY);

    InvocationSettings settings = CredentialResolver.resolve(explicit, FULL_CONFIG);

    assertThat(settings.credentials().identity()).isEqualTo("cli@example.com");
    assertThat(settings.credentials().secret()).isEqualTo("cli-secret");
    assertThat(settings.credentials().region()).isEqualTo(Region.DE);
    assertThat(settings.credentials().securityPin()).isEqualTo("2222");
    assertThat(settings.credentials().apiLevel()).isZero();
    assertThat(settings.baseUrl()).isEqualTo("https://cli-gateway");
    assertThat(settings.retryPolicy())
        .isEqualTo(new RetryPolicy(2, Duration.ZERO, RetryLogging.FINAL_ONLY));
  }

  @Test
  void blankExplicitValueFallsBackToConfig() {
    CredentialResolver.Explicit explicit =
        new CredentialResolver.Explicit(" ", null, null, null, null, null, null, null, null);

    assertThat(CredentialResolver.resolve(explicit, FULL_CONFIG).credentials().identity())
        .isEqualTo("config@example.com");
  }

  @Test
  void defaultsApplyWhenRetrySettingsAbsent() {
    CredentialResolver.Explicit explicit =
        new CredentialResolver.Explicit(
            "cli@example.com", "pw", "CN", null, null, "https://gw", null, null, null);

    InvocationSettings settings = CredentialResolver.resolve(explicit, ConfigFile.empty());

    assertThat(settings.retryPolicy()).isEqualTo(new RetryPolicy());
    assertThat(settings.credentials().apiLevel()).isZero();
    assertThat(settings.credentials().hasSecurityPin()).isFalse();
  }

  @Test
  void missingRequiredSettingsListed() {
    assertThatThrownBy(() -> CredentialResolver.resolve(none(), ConfigFile.empty()))
        .isInstanceOf(ConfigurationException.class)
        .hasMessage(
            "Missing required settings: username, password, country, base_url. Provide them on"
                + " the command line or in the config file.");
  }

  @Test
  void unsupportedCountryReportedAsConfigurationError() {
    CredentialResolver.Explicit explicit =
        new CredentialResolver.Explicit(
            "cli@example.com", "pw", "FR", null, null, "https://gw", null, null, null);

    assertThatThrownBy(() -> CredentialResolver.resolve(explicit, ConfigFile.empty()))
        .isInstanceOf(ConfigurationException.class)
        .hasMessageContaining("Unsupported country code 'FR'")
        .hasCauseInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void zeroMaxAttemptsReportedAsConfigurationError() {
    CredentialResolver.Explicit explicit =
        new CredentialResolver.Explicit(
            "cli@example.com", "pw", "DE", null, null, "https://gw", 0, null, null);

    assertThatThrownBy(() -> CredentialResolver.resolve(explicit, ConfigFile.empty()))
        .isInstanceOf(ConfigurationException.class)
        .hasMessage("maxAttempts must be >= 1");
  }
}
