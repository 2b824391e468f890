package io.github.wphillipmoore.vehicle.connect.cli;

import io.github.wphillipmoore.vehicle.connect.auth.Credentials;
import io.github.wphillipmoore.vehicle.connect.auth.RetryPolicy;
import java.util.Objects;

/**
 * Everything one invocation needs, after merging command-line values over the config file.
 *
 * @param credentials the resolved account credentials
 * @param baseUrl the vehicle service base URL
 * @param retryPolicy the login retry bounds
 */
public record InvocationSettings(Credentials credentials, String baseUrl, RetryPolicy retryPolicy) {

  /** Validates non-null fields. */
  public InvocationSettings {
    Objects.requireNonNull(credentials, "credentials");
    Objects.requireNonNull(baseUrl, "baseUrl");
    Objects.requireNonNull(retryPolicy, "retryPolicy");
  }
}
