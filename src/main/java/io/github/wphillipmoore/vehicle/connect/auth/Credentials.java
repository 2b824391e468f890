package io.github.wphillipmoore.vehicle.connect.auth;

import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Resolved account credentials for the vehicle cloud.
 *
 * <p>The security PIN is only needed for physically consequential actions (lock, unlock and the
 * pre-heater).
 * {@link #toString()} masks the secret and the PIN.
 *
 * @param identity the account identity (e-mail address), never null
 * @param secret the account password, never null
 * @param region the account region, never null
 * @param securityPin the S-PIN, or null if not configured
 * @param apiLevel the vehicle API level, 0 or 1
 */
public record Credentials(
    String identity, String secret, Region region, @Nullable String securityPin, int apiLevel) {

  /** Validates required fields and the API level. A blank PIN is treated as absent. */
  public Credentials {
    Objects.requireNonNull(identity, "identity");
    Objects.requireNonNull(secret, "secret");
    Objects.requireNonNull(region, "region");
    if (apiLevel != 0 && apiLevel != 1) {
      throw new IllegalArgumentException("apiLevel must be 0 or 1");
    }
    if (securityPin != null && securityPin.isBlank()) {
      securityPin = null;
    }
  }

  /** Creates credentials without a security PIN at API level 0. */
  public Credentials(String identity, String secret, Region region) {
    this(identity, secret, region, null, 0);
  }

  /** Returns whether a security PIN is configured. */
  public boolean hasSecurityPin() {
    return securityPin != null;
  }

  @Override
  public String toString() {
    return "Credentials[identity="
        + identity
        + ", secret=****, region="
        + region
        + ", securityPin="
        + (securityPin != null ? "****" : "none")
        + ", apiLevel="
        + apiLevel
        + "]";
  }
}
