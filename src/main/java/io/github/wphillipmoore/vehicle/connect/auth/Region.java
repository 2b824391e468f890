package io.github.wphillipmoore.vehicle.connect.auth;

import java.util.Locale;
import java.util.Objects;

/** Vehicle cloud regions, identified by the country code the account was registered in. */
public enum Region {

  /** Europe, served from Germany. */
  DE,

  /** United States. */
  US,

  /** Canada. */
  CA,

  /** China. */
  CN;

  /**
   * Looks up a region by its country code, ignoring case.
   *
   * @param code the country code, e.g. {@code "de"}
   * @return the matching region
   * @throws IllegalArgumentException if the code is not a supported region
   */
  public static Region fromCode(String code) {
    Objects.requireNonNull(code, "code");
    for (Region region : values()) {
      if (region.name().equals(code.strip().toUpperCase(Locale.ROOT))) {
        return region;
      }
    }
    throw new IllegalArgumentException(
        "Unsupported country code '" + code + "' (expected one of DE, US, CA, CN)");
  }
}
