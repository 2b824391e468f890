package io.github.wphillipmoore.vehicle.connect;

/** Blocks of vehicle data that can be queried. */
public enum VehicleDataKind {

  /** Current vehicle status: mileage, range, charge, doors, position. */
  STATUS("status"),

  /** Short-term and long-term trip statistics. */
  TRIPS("trips");

  private final String path;

  VehicleDataKind(String path) {
    this.path = path;
  }

  /** Returns the URL path segment for this data block. */
  public String path() {
    return path;
  }
}
