package io.github.wphillipmoore.vehicle.connect.command;

import java.util.LinkedHashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Settings for starting climate control.
 *
 * @param temperatureC target temperature in degrees Celsius, or null to let the vehicle decide
 * @param temperatureF target temperature in degrees Fahrenheit, or null
 * @param glassHeating whether to heat the windscreen and rear window
 * @param seatFrontLeft front left seat heating
 * @param seatFrontRight front right seat heating
 * @param seatRearLeft rear left seat heating
 * @param seatRearRight rear right seat heating
 * @param climatisationAtUnlock whether climate control starts when the vehicle is unlocked
 */
public record ClimateSettings(
    @Nullable Integer temperatureC,
    @Nullable Integer temperatureF,
    boolean glassHeating,
    boolean seatFrontLeft,
    boolean seatFrontRight,
    boolean seatRearLeft,
    boolean seatRearRight,
    boolean climatisationAtUnlock) {

  /** Default target temperature in degrees Celsius (21). */
  public static final int DEFAULT_TEMPERATURE_C = 21;

  /** Creates settings at the default temperature with every heater off. */
  public ClimateSettings() {
    this(DEFAULT_TEMPERATURE_C, null, false, false, false, false, false, false);
  }

  Map<String, Object> toParameters() {
    Map<String, Object> parameters = new LinkedHashMap<>();
    if (temperatureC != null) {
      parameters.put(CommandRequest.TEMPERATURE_C, temperatureC);
    }
    if (temperatureF != null) {
      parameters.put(CommandRequest.TEMPERATURE_F, temperatureF);
    }
    parameters.put("glass_heating", glassHeating);
    parameters.put("seat_front_left", seatFrontLeft);
    parameters.put("seat_front_right", seatFrontRight);
    parameters.put("seat_rear_left", seatRearLeft);
    parameters.put("seat_rear_right", seatRearRight);
    parameters.put("climatisation_at_unlock", climatisationAtUnlock);
    return parameters;
  }
}
