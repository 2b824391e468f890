package io.github.wphillipmoore.vehicle.connect.auth;

import io.github.wphillipmoore.vehicle.connect.exception.FaultKind;
import io.github.wphillipmoore.vehicle.connect.exception.VehicleServiceException;
import java.util.List;
import java.util.Locale;
import org.jspecify.annotations.Nullable;

/**
 * Classifies login faults.
 *
 * <p>A {@link VehicleServiceException} with a structured {@link FaultKind} is taken at its word.
 * Anything else falls back to matching known throttling markers in the fault message. The marker
 * match depends on the service's error text and will need revisiting if that text changes.
 */
final class FaultClassifier {

  /** Lower-case substrings that mark a throttling fault message. */
  static final List<String> THROTTLE_MARKERS = List.of("error=login.error.throttled", "throttled");

  private FaultClassifier() {}

  static boolean isThrottling(Throwable fault) {
    if (fault instanceof VehicleServiceException serviceFault
        && serviceFault.getKind() != FaultKind.UNCLASSIFIED) {
      return serviceFault.getKind() == FaultKind.THROTTLED;
    }
    return hasThrottleMarker(fault.getMessage());
  }

  static boolean hasThrottleMarker(@Nullable String message) {
    if (message == null) {
      return false;
    }
    String lower = message.toLowerCase(Locale.ROOT);
    for (String marker : THROTTLE_MARKERS) {
      if (lower.contains(marker)) {
        return true;
      }
    }
    return false;
  }

  static boolean isCancellation(Throwable fault) {
    for (Throwable current = fault; current != null; current = current.getCause()) {
      if (current instanceof InterruptedException) {
        return true;
      }
      if (current.getCause() == current) {
        break;
      }
    }
    return false;
  }

  static String messageOf(Throwable fault) {
    String message = fault.getMessage();
    return message != null ? message : fault.getClass().getSimpleName();
  }
}
