package io.github.wphillipmoore.vehicle.connect.command;

import io.github.wphillipmoore.vehicle.connect.auth.AuthSession;
import io.github.wphillipmoore.vehicle.connect.auth.Credentials;
import io.github.wphillipmoore.vehicle.connect.exception.PreconditionNotMetException;
import io.github.wphillipmoore.vehicle.connect.exception.ValidationFailedException;
import java.util.Objects;
import java.util.Set;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs every vehicle action through the same pipeline: precondition check, parameter validation,
 * dispatch, result classification.
 *
 * <p>Action-specific code only supplies the {@link CommandRequest} and a {@link Dispatch}. The gate
 * never retries and keeps no state between calls, so one gate can run any number of actions within
 * an authenticated session.
 */
public final class CommandGate {

  private static final Logger LOGGER = LoggerFactory.getLogger(CommandGate.class);

  static final int MIN_TARGET_SOC = 20;
  static final int MAX_TARGET_SOC = 100;
  static final Set<String> CHARGING_MODES = Set.of("manual", "timer");

  private final AuthSession session;

  /** Sends a validated request to the vehicle service. */
  @FunctionalInterface
  public interface Dispatch {

    /**
     * Performs the action.
     *
     * @param request the validated request
     * @return the raw result signal
     */
    ActionResult dispatch(CommandRequest request);
  }

  /**
   * Creates a gate that checks preconditions against the session's credentials.
   *
   * @param session the session whose credentials are consulted
   */
  public CommandGate(AuthSession session) {
    this.session = Objects.requireNonNull(session, "session");
  }

  /**
   * Executes a vehicle action.
   *
   * @param request the action request
   * @param dispatch the call that performs the action
   * @return the classified outcome
   * @throws PreconditionNotMetException if the action needs the S-PIN and none is configured
   * @throws ValidationFailedException if a parameter violates its constraint
   */
  public CommandOutcome execute(CommandRequest request, Dispatch dispatch) {
    Objects.requireNonNull(request, "request");
    Objects.requireNonNull(dispatch, "dispatch");

    checkPreconditions(request, session.getCredentials());
    validate(request);

    VehicleAction action = request.action();
    LOGGER.debug("Dispatching {} for {}", action.commandName(), request.vin());
    ActionResult result;
    try {
      result = dispatch.dispatch(request);
    } catch (RuntimeException e) {
      LOGGER.debug("{} raised a fault", action.commandName(), e);
      String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
      return new CommandOutcome.Failed(action, message, e);
    }
    return classify(action, result);
  }

  static CommandOutcome classify(VehicleAction action, @Nullable ActionResult result) {
    if (result == null) {
      return new CommandOutcome.Failed(action, "No result from the vehicle service", null);
    }
    switch (result) {
      case SUCCESS:
        return new CommandOutcome.Succeeded(action);
      case DISABLED:
        if (action.reportsDisabled()) {
          return new CommandOutcome.Disabled(action);
        }
        return new CommandOutcome.Failed(
            action, "Unexpected disabled result for " + action.commandName(), null);
      case FAILURE:
      default:
        return new CommandOutcome.Failed(action, "Rejected by the vehicle service", null);
    }
  }

  static void checkPreconditions(CommandRequest request, Credentials credentials) {
    if (request.requiresPin() && !credentials.hasSecurityPin()) {
      throw new PreconditionNotMetException("S-PIN", request.action().commandName());
    }
  }

  static void validate(CommandRequest request) {
    switch (request.action()) {
      case SET_CHARGE_TARGET:
        requireIntInRange(request, CommandRequest.TARGET_SOC, MIN_TARGET_SOC, MAX_TARGET_SOC, true);
        break;
      case SET_CHARGING_MODE:
        Object mode = request.parameters().get(CommandRequest.MODE);
        if (!(mode instanceof String s) || !CHARGING_MODES.contains(s)) {
          throw new ValidationFailedException(CommandRequest.MODE, "one of manual, timer", mode);
        }
        break;
      case PREHEATER_START:
        requireIntInRange(request, CommandRequest.DURATION, 1, Integer.MAX_VALUE, true);
        break;
      case CLIMATE_START:
        requireIntInRange(
            request, CommandRequest.TEMPERATURE_C, Integer.MIN_VALUE, Integer.MAX_VALUE, false);
        requireIntInRange(
            request, CommandRequest.TEMPERATURE_F, Integer.MIN_VALUE, Integer.MAX_VALUE, false);
        break;
      default:
        break;
    }
  }

  private static void requireIntInRange(
      CommandRequest request, String parameter, int min, int max, boolean required) {
    Object value = request.parameters().get(parameter);
    if (value == null && !required) {
      return;
    }
    String constraint;
    if (min == Integer.MIN_VALUE && max == Integer.MAX_VALUE) {
      constraint = "an integer";
    } else if (max == Integer.MAX_VALUE) {
      constraint = "an integer of at least " + min;
    } else {
      constraint = "an integer between " + min + " and " + max;
    }
    if (!(value instanceof Integer number) || number < min || number > max) {
      throw new ValidationFailedException(parameter, constraint, value);
    }
  }
}
