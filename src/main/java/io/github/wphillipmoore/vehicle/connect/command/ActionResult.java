package io.github.wphillipmoore.vehicle.connect.command;

/**
 * Raw result signal of a vehicle action call.
 *
 * <p>{@link #DISABLED} is not an error: the service reports that the action is blocked by policy
 * for this vehicle.
 */
public enum ActionResult {

  /** The service accepted the action. */
  SUCCESS,

  /** The service rejected the action. */
  FAILURE,

  /** The action is disabled for this vehicle. */
  DISABLED
}
