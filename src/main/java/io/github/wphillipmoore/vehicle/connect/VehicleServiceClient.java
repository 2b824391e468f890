package io.github.wphillipmoore.vehicle.connect;

import io.github.wphillipmoore.vehicle.connect.auth.Region;
import io.github.wphillipmoore.vehicle.connect.command.ActionResult;
import io.github.wphillipmoore.vehicle.connect.command.VehicleAction;
import io.github.wphillipmoore.vehicle.connect.exception.FaultKind;
import io.github.wphillipmoore.vehicle.connect.exception.VehicleServiceException;
import java.util.List;
import java.util.Map;

/**
 * Client for the vehicle cloud service.
 *
 * <p>Implementations own the network transport, request signing and response parsing. Failures are
 * reported by throwing {@link VehicleServiceException} (with a {@link FaultKind} where the service
 * provides one) or any other {@link RuntimeException} whose message describes the fault. All calls
 * are synchronous.
 */
public interface VehicleServiceClient {

  /**
   * Performs a single login attempt.
   *
   * @param identity the account identity
   * @param secret the account password
   * @param region the account region
   * @return {@code true} if the service accepted the login
   */
  boolean attemptLogin(String identity, String secret, Region region);

  /**
   * Performs a vehicle action.
   *
   * @param vin the vehicle identifier
   * @param action the action to perform
   * @param parameters the validated action parameters
   * @return the raw result signal
   */
  ActionResult executeAction(String vin, VehicleAction action, Map<String, Object> parameters);

  /**
   * Lists the vehicles associated with the account.
   *
   * @return one raw attribute map per vehicle
   */
  List<Map<String, Object>> listVehicles();

  /**
   * Fetches a block of vehicle data.
   *
   * @param vin the vehicle identifier
   * @param kind which data to fetch
   * @return the raw attribute map
   */
  Map<String, Object> fetchVehicleData(String vin, VehicleDataKind kind);
}
