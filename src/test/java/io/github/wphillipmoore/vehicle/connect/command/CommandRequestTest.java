package io.github.wphillipmoore.vehicle.connect.command;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CommandRequestTest {

  @Test
  void pinRequirementDefaultsFromAction() {
    assertThat(new CommandRequest("VIN", VehicleAction.LOCK).requiresPin()).isTrue();
    assertThat(new CommandRequest("VIN", VehicleAction.CLIMATE_STOP).requiresPin()).isFalse();
  }

  @Test
  void parametersAreDefensivelyCopied() {
    Map<String, Object> parameters = new HashMap<>();
    parameters.put(CommandRequest.TARGET_SOC, 80);

    CommandRequest request =
        new CommandRequest("VIN", VehicleAction.SET_CHARGE_TARGET, parameters);
    parameters.put(CommandRequest.TARGET_SOC, 10);

    assertThat(request.parameters()).containsEntry("target_soc", 80);
    assertThatThrownBy(() -> request.parameters().put("x", 1))
        .isInstanceOf(UnsupportedOperationException.class);
  }

  @Test
  void nullVinRejected() {
    assertThatThrownBy(() -> new CommandRequest(null, VehicleAction.LOCK))
        .isInstanceOf(NullPointerException.class)
        .hasMessage("vin");
  }

  @Test
  void nullParametersRejected() {
    assertThatThrownBy(() -> new CommandRequest("VIN", VehicleAction.LOCK, null, true))
        .isInstanceOf(NullPointerException.class)
        .hasMessage("parameters");
  }
}
