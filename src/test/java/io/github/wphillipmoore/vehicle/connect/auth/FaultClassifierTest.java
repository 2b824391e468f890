package io.github.wphillipmoore.vehicle.connect.auth;

import static org.assertj.core.api.Assertions.assertThat;

import io.github.wphillipmoore.vehicle.connect.exception.FaultKind;
import io.github.wphillipmoore.vehicle.connect.exception.VehicleServiceException;
import io.github.wphillipmoore.vehicle.connect.exception.VehicleTransportException;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class FaultClassifierTest {

  @Nested
  class Throttling {

    @ParameterizedTest
    @ValueSource(
        strings = {
          "throttled",
          "Account Throttled",
          "redirect: https://login/?error=login.error.throttled&x=1",
          "ERROR=LOGIN.ERROR.THROTTLED",
          "bad password, also throttled"
        })
    void markerAnywhereInMessageMeansThrottling(String message) {
      assertThat(FaultClassifier.isThrottling(new RuntimeException(message))).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {"Connection reset", "401 Unauthorized", "throttle", ""})
    void messagesWithoutMarkerAreNotThrottling(String message) {
      assertThat(FaultClassifier.isThrottling(new RuntimeException(message))).isFalse();
    }

    @Test
    void nullMessageIsNotThrottling() {
      assertThat(FaultClassifier.isThrottling(new RuntimeException())).isFalse();
    }

    @Test
    void structuredKindOverridesMessage() {
      assertThat(
              FaultClassifier.isThrottling(
                  new VehicleServiceException("throttled", FaultKind.TRANSIENT, 503)))
          .isFalse();
      assertThat(
              FaultClassifier.isThrottling(
                  new VehicleServiceException("slow down", FaultKind.THROTTLED, 429)))
          .isTrue();
      assertThat(
              FaultClassifier.isThrottling(
                  new VehicleServiceException("throttled", FaultKind.OTHER, 400)))
          .isFalse();
    }

    @Test
    void unclassifiedKindFallsBackToMarker() {
      assertThat(
              FaultClassifier.isThrottling(
                  new VehicleServiceException(
                      "error=login.error.throttled", FaultKind.UNCLASSIFIED, 401)))
          .isTrue();
      assertThat(
              FaultClassifier.isThrottling(
                  new VehicleServiceException("Unauthorized", FaultKind.UNCLASSIFIED, 401)))
          .isFalse();
    }
  }

  @Nested
  class Cancellation {

    @Test
    void detectsInterruptedExceptionInCauseChain() {
      RuntimeException fault =
          new RuntimeException(
              "outer",
              new VehicleTransportException(
                  "HTTP request interrupted", "https://host", new InterruptedException()));

      assertThat(FaultClassifier.isCancellation(fault)).isTrue();
    }

    @Test
    void ordinaryFaultIsNotCancellation() {
      assertThat(FaultClassifier.isCancellation(new RuntimeException("boom"))).isFalse();
    }
  }

  @Test
  void messageOfFallsBackToTypeName() {
    assertThat(FaultClassifier.messageOf(new IllegalStateException()))
        .isEqualTo("IllegalStateException");
    assertThat(FaultClassifier.messageOf(new IllegalStateException("boom"))).isEqualTo("boom");
  }
}
