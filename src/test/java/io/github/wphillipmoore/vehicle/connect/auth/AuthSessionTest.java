package io.github.wphillipmoore.vehicle.connect.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.github.wphillipmoore.vehicle.connect.VehicleServiceClient;
import io.github.wphillipmoore.vehicle.connect.exception.ExhaustedRetriesException;
import io.github.wphillipmoore.vehicle.connect.exception.FaultKind;
import io.github.wphillipmoore.vehicle.connect.exception.LoginCancelledException;
import io.github.wphillipmoore.vehicle.connect.exception.ThrottledException;
import io.github.wphillipmoore.vehicle.connect.exception.TransientLoginException;
import io.github.wphillipmoore.vehicle.connect.exception.VehicleServiceException;
import io.github.wphillipmoore.vehicle.connect.exception.VehicleTransportException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class AuthSessionTest {

  private static final Credentials CREDENTIALS =
      new Credentials("user@example.com", "secret", Region.DE, "1234", 0);
  private static final Instant NOW = Instant.parse("2026-10-19T08:00:00Z");
  private static final Duration DELAY = Duration.ofSeconds(10);

  @Mock private VehicleServiceClient client;

  private FakeClock fakeClock;

  /** Fake clock that records sleeps instead of blocking. */
  static final class FakeClock implements AuthSession.Clock {
    final List<Duration> sleeps = new ArrayList<>();
    boolean interruptOnSleep;

    @Override
    public void sleep(Duration duration) throws InterruptedException {
      if (interruptOnSleep) {
        throw new InterruptedException("sleep interrupted");
      }
      sleeps.add(duration);
    }

    @Override
    public Instant now() {
      return NOW;
    }
  }

  @BeforeEach
  void setUp() {
    fakeClock = new FakeClock();
  }

  @AfterEach
  void clearInterruptFlag() {
    Thread.interrupted();
  }

  private AuthSession session(int maxAttempts) {
    AuthSession session =
        new AuthSession.Builder(CREDENTIALS, client)
            .maxAttempts(maxAttempts)
            .retryDelay(DELAY)
            .build();
    session.setClock(fakeClock);
    return session;
  }

  private static RuntimeException genericFault(int index) {
    return new RuntimeException("Login failed: connection reset (" + index + ")");
  }

  @Nested
  class Success {

    @ParameterizedTest
    @ValueSource(ints = {1, 2, 3, 7})
    void firstAttemptSuccessMakesExactlyOneCall(int maxAttempts) {
      when(client.attemptLogin("user@example.com", "secret", Region.DE)).thenReturn(true);
      AuthSession session = session(maxAttempts);

      LoginOutcome outcome = session.login();

      assertThat(outcome).isEqualTo(new LoginOutcome.Success(NOW, 1));
      assertThat(session.getState()).isEqualTo(AuthState.AUTHENTICATED);
      assertThat(session.isAuthenticated()).isTrue();
      assertThat(session.getAuthenticatedAt()).isEqualTo(NOW);
      assertThat(session.getAttemptsMade()).isEqualTo(1);
      assertThat(fakeClock.sleeps).isEmpty();
      verify(client, times(1)).attemptLogin(anyString(), anyString(), any());
    }

    @ParameterizedTest
    @ValueSource(ints = {2, 3, 5})
    void genericFaultsThenSuccessRetriesWithDelays(int maxAttempts) {
      AtomicInteger calls = new AtomicInteger();
      when(client.attemptLogin(anyString(), anyString(), any()))
          .thenAnswer(
              invocation -> {
                int call = calls.incrementAndGet();
                if (call < maxAttempts) {
                  throw genericFault(call);
                }
                return true;
              });
      AuthSession session = session(maxAttempts);

      LoginOutcome outcome = session.login();

      assertThat(outcome.isSuccess()).isTrue();
      assertThat(outcome.attempts()).isEqualTo(maxAttempts);
      assertThat(fakeClock.sleeps).hasSize(maxAttempts - 1).containsOnly(DELAY);
      verify(client, times(maxAttempts)).attemptLogin(anyString(), anyString(), any());
    }

    @Test
    void falseFlagIsRetriedLikeAFault() {
      when(client.attemptLogin(anyString(), anyString(), any())).thenReturn(false, true);
      AuthSession session = session(3);

      assertThat(session.login().isSuccess()).isTrue();
      assertThat(session.getAttemptsMade()).isEqualTo(2);
      assertThat(fakeClock.sleeps).containsExactly(DELAY);
    }

    @Test
    void requireSuccessReturnsNormally() {
      when(client.attemptLogin(anyString(), anyString(), any())).thenReturn(true);

      session(3).login().requireSuccess();
    }
  }

  @Nested
  class Throttling {

    @ParameterizedTest
    @ValueSource(ints = {1, 2, 3, 10})
    void throttledFaultStopsAfterOneAttempt(int maxAttempts) {
      when(client.attemptLogin(anyString(), anyString(), any()))
          .thenThrow(new RuntimeException("Login failed: error=login.error.throttled"));
      AuthSession session = session(maxAttempts);

      LoginOutcome outcome = session.login();

      assertThat(outcome)
          .isEqualTo(new LoginOutcome.Throttled("Login failed: error=login.error.throttled", 1));
      assertThat(session.getState()).isEqualTo(AuthState.THROTTLED);
      assertThat(session.getAuthenticatedAt()).isNull();
      assertThat(fakeClock.sleeps).isEmpty();
      verify(client, times(1)).attemptLogin(anyString(), anyString(), any());
    }

    @Test
    void throttlingMarkerIsCaseInsensitive() {
      when(client.attemptLogin(anyString(), anyString(), any()))
          .thenThrow(new IllegalStateException("Account THROTTLED by server"));

      assertThat(session(3).login()).isInstanceOf(LoginOutcome.Throttled.class);
    }

    @Test
    void throttlingWinsOverOtherErrorTextInSameMessage() {
      when(client.attemptLogin(anyString(), anyString(), any()))
          .thenThrow(
              new RuntimeException(
                  "Invalid credentials; redirect to /signin?error=login.error.throttled"));

      assertThat(session(3).login()).isInstanceOf(LoginOutcome.Throttled.class);
      verify(client, times(1)).attemptLogin(anyString(), anyString(), any());
    }

    @Test
    void throttlingAfterTransientFaultsStopsImmediately() {
      when(client.attemptLogin(anyString(), anyString(), any()))
          .thenThrow(genericFault(1))
          .thenThrow(new RuntimeException("throttled"))
          .thenReturn(true);
      AuthSession session = session(5);

      LoginOutcome outcome = session.login();

      assertThat(outcome).isEqualTo(new LoginOutcome.Throttled("throttled", 2));
      assertThat(fakeClock.sleeps).hasSize(1);
      verify(client, times(2)).attemptLogin(anyString(), anyString(), any());
    }

    @Test
    void structuredThrottledKindIsTrustedWithoutMarker() {
      when(client.attemptLogin(anyString(), anyString(), any()))
          .thenThrow(new VehicleServiceException("Too many requests", FaultKind.THROTTLED, 429));

      assertThat(session(3).login()).isEqualTo(new LoginOutcome.Throttled("Too many requests", 1));
    }

    @Test
    void structuredTransientKindOverridesMarkerText() {
      when(client.attemptLogin(anyString(), anyString(), any()))
          .thenThrow(
              new VehicleServiceException("upstream throttled briefly", FaultKind.TRANSIENT, 503))
          .thenReturn(true);

      assertThat(session(3).login().isSuccess()).isTrue();
    }

    @Test
    void sessionNeverAuthenticatesAfterThrottling() {
      when(client.attemptLogin(anyString(), anyString(), any()))
          .thenThrow(new RuntimeException("throttled"));
      AuthSession session = session(3);

      LoginOutcome first = session.login();
      LoginOutcome second = session.login();

      assertThat(second).isSameAs(first);
      assertThat(session.getState()).isEqualTo(AuthState.THROTTLED);
      verify(client, times(1)).attemptLogin(anyString(), anyString(), any());
    }

    @Test
    void requireSuccessThrowsThrottledException() {
      when(client.attemptLogin(anyString(), anyString(), any()))
          .thenThrow(new RuntimeException("error=login.error.throttled"));

      assertThatThrownBy(() -> session(3).login().requireSuccess())
          .isInstanceOf(ThrottledException.class)
          .hasMessageContaining("wait before trying again");
    }
  }

  @Nested
  class Exhaustion {

    @ParameterizedTest
    @ValueSource(ints = {1, 2, 4})
    void consecutiveGenericFaultsExhaustAllAttempts(int maxAttempts) {
      AtomicInteger calls = new AtomicInteger();
      when(client.attemptLogin(anyString(), anyString(), any()))
          .thenAnswer(
              invocation -> {
                throw genericFault(calls.incrementAndGet());
              });
      AuthSession session = session(maxAttempts);

      LoginOutcome outcome = session.login();

      assertThat(outcome).isInstanceOf(LoginOutcome.Exhausted.class);
      LoginOutcome.Exhausted exhausted = (LoginOutcome.Exhausted) outcome;
      assertThat(exhausted.attempts()).isEqualTo(maxAttempts);
      assertThat(exhausted.lastError()).hasMessageEndingWith("(" + maxAttempts + ")");
      assertThat(session.getState()).isEqualTo(AuthState.FAILED);
      assertThat(session.getAttemptsMade()).isEqualTo(maxAttempts);
      assertThat(fakeClock.sleeps).hasSize(maxAttempts - 1);
      verify(client, times(maxAttempts)).attemptLogin(anyString(), anyString(), any());
    }

    @Test
    void singleAttemptNeverSleeps() {
      when(client.attemptLogin(anyString(), anyString(), any())).thenThrow(genericFault(1));
      AuthSession session = session(1);

      assertThat(session.login()).isInstanceOf(LoginOutcome.Exhausted.class);
      assertThat(fakeClock.sleeps).isEmpty();
    }

    @Test
    void falseFlagOnLastAttemptRecordsTransientLoginError() {
      when(client.attemptLogin(anyString(), anyString(), any())).thenReturn(false);

      LoginOutcome outcome = session(2).login();

      assertThat(((LoginOutcome.Exhausted) outcome).lastError())
          .isInstanceOf(TransientLoginException.class);
    }

    @Test
    void repeatedLoginDoesNotRetryAgain() {
      when(client.attemptLogin(anyString(), anyString(), any())).thenReturn(false);
      AuthSession session = session(2);

      session.login();
      session.login();

      verify(client, times(2)).attemptLogin(anyString(), anyString(), any());
    }

    @Test
    void requireSuccessThrowsExhaustedWithLastCause() {
      RuntimeException last = new RuntimeException("bad password");
      when(client.attemptLogin(anyString(), anyString(), any()))
          .thenThrow(genericFault(1))
          .thenThrow(last);

      assertThatThrownBy(() -> session(2).login().requireSuccess())
          .isInstanceOf(ExhaustedRetriesException.class)
          .hasCause(last)
          .hasMessageContaining("terms and conditions");
    }
  }

  @Nested
  class Cancellation {

    @Test
    void interruptBeforeFirstAttemptMakesNoCall() {
      AuthSession session = session(3);
      Thread.currentThread().interrupt();

      assertThatThrownBy(session::login).isInstanceOf(LoginCancelledException.class);
      assertThat(Thread.currentThread().isInterrupted()).isTrue();
      verifyNoInteractions(client);
    }

    @Test
    void interruptDuringDelayStopsRetrying() {
      when(client.attemptLogin(anyString(), anyString(), any())).thenThrow(genericFault(1));
      fakeClock.interruptOnSleep = true;
      AuthSession session = session(3);

      assertThatThrownBy(session::login)
          .isInstanceOf(LoginCancelledException.class)
          .hasCauseInstanceOf(InterruptedException.class);
      assertThat(Thread.currentThread().isInterrupted()).isTrue();
      assertThat(session.getState()).isEqualTo(AuthState.FAILED);
      verify(client, times(1)).attemptLogin(anyString(), anyString(), any());
    }

    @Test
    void interruptedTransportCallIsNotTreatedAsGenericFault() {
      when(client.attemptLogin(anyString(), anyString(), any()))
          .thenThrow(
              new VehicleTransportException(
                  "HTTP request interrupted",
                  "https://host/login",
                  new InterruptedException()));
      AuthSession session = session(3);

      assertThatThrownBy(session::login).isInstanceOf(LoginCancelledException.class);
      assertThat(fakeClock.sleeps).isEmpty();
      verify(client, times(1)).attemptLogin(anyString(), anyString(), any());
    }

    @Test
    void interruptRaisedInsideAttemptIsCheckedBeforeSleeping() {
      when(client.attemptLogin(anyString(), anyString(), any()))
          .thenAnswer(
              invocation -> {
                Thread.currentThread().interrupt();
                return false;
              });
      AuthSession session = session(3);

      assertThatThrownBy(session::login).isInstanceOf(LoginCancelledException.class);
      assertThat(fakeClock.sleeps).isEmpty();
    }
  }

  @Nested
  class Configuration {

    @Test
    void defaultsComeFromRetryPolicy() {
      AuthSession session = new AuthSession.Builder(CREDENTIALS, client).build();

      assertThat(session.getRetryPolicy()).isEqualTo(new RetryPolicy());
      assertThat(session.getState()).isEqualTo(AuthState.IDLE);
      assertThat(session.getAttemptsMade()).isZero();
      assertThat(session.getCredentials()).isSameAs(CREDENTIALS);
    }

    @Test
    void retryPolicyIsCopiedByBuilder() {
      RetryPolicy policy = new RetryPolicy(5, Duration.ofSeconds(2), RetryLogging.FINAL_ONLY);

      AuthSession session =
          new AuthSession.Builder(CREDENTIALS, client).retryPolicy(policy).build();

      assertThat(session.getRetryPolicy()).isEqualTo(policy);
    }

    @Test
    void zeroMaxAttemptsRejected() {
      assertThatThrownBy(() -> new AuthSession.Builder(CREDENTIALS, client).maxAttempts(0).build())
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessage("maxAttempts must be >= 1");
    }

    @Test
    void nullClientRejected() {
      assertThatThrownBy(() -> new AuthSession.Builder(CREDENTIALS, null))
          .isInstanceOf(NullPointerException.class)
          .hasMessage("client");
    }

    @Test
    void finalOnlyLoggingStillRetries() {
      when(client.attemptLogin(anyString(), anyString(), any())).thenReturn(false, false, true);
      AuthSession session =
          new AuthSession.Builder(CREDENTIALS, client)
              .maxAttempts(3)
              .retryDelay(Duration.ZERO)
              .retryLogging(RetryLogging.FINAL_ONLY)
              .build();
      session.setClock(fakeClock);

      assertThat(session.login().attempts()).isEqualTo(3);
      assertThat(fakeClock.sleeps).containsExactly(Duration.ZERO, Duration.ZERO);
    }
  }
}
