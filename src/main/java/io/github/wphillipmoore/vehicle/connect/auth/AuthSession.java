package io.github.wphillipmoore.vehicle.connect.auth;

import io.github.wphillipmoore.vehicle.connect.VehicleServiceClient;
import io.github.wphillipmoore.vehicle.connect.exception.LoginCancelledException;
import io.github.wphillipmoore.vehicle.connect.exception.TransientLoginException;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Authentication session against the vehicle cloud.
 *
 * <p>Owns the account {@link Credentials} for its lifetime and runs the login retry loop. Transient
 * failures are retried up to {@link RetryPolicy#maxAttempts()} times with {@link
 * RetryPolicy#retryDelay()} between attempts. A throttled account is never retried: once the
 * service reports throttling the session stays {@link AuthState#THROTTLED}.
 *
 * <p>Instances are created via the {@link Builder}:
 *
 * <pre>{@code
 * AuthSession session = new AuthSession.Builder(credentials, client)
 *     .maxAttempts(3)
 *     .retryDelay(Duration.ofSeconds(10))
 *     .build();
 * LoginOutcome outcome = session.login();
 * }</pre>
 *
 * <p>Not thread-safe. One session serves one invocation.
 */
public final class AuthSession {

  private static final Logger LOGGER = LoggerFactory.getLogger(AuthSession.class);

  private final Credentials credentials;
  private final VehicleServiceClient client;
  private final RetryPolicy retryPolicy;

  private Clock clock = new SystemClock();
  private AuthState state = AuthState.IDLE;
  private int attemptsMade;
  private @Nullable Instant authenticatedAt;
  private @Nullable LoginOutcome outcome;

  /** Clock abstraction for testability. */
  interface Clock {
    void sleep(Duration duration) throws InterruptedException;

    Instant now();
  }

  /** Real clock using Thread.sleep and the system UTC clock. */
  static final class SystemClock implements Clock {

    @Override
    public void sleep(Duration duration) throws InterruptedException {
      Thread.sleep(duration.toMillis());
    }

    @Override
    public Instant now() {
      return Instant.now();
    }
  }

  /** Package-private setter for test injection. */
  void setClock(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  private AuthSession(Builder builder) {
    this.credentials = builder.credentials;
    this.client = builder.client;
    this.retryPolicy =
        new RetryPolicy(builder.maxAttempts, builder.retryDelay, builder.retryLogging);
  }

  /** Returns the credentials this session logs in with. */
  public Credentials getCredentials() {
    return credentials;
  }

  /** Returns the retry bounds of this session. */
  public RetryPolicy getRetryPolicy() {
    return retryPolicy;
  }

  /** Returns the current state. */
  public AuthState getState() {
    return state;
  }

  /** Returns the number of login attempts made so far. Never exceeds the maximum. */
  public int getAttemptsMade() {
    return attemptsMade;
  }

  /** Returns when the session authenticated, or {@code null} if it has not. */
  public @Nullable Instant getAuthenticatedAt() {
    return authenticatedAt;
  }

  /** Returns whether the session is authenticated. */
  public boolean isAuthenticated() {
    return state == AuthState.AUTHENTICATED;
  }

  /**
   * Logs in to the vehicle service, retrying transient failures.
   *
   * <p>The first call runs the login sequence. Later calls return the same outcome without
   * contacting the service again.
   *
   * @return the terminal login outcome
   * @throws LoginCancelledException if the thread is interrupted between or during attempts
   */
  public LoginOutcome login() {
    if (outcome != null) {
      return outcome;
    }
    state = AuthState.AUTHENTICATING;
    int maxAttempts = retryPolicy.maxAttempts();
    Throwable lastError = null;

    for (int attempt = 0; attempt < maxAttempts; attempt++) {
      checkCancelled();
      attemptsMade++;
      Throwable failure;
      try {
        LOGGER.debug(
            "Requesting login for {} (attempt {}/{})",
            credentials.identity(),
            attemptsMade,
            maxAttempts);
        boolean accepted =
            client.attemptLogin(
                credentials.identity(), credentials.secret(), credentials.region());
        if (accepted) {
          LOGGER.debug("Login to the vehicle service successful");
          authenticatedAt = clock.now();
          state = AuthState.AUTHENTICATED;
          return finish(new LoginOutcome.Success(authenticatedAt, attemptsMade));
        }
        failure = new TransientLoginException("Login rejected by the vehicle service");
      } catch (RuntimeException e) {
        if (FaultClassifier.isCancellation(e)) {
          throw cancelled(e);
        }
        if (FaultClassifier.isThrottling(e)) {
          String message = FaultClassifier.messageOf(e);
          LOGGER.error("Account is throttled. Please wait before trying again.");
          LOGGER.error("Error message: {}", message);
          state = AuthState.THROTTLED;
          return finish(new LoginOutcome.Throttled(message, attemptsMade));
        }
        failure = e;
      }
      lastError = failure;

      if (attempt < maxAttempts - 1) {
        logRetry(failure);
        checkCancelled();
        try {
          clock.sleep(retryPolicy.retryDelay());
        } catch (InterruptedException e) {
          throw cancelled(e);
        }
      }
    }

    LOGGER.error(
        "Failed to log in to the vehicle service: {}. You may need to open the vehicle app, or log"
            + " in via a web browser, to accept updated terms and conditions.",
        FaultClassifier.messageOf(lastError));
    state = AuthState.FAILED;
    return finish(new LoginOutcome.Exhausted(lastError, attemptsMade));
  }

  private void logRetry(Throwable failure) {
    long delaySeconds = retryPolicy.retryDelay().toSeconds();
    if (retryPolicy.logging() == RetryLogging.EVERY_ATTEMPT) {
      LOGGER.warn(
          "Login to the vehicle service failed, trying again in {} seconds: {}",
          delaySeconds,
          FaultClassifier.messageOf(failure));
    } else {
      LOGGER.debug(
          "Login to the vehicle service failed, trying again in {} seconds: {}",
          delaySeconds,
          FaultClassifier.messageOf(failure));
    }
  }

  private void checkCancelled() {
    if (Thread.currentThread().isInterrupted()) {
      throw cancelled(null);
    }
  }

  private LoginCancelledException cancelled(@Nullable Throwable cause) {
    Thread.currentThread().interrupt();
    LoginCancelledException cancellation =
        cause != null
            ? new LoginCancelledException(attemptsMade, cause)
            : new LoginCancelledException(attemptsMade);
    state = AuthState.FAILED;
    finish(new LoginOutcome.Exhausted(cancellation, attemptsMade));
    return cancellation;
  }

  private LoginOutcome finish(LoginOutcome result) {
    this.outcome = result;
    return result;
  }

  /** Builder for {@link AuthSession}. */
  public static final class Builder {

    private final Credentials credentials;
    private final VehicleServiceClient client;
    private int maxAttempts = RetryPolicy.DEFAULT_MAX_ATTEMPTS;
    private Duration retryDelay = RetryPolicy.DEFAULT_RETRY_DELAY;
    private RetryLogging retryLogging = RetryLogging.EVERY_ATTEMPT;

    /**
     * Creates a builder with the required session parameters.
     *
     * @param credentials the account credentials
     * @param client the vehicle service client that performs single login attempts
     */
    public Builder(Credentials credentials, VehicleServiceClient client) {
      this.credentials = Objects.requireNonNull(credentials, "credentials");
      this.client = Objects.requireNonNull(client, "client");
    }

    /** Sets the maximum number of login attempts. Defaults to 3. */
    public Builder maxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
      return this;
    }

    /** Sets the pause between login attempts. Defaults to 10 seconds. */
    public Builder retryDelay(Duration retryDelay) {
      this.retryDelay = Objects.requireNonNull(retryDelay, "retryDelay");
      return this;
    }

    /** Sets how non-final failures are logged. Defaults to {@link RetryLogging#EVERY_ATTEMPT}. */
    public Builder retryLogging(RetryLogging retryLogging) {
      this.retryLogging = Objects.requireNonNull(retryLogging, "retryLogging");
      return this;
    }

    /** Copies all bounds from an existing policy. */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      Objects.requireNonNull(retryPolicy, "retryPolicy");
      this.maxAttempts = retryPolicy.maxAttempts();
      this.retryDelay = retryPolicy.retryDelay();
      this.retryLogging = retryPolicy.logging();
      return this;
    }

    /**
     * Builds the session.
     *
     * @return the configured session in state {@link AuthState#IDLE}
     * @throws IllegalArgumentException if the retry bounds are invalid
     */
    public AuthSession build() {
      return new AuthSession(this);
    }
  }
}
