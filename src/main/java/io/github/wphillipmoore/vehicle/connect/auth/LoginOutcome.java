package io.github.wphillipmoore.vehicle.connect.auth;

import io.github.wphillipmoore.vehicle.connect.exception.ExhaustedRetriesException;
import io.github.wphillipmoore.vehicle.connect.exception.ThrottledException;
import java.time.Instant;
import java.util.Objects;

/**
 * Terminal result of {@link AuthSession#login()}.
 *
 * <p>Exactly one outcome is produced per session. Callers either switch on the concrete type or
 * call {@link #requireSuccess()}.
 */
public sealed interface LoginOutcome
    permits LoginOutcome.Success, LoginOutcome.Throttled, LoginOutcome.Exhausted {

  /** Returns the number of login attempts made to reach this outcome. */
  int attempts();

  /** Returns whether the session is authenticated. */
  default boolean isSuccess() {
    return this instanceof Success;
  }

  /**
   * Returns normally if this outcome is a success, otherwise throws the matching exception.
   *
   * @throws ThrottledException if the account is throttled
   * @throws ExhaustedRetriesException if every attempt failed
   */
  default void requireSuccess() {
    if (this instanceof Throttled throttled) {
      throw new ThrottledException(throttled.message());
    }
    if (this instanceof Exhausted exhausted) {
      throw new ExhaustedRetriesException(exhausted.attempts(), exhausted.lastError());
    }
  }

  /**
   * The login succeeded.
   *
   * @param authenticatedAt when the successful attempt completed
   * @param attempts the number of attempts made, including the successful one
   */
  record Success(Instant authenticatedAt, int attempts) implements LoginOutcome {

    /** Validates non-null fields. */
    public Success {
      Objects.requireNonNull(authenticatedAt, "authenticatedAt");
    }
  }

  /**
   * The service reported account throttling. No further attempts were made.
   *
   * @param message the fault message reported by the service
   * @param attempts the number of attempts made, including the throttled one
   */
  record Throttled(String message, int attempts) implements LoginOutcome {

    /** Validates non-null fields. */
    public Throttled {
      Objects.requireNonNull(message, "message");
    }
  }

  /**
   * Every attempt failed.
   *
   * @param lastError the failure of the final attempt
   * @param attempts the number of attempts made
   */
  record Exhausted(Throwable lastError, int attempts) implements LoginOutcome {

    /** Validates non-null fields. */
    public Exhausted {
      Objects.requireNonNull(lastError, "lastError");
    }
  }
}
