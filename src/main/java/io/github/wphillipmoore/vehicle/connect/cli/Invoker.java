package io.github.wphillipmoore.vehicle.connect.cli;

import io.github.wphillipmoore.vehicle.connect.VehicleServiceClient;
import io.github.wphillipmoore.vehicle.connect.auth.AuthSession;
import io.github.wphillipmoore.vehicle.connect.command.CommandGate;
import io.github.wphillipmoore.vehicle.connect.command.CommandOutcome;
import io.github.wphillipmoore.vehicle.connect.command.VehicleActions;
import io.github.wphillipmoore.vehicle.connect.exception.ExhaustedRetriesException;
import io.github.wphillipmoore.vehicle.connect.exception.LoginCancelledException;
import io.github.wphillipmoore.vehicle.connect.exception.PreconditionNotMetException;
import io.github.wphillipmoore.vehicle.connect.exception.ThrottledException;
import io.github.wphillipmoore.vehicle.connect.exception.ValidationFailedException;
import io.github.wphillipmoore.vehicle.connect.exception.VehicleConnectException;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one invocation: build the client, log in once, then run a single action or query and render
 * the result.
 */
public final class Invoker {

  private static final Logger LOGGER = LoggerFactory.getLogger(Invoker.class);

  private final Function<InvocationSettings, VehicleServiceClient> clientFactory;
  private final OutcomeRenderer renderer;

  /** A read-only query against an authenticated client. */
  @FunctionalInterface
  interface Query {
    void run(VehicleServiceClient client, OutcomeRenderer renderer);
  }

  Invoker(
      Function<InvocationSettings, VehicleServiceClient> clientFactory, OutcomeRenderer renderer) {
    this.clientFactory = Objects.requireNonNull(clientFactory, "clientFactory");
    this.renderer = Objects.requireNonNull(renderer, "renderer");
  }

  /**
   * Logs in and runs one vehicle action.
   *
   * @return the process exit code
   */
  int runAction(InvocationSettings settings, Function<VehicleActions, CommandOutcome> action) {
    return guarded(
        () -> {
          VehicleServiceClient client = clientFactory.apply(settings);
          AuthSession session = login(settings, client);
          VehicleActions actions = new VehicleActions(new CommandGate(session), client);
          CommandOutcome outcome = action.apply(actions);
          return renderer.render(outcome);
        });
  }

  /**
   * Logs in and runs one query.
   *
   * @return the process exit code
   */
  int runQuery(InvocationSettings settings, Query query) {
    return guarded(
        () -> {
          VehicleServiceClient client = clientFactory.apply(settings);
          login(settings, client);
          query.run(client, renderer);
          return ExitCodes.OK;
        });
  }

  private static AuthSession login(InvocationSettings settings, VehicleServiceClient client) {
    AuthSession session =
        new AuthSession.Builder(settings.credentials(), client)
            .retryPolicy(settings.retryPolicy())
            .build();
    session.login().requireSuccess();
    return session;
  }

  private int guarded(Supplier<Integer> body) {
    try {
      return body.get();
    } catch (ThrottledException e) {
      renderer.error(e.getMessage());
      return ExitCodes.TEMPFAIL;
    } catch (ExhaustedRetriesException e) {
      renderer.error(e.getMessage());
      return ExitCodes.FAILURE;
    } catch (LoginCancelledException e) {
      renderer.info("Operation cancelled by user");
      return ExitCodes.FAILURE;
    } catch (PreconditionNotMetException | ValidationFailedException e) {
      renderer.error(e.getMessage());
      return ExitCodes.USAGE;
    } catch (VehicleConnectException e) {
      LOGGER.debug("Invocation failed", e);
      renderer.error(e.getMessage());
      return ExitCodes.FAILURE;
    }
  }
}
