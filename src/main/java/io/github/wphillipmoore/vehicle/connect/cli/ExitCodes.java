package io.github.wphillipmoore.vehicle.connect.cli;

/**
 * Process exit codes.
 *
 * <p>{@link #TEMPFAIL} follows sysexits.h {@code EX_TEMPFAIL} and is used when the account is
 * throttled: the same invocation may succeed later.
 */
public final class ExitCodes {
  public static final int OK = 0;
  public static final int FAILURE = 1;
  public static final int USAGE = 2;
  public static final int TEMPFAIL = 75;

  private ExitCodes() {}
}
