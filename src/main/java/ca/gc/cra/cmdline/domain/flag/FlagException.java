package ca.gc.cra.cmdline.domain.flag;

import java.util.Objects;

/**
 * Checked failure raised by typed flag accessors.
 *
 * <p>The action handler decides whether to ignore, default, log, or escalate; the dispatcher never does so on
 * its behalf.</p>
 *
 * @since 0.1.0
 */
public final class FlagException extends Exception {
  private static final long serialVersionUID = 1L;

  private final FlagError error;
  private final String flagName;

  /**
   * Creates an exception for the given failure kind.
   *
   * @param error failure kind; never {@code null}
   * @param flagName name or alias passed to the accessor
   */
  public FlagException(FlagError error, String flagName) {
    this(error, flagName, null);
  }

  /**
   * Creates an exception preserving the parse failure that caused it.
   *
   * @param error failure kind; never {@code null}
   * @param flagName name or alias passed to the accessor
   * @param cause underlying parse failure; may be {@code null}
   */
  public FlagException(FlagError error, String flagName, Throwable cause) {
    super(Objects.requireNonNull(error, "error").description() + ": " + flagName, cause);
    this.error = error;
    this.flagName = flagName;
  }

  public FlagError error() {
    return error;
  }

  public String flagName() {
    return flagName;
  }
}
