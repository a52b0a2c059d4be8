package ca.gc.cra.cmdline.domain.command;

/**
 * Handler invoked with the per-invocation {@link Context} of a matched command.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface Action {
  /**
   * Runs the command.
   *
   * @param context read-only positional arguments and flag occurrences for this invocation
   */
  void execute(Context context);
}
