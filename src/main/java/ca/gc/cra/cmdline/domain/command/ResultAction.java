package ca.gc.cra.cmdline.domain.command;

/**
 * Handler variant that reports failure to the host through {@link ActionException}.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface ResultAction {
  /**
   * Runs the command.
   *
   * @param context read-only positional arguments and flag occurrences for this invocation
   * @throws ActionException when the command fails and the host should decide how to react
   */
  void execute(Context context) throws ActionException;

  /**
   * Adapts a plain {@link Action}.
   *
   * @param action plain handler; never {@code null}
   * @return result action that never throws {@link ActionException}
   */
  static ResultAction of(Action action) {
    return action::execute;
  }
}
