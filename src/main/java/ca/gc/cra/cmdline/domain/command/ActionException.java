package ca.gc.cra.cmdline.domain.command;

/**
 * Failure reported by a {@link ResultAction}.
 *
 * @since 0.1.0
 */
public class ActionException extends Exception {
  private static final long serialVersionUID = 1L;

  public ActionException(String message) {
    super(message);
  }

  public ActionException(String message, Throwable cause) {
    super(message, cause);
  }
}
