package ca.gc.cra.cmdline.api;

/**
 * ANSI escape decorators for terminal text.
 *
 * <p>Each method wraps {@code String.valueOf(text)} in an SGR sequence followed by a reset. Stateless and
 * thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class AnsiColor {
  private static final String RESET = "\u001b[0m";

  private AnsiColor() {}

  public static String black(Object text) {
    return sgr(30, text);
  }

  public static String red(Object text) {
    return sgr(31, text);
  }

  public static String green(Object text) {
    return sgr(32, text);
  }

  public static String yellow(Object text) {
    return sgr(33, text);
  }

  public static String blue(Object text) {
    return sgr(34, text);
  }

  public static String magenta(Object text) {
    return sgr(35, text);
  }

  public static String cyan(Object text) {
    return sgr(36, text);
  }

  public static String white(Object text) {
    return sgr(37, text);
  }

  public static String bgBlack(Object text) {
    return sgr(40, text);
  }

  public static String bgRed(Object text) {
    return sgr(41, text);
  }

  public static String bgGreen(Object text) {
    return sgr(42, text);
  }

  public static String bgYellow(Object text) {
    return sgr(43, text);
  }

  public static String bgBlue(Object text) {
    return sgr(44, text);
  }

  public static String bgMagenta(Object text) {
    return sgr(45, text);
  }

  public static String bgCyan(Object text) {
    return sgr(46, text);
  }

  public static String bgWhite(Object text) {
    return sgr(47, text);
  }

  public static String bold(Object text) {
    return sgr(1, text);
  }

  private static String sgr(int code, Object text) {
    return "\u001b[" + code + "m" + text + RESET;
  }
}
