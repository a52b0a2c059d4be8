package ca.gc.cra.cmdline.api;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;

/**
 * Minimal console output helper for help text and action failure messages.
 *
 * <p>Uses native file descriptors in order to avoid direct {@code System.out} references while
 * preserving simple stdout writes that play nicely with logging configurations.</p>
 */
public final class CliPrinter {
  private static final PrintWriter STDOUT = new PrintWriter(
      new OutputStreamWriter(new FileOutputStream(FileDescriptor.out), StandardCharsets.UTF_8), true);
  private static volatile PrintWriter override;

  private CliPrinter() {
    // Utility
  }

  /**
   * Prints a single line to stdout using the shared CLI writer.
   *
   * @param message line to emit
   */
  public static void println(String message) {
    PrintWriter writer = writer();
    writer.println(message);
    writer.flush();
  }

  /**
   * Overrides the CLI writer; intended for tests of code that prints help.
   *
   * @param writer writer to use until {@link #clearTestWriter()}
   */
  static void setWriterForTesting(PrintWriter writer) {
    override = writer;
  }

  /**
   * Clears any test writer override.
   */
  static void clearTestWriter() {
    override = null;
  }

  private static PrintWriter writer() {
    PrintWriter current = override;
    return current != null ? current : STDOUT;
  }
}
