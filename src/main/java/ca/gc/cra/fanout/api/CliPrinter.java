package ca.gc.cra.fanout.api;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;

/**
 * Console output helper for usage text, plans, and the report stream.
 *
 * <p>Uses the native stdout descriptor so nothing written here can be confused with log output, which Logback sends
 * to stderr. Tests swap the stream with {@link #setStreamForTesting(OutputStream)}.</p>
 */
public final class CliPrinter {
  private static final OutputStream STDOUT = new FileOutputStream(FileDescriptor.out);
  private static volatile OutputStream override;

  private CliPrinter() {
    // Utility
  }

  /**
   * Prints a single line to stdout.
   *
   * @param message line to emit
   */
  public static void println(String message) {
    printLines(message);
  }

  /**
   * Prints zero or more lines to stdout.
   *
   * @param lines lines to emit
   */
  public static void printLines(String... lines) {
    if (lines == null) {
      return;
    }
    PrintWriter writer = new PrintWriter(new OutputStreamWriter(stdout(), StandardCharsets.UTF_8));
    for (String line : lines) {
      writer.println(line);
    }
    writer.flush();
  }

  /**
   * Returns the raw stdout stream that report writers append to.
   *
   * @return active stdout stream; never closed by callers
   */
  static OutputStream stdout() {
    OutputStream stream = override;
    return stream != null ? stream : STDOUT;
  }

  /**
   * Overrides stdout for tests.
   *
   * @param stream stream to use during the test
   */
  static void setStreamForTesting(OutputStream stream) {
    override = stream;
  }

  /**
   * Clears any test stream override.
   */
  static void clearTestStream() {
    override = null;
  }
}
