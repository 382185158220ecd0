package ca.gc.cra.helm.api;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;

/**
 * Writes user-facing CLI text and session transcripts to stdout, leaving stderr to logback.
 *
 * @since 0.1.0
 */
public final class CliPrinter {
  private static final PrintWriter CONSOLE = new PrintWriter(
      new OutputStreamWriter(new FileOutputStream(FileDescriptor.out), StandardCharsets.UTF_8), true);
  private static volatile PrintWriter capture;

  private CliPrinter() {
    // Utility
  }

  public static void println(String line) {
    target().println(line);
  }

  /**
   * Prints a message that may span lines, one output line per message line. Trailing blank lines are dropped.
   *
   * @param message message text; {@code null} prints nothing
   */
  public static void printMessage(String message) {
    if (message == null) {
      return;
    }
    PrintWriter out = target();
    for (String line : message.stripTrailing().split("\n", -1)) {
      out.println(line);
    }
  }

  static void setWriterForTesting(PrintWriter writer) {
    capture = writer;
  }

  static void clearTestWriter() {
    capture = null;
  }

  private static PrintWriter target() {
    PrintWriter current = capture;
    return current != null ? current : CONSOLE;
  }
}
