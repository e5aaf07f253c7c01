package ca.gc.cra.envlayers.api;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Stdout for command results, usage text and error summaries.
 *
 * <p>Logback writes to stderr, so anything printed here can be piped without log noise. Tests swap
 * the target with {@link #redirectForTesting(PrintWriter)}.</p>
 */
public final class CliPrinter {
  private static final PrintWriter STDOUT = stdout();
  private static volatile PrintWriter target = STDOUT;

  private CliPrinter() {
    // Utility
  }

  /**
   * Prints a single line.
   *
   * @param message line to emit
   */
  public static void println(String message) {
    printLines(List.of(String.valueOf(message)));
  }

  /**
   * Prints each line in order and flushes once.
   *
   * @param lines lines to emit; {@code null} prints nothing
   */
  public static void printLines(Iterable<String> lines) {
    if (lines == null) {
      return;
    }
    PrintWriter out = target;
    lines.forEach(out::println);
    out.flush();
  }

  static void redirectForTesting(PrintWriter writer) {
    target = writer == null ? STDOUT : writer;
  }

  static void restoreStdout() {
    target = STDOUT;
  }

  private static PrintWriter stdout() {
    return new PrintWriter(
        new OutputStreamWriter(new FileOutputStream(FileDescriptor.out), StandardCharsets.UTF_8), true);
  }
}
