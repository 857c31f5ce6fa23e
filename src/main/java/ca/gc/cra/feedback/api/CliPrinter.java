package ca.gc.cra.feedback.api;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Console output for usage text and dry-run plans, kept apart from the logging pipeline.
 */
public final class CliPrinter {
  private static final PrintWriter STDOUT = new PrintWriter(
      new OutputStreamWriter(new FileOutputStream(FileDescriptor.out), StandardCharsets.UTF_8), true);
  private static final int LABEL_WIDTH = 17;
  private static volatile PrintWriter override;

  private CliPrinter() {}

  public static void println(String message) {
    writer().println(message);
  }

  /**
   * Prints a heading, one {@code " label : value"} line per entry with labels padded to a common
   * width, then a footer.
   *
   * @param heading first line
   * @param rows labels and values in display order
   * @param footer last line; {@code null} to omit
   */
  public static void printPlan(String heading, Map<String, String> rows, String footer) {
    PrintWriter out = writer();
    out.println(heading);
    rows.forEach((label, value) -> out.println(String.format(" %-" + LABEL_WIDTH + "s: %s", label, value)));
    if (footer != null) {
      out.println(footer);
    }
    out.flush();
  }

  static void setWriterForTesting(PrintWriter writer) {
    override = writer;
  }

  static void clearTestWriter() {
    override = null;
  }

  private static PrintWriter writer() {
    PrintWriter current = override;
    return current != null ? current : STDOUT;
  }
}
