package ca.gc.cra.beacon.api;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Writes CLI usage text and demo summaries to stdout, separate from log output.
 *
 * @since 0.1.0
 */
final class CliPrinter {
  private static final PrintWriter STDOUT = new PrintWriter(
      new OutputStreamWriter(new FileOutputStream(FileDescriptor.out), StandardCharsets.UTF_8), true);
  private static volatile PrintWriter override;

  private CliPrinter() {}

  static void println(String message) {
    writer().println(message);
  }

  static void printf(String format, Object... args) {
    PrintWriter writer = writer();
    writer.printf(Locale.ROOT, format, args);
    writer.flush();
  }

  /** Redirects output in tests; {@code null} restores stdout. */
  static void setWriterForTesting(PrintWriter writer) {
    override = writer;
  }

  private static PrintWriter writer() {
    PrintWriter current = override;
    return current != null ? current : STDOUT;
  }
}
