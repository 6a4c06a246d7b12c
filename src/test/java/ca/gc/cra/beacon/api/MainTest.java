package ca.gc.cra.beacon.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MainTest {
  private StringWriter buffer;

  @BeforeEach
  void captureOutput() {
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
  }

  @AfterEach
  void restoreOutput() {
    CliPrinter.setWriterForTesting(null);
  }

  @Test
  void helpWithoutCommandSucceeds() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"--help"}));
    assertTrue(buffer.toString().contains("Beacon logging toolkit"));
  }

  @Test
  void missingCommandPrintsUsage() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[0]));
    assertTrue(buffer.toString().contains(Main.SUMMARY_USAGE));
  }

  @Test
  void unknownCommandPrintsUsage() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[] {"capture"}));
    assertTrue(buffer.toString().contains(Main.SUMMARY_USAGE));
  }

  @Test
  void demoHelpDispatched() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"demo", "--help"}));
    assertTrue(buffer.toString().contains("Beacon logging walkthrough"));
  }

  @Test
  void exitCodesAreStable() {
    assertEquals(0, ExitCode.SUCCESS.code());
    assertEquals(2, ExitCode.INVALID_ARGS.code());
    assertEquals(3, ExitCode.IO_ERROR.code());
    assertEquals(4, ExitCode.CONFIG_ERROR.code());
    assertEquals(5, ExitCode.RUNTIME_FAILURE.code());
  }
}
