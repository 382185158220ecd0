package ca.gc.cra.helm.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MainTest {
  private StringWriter output;

  @BeforeEach
  void captureOutput() {
    output = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(output, true));
  }

  @AfterEach
  void releaseOutput() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void helpListsCommands() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"--help"}));
    assertTrue(output.toString().contains("console"));
  }

  @Test
  void missingCommandIsInvalid() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[0]));
    assertTrue(output.toString().contains("usage: helm"));
  }

  @Test
  void unknownCommandIsInvalid() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[] {"capture"}));
  }

  @Test
  void commandHelpIsLeftToTheCommand() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"console", "--help"}));
    assertTrue(output.toString().contains("HELM console session"));
  }
}
