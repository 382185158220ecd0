package ca.gc.cra.helm.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConsoleCliTest {
  @TempDir Path tempDir;

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
  void singleCharacterSessionPrintsReplies() {
    ExitCode code = ConsoleCli.run(new String[] {"name=Ann"}, input("say hello", "dance", "wave", "quit", "wave"));

    assertEquals(ExitCode.SUCCESS, code);
    String transcript = output.toString();
    assertTrue(transcript.contains("Connected as Ann the Wanderer."));
    assertTrue(transcript.contains("Ann the Wanderer : hello"));
    assertTrue(transcript.contains("Command 'dance' not recognized."));
    assertEquals(1, occurrences(transcript, "Ann waves."));
  }

  @Test
  void partySessionLabelsSpeakersAndSuppressesRepeatedHelp() {
    ExitCode code = ConsoleCli.run(new String[] {"party=Ann,Bo"}, input("say hi", "help"));

    assertEquals(ExitCode.SUCCESS, code);
    String transcript = output.toString();
    assertTrue(transcript.contains("[Ann the Wanderer]"));
    assertTrue(transcript.contains("Ann the Wanderer : hi"));
    assertTrue(transcript.contains("[Bo the Wanderer]"));
    assertTrue(transcript.contains("Bo the Wanderer : hi"));
    assertEquals(1, occurrences(transcript, "[Wanderer Commands]"));
  }

  @Test
  void configFileSuppliesProfileValuesAndCliOverridesThem() throws IOException {
    Path yaml = tempDir.resolve("helm.yaml");
    Files.writeString(yaml, """
        common:
          dedup:
            factor: 2
        console:
          name: Cy
          session: desk
        """);

    ExitCode code = ConsoleCli.run(new String[] {"config=" + yaml, "name=Dee"}, input("wave"));

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(output.toString().contains("Dee waves."));
    assertFalse(output.toString().contains("Cy"));
  }

  @Test
  void missingConfigFileFallsBackToDefaults() {
    ExitCode code = ConsoleCli.run(new String[] {"config=" + tempDir.resolve("absent.yaml")}, input("wave"));

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(output.toString().contains("Traveler waves."));
  }

  @Test
  void malformedArgumentIsRejected() {
    ExitCode code = ConsoleCli.run(new String[] {"party"}, input());

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(output.toString().contains("usage: helm console"));
  }

  @Test
  void invalidConfigurationValueIsAConfigError() {
    assertEquals(ExitCode.CONFIG_ERROR, ConsoleCli.run(new String[] {"dedup=0"}, input()));
    assertEquals(ExitCode.CONFIG_ERROR, ConsoleCli.run(new String[] {"metrics=statsd"}, input()));
  }

  @Test
  void unreadableConfigFileIsAnIoError() throws IOException {
    Path directory = Files.createDirectory(tempDir.resolve("helm.yaml"));

    assertEquals(ExitCode.IO_ERROR, ConsoleCli.run(new String[] {"config=" + directory}, input()));
  }

  @Test
  void helpPrintsUsage() {
    assertEquals(ExitCode.SUCCESS, ConsoleCli.run(new String[] {"--help"}, input()));
    assertTrue(output.toString().contains("HELM console session"));
  }

  private static InputStream input(String... lines) {
    String text = lines.length == 0 ? "" : String.join("\n", lines) + "\n";
    return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
  }

  private static int occurrences(String text, String needle) {
    int count = 0;
    int from = 0;
    while ((from = text.indexOf(needle, from)) >= 0) {
      count++;
      from += needle.length();
    }
    return count;
  }
}
