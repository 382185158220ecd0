package ca.gc.cra.helm.api;

import ca.gc.cra.helm.logging.LoggingConfigurator;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HELM CLI dispatcher that routes to subcommands.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: helm <console> [options]";
  private static final String HELP_TEXT = """
      HELM command dispatcher

      Usage:
        helm <command> [options]

      Commands:
        console     Drive a character from standard input (console --help for details)

      Global flags:
        --help      Show this message
        --verbose   Enable DEBUG logging before dispatching to the command
      """;

  private Main() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Dispatches a subcommand and returns its exit code without terminating the JVM. Flags after the command name are
   * left for the command itself.
   *
   * @param args dispatcher arguments (first non-flag token is the command)
   * @return exit code reported by the delegated CLI
   */
  static ExitCode run(String[] args) {
    List<String> tokens = args == null ? List.of() : List.of(args);
    int commandIndex = -1;
    for (int i = 0; i < tokens.size(); i++) {
      String token = tokens.get(i);
      if (token != null && !token.isBlank() && !token.trim().startsWith("-")) {
        commandIndex = i;
        break;
      }
    }

    CliInput global = CliInput.parse(commandIndex < 0
        ? tokens.toArray(String[]::new)
        : tokens.subList(0, commandIndex).toArray(String[]::new));
    if (global.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for dispatcher");
    }
    if (commandIndex < 0) {
      if (global.help()) {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        return ExitCode.SUCCESS;
      }
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    String command = tokens.get(commandIndex).trim().toLowerCase(Locale.ROOT);
    List<String> delegate = new ArrayList<>(tokens.subList(commandIndex + 1, tokens.size()));
    if (global.verbose()) {
      delegate.add("--verbose");
    }
    String[] delegateArgs = delegate.toArray(String[]::new);

    return switch (command) {
      case "console" -> ConsoleCli.run(delegateArgs);
      case "help" -> {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        yield ExitCode.SUCCESS;
      }
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }
}
