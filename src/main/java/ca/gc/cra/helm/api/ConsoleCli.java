package ca.gc.cra.helm.api;

import ca.gc.cra.helm.application.port.Receiver;
import ca.gc.cra.helm.application.session.DuplicateSessionException;
import ca.gc.cra.helm.application.session.Player;
import ca.gc.cra.helm.application.session.PlayerRegistry;
import ca.gc.cra.helm.config.CompositionRoot;
import ca.gc.cra.helm.config.HelmConfig;
import ca.gc.cra.helm.config.YamlConfigLoader;
import ca.gc.cra.helm.domain.session.SessionId;
import ca.gc.cra.helm.logging.LoggingConfigurator;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Interactive console session: each stdin line is a command for one player, and everything the
 * driven entity says is printed after the line is processed.
 * <p><strong>Why:</strong> Exercises the full controller/receiver stack without a network transport.</p>
 * <p><strong>Thread-safety:</strong> Single-threaded; reads stdin on the calling thread.</p>
 *
 * @since 0.1.0
 */
public final class ConsoleCli {
  private static final Logger log = LoggerFactory.getLogger(ConsoleCli.class);
  private static final String PROFILE = "console";
  private static final String QUIT = "quit";
  private static final Map<String, String> ALIASES = Map.of(
      "session", "console.session",
      "name", "console.name",
      "party", "console.party",
      "dedup", "dedup.factor",
      "metrics", "metrics.exporter",
      "level", "logging.level");
  private static final String SUMMARY_USAGE =
      "usage: helm console [config=path] [name=NAME] [party=A,B] [session=ID] [dedup=F] [metrics=none|otlp]";
  private static final String HELP_TEXT = """
      HELM console session

      Usage:
        helm console [key=value ...] [--verbose]

      Options:
        config=PATH      YAML file; the 'common' and 'console' sections are merged
        name=NAME        Character driven by this console (default Traveler)
        party=A,B,...    Drive several wanderers as one group instead of a single character
        session=ID       Session id registered for this console (default console)
        dedup=FACTOR     Group routing window multiplier (default 1.5)
        metrics=MODE     none | otlp
        level=LEVEL      Root logging level (TRACE..ERROR)

      Type 'help' inside the session for the character's commands and 'quit' to leave.
      """;

  private ConsoleCli() {}

  /**
   * Runs a console session over the process's standard input.
   *
   * @param args CLI arguments
   * @return exit code describing the outcome
   */
  public static ExitCode run(String[] args) {
    return run(args, System.in);
  }

  static ExitCode run(String[] args, InputStream in) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled");
    }

    Map<String, String> overrides;
    try {
      overrides = input.options(ALIASES);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid console arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    HelmConfig config;
    try {
      config = resolveConfig(overrides);
      if (!input.verbose()) {
        LoggingConfigurator.applyRootLevel(config.loggingLevel());
      }
    } catch (IOException | IllegalArgumentException ex) {
      log.error("Unable to load console configuration: {}", ex.getMessage());
      return ExitCode.forFailure(ex);
    }

    try (CompositionRoot root = new CompositionRoot(config)) {
      return session(root, in);
    } catch (DuplicateSessionException ex) {
      log.error("Console session could not be registered: {}", ex.getMessage());
      return ExitCode.forFailure(ex);
    }
  }

  private static HelmConfig resolveConfig(Map<String, String> overrides) throws IOException {
    Map<String, String> merged = new LinkedHashMap<>();
    String configPath = overrides.remove("config");
    if (configPath != null) {
      Path path = Path.of(configPath);
      Optional<Map<String, String>> loaded = YamlConfigLoader.load(path, PROFILE);
      if (loaded.isPresent()) {
        loaded.get().forEach((key, value) -> merged.put(ALIASES.getOrDefault(key, key), value));
        log.info("Loaded console configuration from {}", path);
      } else {
        log.warn("Configuration file {} not found; using defaults", path);
      }
    }
    merged.putAll(overrides);
    return HelmConfig.fromMap(merged);
  }

  private static ExitCode session(CompositionRoot root, InputStream in) {
    PlayerRegistry registry = root.registry();
    SessionId id = SessionId.of(root.config().sessionId());
    Player player = registry.connect(id);
    Receiver receiver = root.consoleReceiver();
    player.assumeControl(receiver);
    CliPrinter.println("Connected as " + receiver + ". Type 'help' for commands, 'quit' to leave.");

    try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
      String line;
      while ((line = reader.readLine()) != null) {
        if (QUIT.equalsIgnoreCase(line.trim())) {
          break;
        }
        registry.sendCommand(id, line);
        registry.receiveMessages().forEach(message -> CliPrinter.printMessage(message.message()));
      }
      return ExitCode.SUCCESS;
    } catch (IOException ex) {
      log.error("Failed to read console input", ex);
      return ExitCode.forFailure(ex);
    } finally {
      registry.removePlayer(id);
    }
  }
}
