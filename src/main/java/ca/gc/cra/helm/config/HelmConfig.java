package ca.gc.cra.helm.config;

import ca.gc.cra.helm.application.control.Multireceiver;
import ca.gc.cra.helm.validation.Strings;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Immutable runtime configuration for HELM sessions and the console CLI.
 * <p><strong>Role:</strong> Configuration record consumed by {@link CompositionRoot}.</p>
 * <p><strong>Thread-safety:</strong> Record is immutable; safe for concurrent reads.</p>
 *
 * @param dedupFactor routing window multiplier for groups ({@code dedup.factor}); positive
 * @param metricsExporter metrics backend ({@code metrics.exporter})
 * @param loggingLevel optional root logging level ({@code logging.level}); blank keeps logback defaults
 * @param sessionId console session id ({@code console.session})
 * @param characterName name of the console's character when no party is configured ({@code console.name})
 * @param party names of the wanderers driven as one group ({@code console.party}, comma separated); may be empty
 * @since 0.1.0
 */
public record HelmConfig(
    double dedupFactor,
    MetricsExporter metricsExporter,
    String loggingLevel,
    String sessionId,
    String characterName,
    List<String> party) {

  /** Supported metrics backends. */
  public enum MetricsExporter {
    NONE,
    OTLP;

    static MetricsExporter from(String raw) {
      String normalized = Strings.requireNonBlank("metrics.exporter", raw).toLowerCase(Locale.ROOT);
      return switch (normalized) {
        case "none" -> NONE;
        case "otlp" -> OTLP;
        default -> throw new IllegalArgumentException("metrics.exporter must be none or otlp: " + raw);
      };
    }
  }

  /**
   * Validates components.
   *
   * @throws IllegalArgumentException if the factor is not positive or a name is blank
   */
  public HelmConfig {
    if (!(dedupFactor > 0) || Double.isInfinite(dedupFactor)) {
      throw new IllegalArgumentException("dedup.factor must be a positive number");
    }
    Objects.requireNonNull(metricsExporter, "metricsExporter");
    loggingLevel = loggingLevel == null ? "" : loggingLevel.trim();
    sessionId = Strings.requireNonBlank("console.session", sessionId);
    characterName = Strings.requireNonBlank("console.name", characterName);
    List<String> names = new ArrayList<>();
    for (String member : Objects.requireNonNull(party, "party")) {
      names.add(Strings.requireNonBlank("console.party", member));
    }
    party = List.copyOf(names);
  }

  /**
   * Provides the values used when no configuration file is supplied.
   *
   * @return default configuration
   */
  public static HelmConfig defaults() {
    return new HelmConfig(Multireceiver.DEFAULT_DEDUP_FACTOR, MetricsExporter.NONE, "", "console", "Traveler",
        List.of());
  }

  /**
   * Returns the flat key/value view of this configuration, as accepted by {@link #fromMap(Map)}.
   *
   * @return ordered map of dotted keys
   */
  public Map<String, String> toMap() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("dedup.factor", Double.toString(dedupFactor));
    map.put("metrics.exporter", metricsExporter.name().toLowerCase(Locale.ROOT));
    map.put("logging.level", loggingLevel);
    map.put("console.session", sessionId);
    map.put("console.name", characterName);
    map.put("console.party", String.join(",", party));
    return map;
  }

  /**
   * Builds a configuration from flat dotted keys, falling back to {@link #defaults()} for absent keys.
   *
   * @param values flattened configuration; unknown keys are ignored
   * @return validated configuration
   * @throws IllegalArgumentException if a value cannot be parsed or fails validation
   */
  public static HelmConfig fromMap(Map<String, String> values) {
    Objects.requireNonNull(values, "values");
    Map<String, String> merged = new LinkedHashMap<>(defaults().toMap());
    merged.putAll(values);
    return new HelmConfig(
        parseFactor(merged.get("dedup.factor")),
        MetricsExporter.from(merged.get("metrics.exporter")),
        merged.get("logging.level"),
        merged.get("console.session"),
        merged.get("console.name"),
        parseList(merged.get("console.party")));
  }

  private static double parseFactor(String raw) {
    try {
      return Double.parseDouble(Strings.requireNonBlank("dedup.factor", raw));
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("dedup.factor must be numeric: " + raw, ex);
    }
  }

  private static List<String> parseList(String raw) {
    if (raw == null || raw.isBlank()) {
      return List.of();
    }
    List<String> items = new ArrayList<>();
    for (String token : raw.split(",")) {
      String trimmed = token.trim();
      if (!trimmed.isEmpty()) {
        items.add(trimmed);
      }
    }
    return items;
  }
}
