package ca.gc.cra.helm.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class HelmConfigTest {

  @Test
  void defaultsDescribeASingleTravelerWithoutMetrics() {
    HelmConfig config = HelmConfig.defaults();

    assertEquals(1.5, config.dedupFactor());
    assertEquals(HelmConfig.MetricsExporter.NONE, config.metricsExporter());
    assertEquals("console", config.sessionId());
    assertEquals("Traveler", config.characterName());
    assertEquals(List.of(), config.party());
  }

  @Test
  void fromMapOverlaysDefaults() {
    HelmConfig config = HelmConfig.fromMap(Map.of(
        "dedup.factor", "2",
        "metrics.exporter", "OTLP",
        "console.party", "Ann, Bo,,"));

    assertEquals(2.0, config.dedupFactor());
    assertEquals(HelmConfig.MetricsExporter.OTLP, config.metricsExporter());
    assertEquals(List.of("Ann", "Bo"), config.party());
    assertEquals("Traveler", config.characterName());
  }

  @Test
  void toMapRoundTripsThroughFromMap() {
    HelmConfig config = HelmConfig.fromMap(Map.of("console.name", "Ann", "logging.level", "debug"));

    assertEquals(config, HelmConfig.fromMap(config.toMap()));
  }

  @Test
  void rejectsInvalidValues() {
    assertThrows(IllegalArgumentException.class, () -> HelmConfig.fromMap(Map.of("dedup.factor", "lots")));
    assertThrows(IllegalArgumentException.class, () -> HelmConfig.fromMap(Map.of("dedup.factor", "0")));
    assertThrows(IllegalArgumentException.class, () -> HelmConfig.fromMap(Map.of("metrics.exporter", "statsd")));
    assertThrows(IllegalArgumentException.class, () -> HelmConfig.fromMap(Map.of("console.name", " ")));
  }
}
