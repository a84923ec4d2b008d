package com.quantori.faves.core.configuration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.quantori.faves.core.index.IndexLoadException;
import com.quantori.faves.core.pattern.PatternCompileException;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.Test;

class FavesConfigurationTest {

  private static Config override(Map<String, ?> values) {
    return ConfigFactory.parseMap(values).withFallback(ConfigFactory.load());
  }

  @Test
  void defaultsComeFromReferenceConf() {
    FavesConfigurationProperties properties = FavesConfiguration.load();

    assertEquals("faves-akka-system", properties.getSystemName());
    assertEquals(Duration.ofMillis(250), properties.getMatchTimeout());
    assertEquals(8, properties.getWorkers());
    assertEquals(Duration.ofSeconds(30), properties.getAskTimeout());
    assertEquals("classpath:scaffold-patterns.json", properties.getPatternsPath());
  }

  @Test
  void overridesTakePrecedence() {
    FavesConfigurationProperties properties =
        FavesConfiguration.fromConfig(
            override(Map.of("faves.workers", 2, "faves.match-timeout", "1s")));

    assertEquals(2, properties.getWorkers());
    assertEquals(Duration.ofSeconds(1), properties.getMatchTimeout());
  }

  @Test
  void outOfRangeValuesAreRejected() {
    assertThrows(
        IllegalArgumentException.class,
        () -> FavesConfiguration.fromConfig(override(Map.of("faves.workers", 0))));
    assertThrows(
        IllegalArgumentException.class,
        () -> FavesConfiguration.fromConfig(override(Map.of("faves.match-timeout", "0ms"))));
    assertThrows(
        ConfigException.class,
        () -> FavesConfiguration.fromConfig(override(Map.of("faves.workers", "many"))));
  }

  @Test
  void missingSnapshotAbortsStartup() {
    FavesConfigurationProperties properties = FavesConfiguration.load();
    properties.setWhitelistPath("classpath:reference/absent.tsv");

    assertThrows(IndexLoadException.class, () -> FavesBootstrap.createPipeline(properties));
  }

  @Test
  void invalidPatternLibraryAbortsStartup() {
    FavesConfigurationProperties properties = FavesConfiguration.load();
    properties.setPatternsPath("classpath:fixtures/patterns-malformed.json");

    assertThrows(PatternCompileException.class, () -> FavesBootstrap.createPipeline(properties));
  }
}
