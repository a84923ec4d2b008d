package com.quantori.faves.core.configuration;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import java.time.Duration;
import lombok.experimental.UtilityClass;

/**
 * Reads {@link FavesConfigurationProperties} from the {@code faves} section of a Typesafe config.
 * Defaults live in {@code reference.conf}.
 */
@UtilityClass
public final class FavesConfiguration {
  public static final String ROOT = "faves";
  public static final String DISPATCHER = "faves-classifier-dispatcher";

  public static FavesConfigurationProperties load() {
    return fromConfig(ConfigFactory.load());
  }

  /**
   * Reads and validates the settings.
   *
   * @param config configuration containing a {@code faves} section
   * @return validated properties
   * @throws IllegalArgumentException if a value is out of range
   * @throws com.typesafe.config.ConfigException if a value is missing or mistyped
   */
  public static FavesConfigurationProperties fromConfig(Config config) {
    Config faves = config.getConfig(ROOT);
    FavesConfigurationProperties properties =
        FavesConfigurationProperties.builder()
            .systemName(faves.getString("system-name"))
            .whitelistPath(faves.getString("whitelist-path"))
            .controlledPath(faves.getString("controlled-path"))
            .patternsPath(faves.getString("patterns-path"))
            .matchTimeout(faves.getDuration("match-timeout"))
            .workers(faves.getInt("workers"))
            .askTimeout(faves.getDuration("ask-timeout"))
            .build();
    validate(properties);
    return properties;
  }

  public static void validate(FavesConfigurationProperties properties) {
    if (properties.getWorkers() <= 0) {
      throw new IllegalArgumentException("faves.workers must be positive");
    }
    requirePositive(properties.getMatchTimeout(), "faves.match-timeout");
    requirePositive(properties.getAskTimeout(), "faves.ask-timeout");
  }

  private static void requirePositive(Duration duration, String key) {
    if (duration == null || duration.isNegative() || duration.isZero()) {
      throw new IllegalArgumentException(key + " must be positive");
    }
  }
}
