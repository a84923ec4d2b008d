package com.quantori.faves.core.configuration;

import java.time.Duration;
import lombok.Builder;
import lombok.Data;

@Builder
@Data
public class FavesConfigurationProperties {
  String systemName;
  String whitelistPath;
  String controlledPath;
  String patternsPath;
  Duration matchTimeout;
  int workers;
  Duration askTimeout;
}
