package com.quantori.faves.core.pattern;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;
import java.util.Locale;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum DrugClass {
  OPIOID("opioid"),
  BENZODIAZEPINE("benzodiazepine"),
  STIMULANT("stimulant"),
  CANNABINOID("cannabinoid"),
  HYPNOTIC_SEDATIVE("hypnotic_sedative"),
  DISSOCIATIVE_HALLUCINOGEN("dissociative_hallucinogen");

  @JsonValue
  private final String label;

  @JsonCreator
  public static DrugClass fromLabel(String label) {
    String normalized =
        label == null ? "" : label.trim().toLowerCase(Locale.ROOT).replace('/', '_');
    return Arrays.stream(values())
        .filter(drugClass -> drugClass.label.equals(normalized))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unknown drug class: " + label));
  }
}
