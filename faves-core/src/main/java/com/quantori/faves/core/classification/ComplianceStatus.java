package com.quantori.faves.core.classification;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ComplianceStatus {
  CLEARED("cleared"),
  CONTROLLED("controlled"),
  REVIEW("review"),
  /** No flag raised: cleared by absence. */
  NONE("none");

  @JsonValue
  private final String label;

  /**
   * Terminal status for a set of tier outcomes. Whitelisting overrides every other signal.
   */
  public static ComplianceStatus of(boolean whitelisted, boolean deaControlled, boolean scaffold) {
    if (whitelisted) {
      return CLEARED;
    }
    if (deaControlled) {
      return CONTROLLED;
    }
    return scaffold ? REVIEW : NONE;
  }
}
