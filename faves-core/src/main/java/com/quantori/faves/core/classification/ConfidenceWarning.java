package com.quantori.faves.core.classification;

/**
 * Conditions that lower confidence in a verdict without failing the classification.
 */
public enum ConfidenceWarning {
  /** The canonical form is whitelisted but no record agrees with the secondary hash. */
  AMBIGUOUS_WHITELIST_MATCH,
  AMBIGUOUS_CONTROLLED_MATCH,
  /** At least one scaffold pattern ran out of time and was counted as not matched. */
  SCAFFOLD_MATCH_TIMEOUT
}
