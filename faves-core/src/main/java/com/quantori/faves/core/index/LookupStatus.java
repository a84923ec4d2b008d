package com.quantori.faves.core.index;

public enum LookupStatus {
  MATCH,
  /** The canonical form is present but no record agrees with the secondary hash. */
  AMBIGUOUS,
  MISS
}
