package com.quantori.faves.api.model;

/**
 * Tetrahedral configuration relative to the order in which neighbours were written.
 */
public enum Chirality {
  NONE,
  /** {@code @}: the remaining neighbours appear anticlockwise when viewed from the first one. */
  ANTICLOCKWISE,
  /** {@code @@}. */
  CLOCKWISE
}
