package com.quantori.faves.api;

import lombok.Getter;

/**
 * Malformed structure text. Raised per query and never fatal for the process.
 */
@Getter
public class StructureParseException extends FavesException {
  /** Character offset in the input where the problem was detected, or -1 if unknown. */
  private final int position;

  public StructureParseException(String message, int position) {
    super(position >= 0 ? String.format("%s at position %d", message, position) : message);
    this.position = position;
  }

  public StructureParseException(String message) {
    this(message, -1);
  }
}
