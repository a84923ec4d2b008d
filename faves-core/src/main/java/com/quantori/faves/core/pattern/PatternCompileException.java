package com.quantori.faves.core.pattern;

import com.quantori.faves.api.FavesException;

/**
 * The pattern library could not be read or a pattern is malformed. Fatal at startup.
 */
public class PatternCompileException extends FavesException {
  public PatternCompileException(String message) {
    super(message);
  }

  public PatternCompileException(String message, Throwable cause) {
    super(message, cause);
  }
}
