package com.quantori.faves.api.match;

import java.util.concurrent.TimeoutException;

/**
 * A substructure search ran past its deadline or its thread was interrupted.
 */
public class MatchTimeoutException extends TimeoutException {
  public MatchTimeoutException(String message) {
    super(message);
  }
}
