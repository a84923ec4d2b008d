package com.quantori.faves.api;

/**
 * A generic error raised by the classification core when a structure, a reference snapshot or a
 * pattern cannot be processed.
 */
public class FavesException extends RuntimeException {
  /**
   * Constructs a {@code FavesException} with the specified detail message.
   *
   * @param message the detail message, or null
   */
  public FavesException(String message) {
    super(message);
  }

  /**
   * Constructs a {@code FavesException} as a wrapper of original error.
   *
   * @param t original error
   */
  public FavesException(Throwable t) {
    super(t);
  }

  /**
   * Constructs a {@code FavesException} with the specified detail message and cause.
   *
   * @param message the detail message, or null
   * @param cause   the cause
   */
  public FavesException(String message, Throwable cause) {
    super(message, cause);
  }
}
