package com.quantori.faves.core.index;

import com.quantori.faves.api.FavesException;

/**
 * A reference snapshot could not be read. Fatal at startup.
 */
public class IndexLoadException extends FavesException {
  public IndexLoadException(String message) {
    super(message);
  }

  public IndexLoadException(String message, Throwable cause) {
    super(message, cause);
  }
}
