package com.quantori.faves.core.util;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import lombok.experimental.UtilityClass;
import org.apache.commons.lang3.StringUtils;

/**
 * Opens snapshot locations written either as file paths or as {@code classpath:} resources.
 */
@UtilityClass
public final class ResourceLocations {
  public static final String CLASSPATH_PREFIX = "classpath:";

  public static InputStream open(String location) throws IOException {
    if (StringUtils.isBlank(location)) {
      throw new FileNotFoundException("Location is not set");
    }
    if (location.startsWith(CLASSPATH_PREFIX)) {
      String resource = StringUtils.removeStart(location.substring(CLASSPATH_PREFIX.length()), "/");
      InputStream stream = ResourceLocations.class.getClassLoader().getResourceAsStream(resource);
      if (stream == null) {
        throw new FileNotFoundException("Classpath resource not found: " + resource);
      }
      return stream;
    }
    return Files.newInputStream(Path.of(location));
  }
}
