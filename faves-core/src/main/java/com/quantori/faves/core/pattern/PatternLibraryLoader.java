package com.quantori.faves.core.pattern;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.quantori.faves.core.util.ResourceLocations;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * Reads the pattern library snapshot, a JSON array of {@link ScaffoldPattern} objects.
 */
@Slf4j
public class PatternLibraryLoader {
  private final ObjectMapper objectMapper = new ObjectMapper();

  public PatternLibrary load(String location) {
    List<ScaffoldPattern> definitions;
    try (InputStream stream = ResourceLocations.open(location)) {
      definitions = objectMapper.readValue(stream, new TypeReference<List<ScaffoldPattern>>() {});
    } catch (IOException e) {
      throw new PatternCompileException("Unable to read pattern library " + location, e);
    }
    if (definitions == null || definitions.isEmpty()) {
      throw new PatternCompileException("Pattern library " + location + " is empty");
    }
    PatternLibrary library = PatternLibrary.compile(definitions);
    log.info("Compiled {} scaffold patterns from {}", library.size(), location);
    return library;
  }
}
