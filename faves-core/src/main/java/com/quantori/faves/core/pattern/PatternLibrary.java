package com.quantori.faves.core.pattern;

import com.quantori.faves.api.StructureParseException;
import com.quantori.faves.api.query.QueryMolecule;
import com.quantori.faves.api.query.SmartsParser;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.apache.commons.lang3.StringUtils;

/**
 * Ordered, immutable collection of compiled scaffold patterns. Order only affects reporting.
 */
public final class PatternLibrary {
  private final List<CompiledPattern> patterns;

  private PatternLibrary(List<CompiledPattern> patterns) {
    this.patterns = List.copyOf(patterns);
  }

  /**
   * Compiles pattern definitions.
   *
   * @param definitions patterns in reporting order
   * @return the compiled library
   * @throws PatternCompileException if a definition is missing, incomplete, duplicated,
   *                                 unparseable, empty or disconnected
   */
  public static PatternLibrary compile(List<ScaffoldPattern> definitions) {
    List<CompiledPattern> compiled = new ArrayList<>(definitions.size());
    Set<String> ids = new HashSet<>();
    for (int index = 0; index < definitions.size(); index++) {
      ScaffoldPattern definition = definitions.get(index);
      if (definition == null) {
        throw new PatternCompileException("Pattern definition " + index + " is empty");
      }
      if (StringUtils.isBlank(definition.id())) {
        throw new PatternCompileException("Pattern without id: " + definition);
      }
      if (!ids.add(definition.id())) {
        throw new PatternCompileException("Duplicate pattern id " + definition.id());
      }
      if (definition.drugClass() == null) {
        throw new PatternCompileException("Pattern " + definition.id() + " has no drug class");
      }
      QueryMolecule query;
      try {
        query = SmartsParser.parse(definition.smarts());
      } catch (StructureParseException e) {
        throw new PatternCompileException(
            "Pattern " + definition.id() + " is malformed: " + e.getMessage(), e);
      }
      if (!query.isConnected()) {
        throw new PatternCompileException("Pattern " + definition.id() + " is not connected");
      }
      compiled.add(
          new CompiledPattern(
              definition.id(),
              StringUtils.defaultIfBlank(definition.name(), definition.id()),
              definition.drugClass(),
              definition.smarts(),
              query));
    }
    return new PatternLibrary(compiled);
  }

  public List<CompiledPattern> patterns() {
    return patterns;
  }

  public int size() {
    return patterns.size();
  }
}
