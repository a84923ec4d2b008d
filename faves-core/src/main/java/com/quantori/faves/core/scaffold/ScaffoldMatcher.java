package com.quantori.faves.core.scaffold;

import com.quantori.faves.api.match.MatchTimeoutException;
import com.quantori.faves.api.match.MoleculesMatcher;
import com.quantori.faves.api.model.Molecule;
import com.quantori.faves.core.pattern.CompiledPattern;
import com.quantori.faves.core.pattern.DrugClass;
import com.quantori.faves.core.pattern.PatternLibrary;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs every pattern of the library against a candidate. Each disconnected fragment is a separate
 * candidate unit, and each (candidate, pattern) pair is bounded by its own deadline; a pattern that
 * runs out of time is reported as not matched.
 */
@Slf4j
public class ScaffoldMatcher {
  @Getter private final PatternLibrary library;
  private final MoleculesMatcher matcher;
  private final Duration timeout;

  public ScaffoldMatcher(PatternLibrary library, MoleculesMatcher matcher, Duration timeout) {
    if (timeout.isNegative() || timeout.isZero()) {
      throw new IllegalArgumentException("Match timeout must be positive: " + timeout);
    }
    this.library = library;
    this.matcher = matcher;
    this.timeout = timeout;
  }

  /**
   * Tests one pattern against a candidate.
   *
   * @param candidate normalized molecule, possibly with several fragments
   * @param pattern   compiled pattern
   * @return true if some fragment contains the pattern
   * @throws MatchTimeoutException if the pair's deadline passes first
   */
  public boolean matches(Molecule candidate, CompiledPattern pattern) throws MatchTimeoutException {
    return matches(candidate.fragments(), pattern, System.nanoTime() + timeout.toNanos());
  }

  /**
   * Evaluates every pattern of the library.
   *
   * @param candidate normalized molecule
   * @return matched and timed-out pattern ids
   */
  public ScaffoldReport matchAll(Molecule candidate) {
    List<Molecule> fragments = candidate.fragments();
    List<String> matched = new ArrayList<>();
    List<DrugClass> classes = new ArrayList<>();
    Map<DrugClass, String> firstByClass = new EnumMap<>(DrugClass.class);
    List<String> timedOut = new ArrayList<>();
    for (CompiledPattern pattern : library.patterns()) {
      try {
        if (matches(fragments, pattern, System.nanoTime() + timeout.toNanos())) {
          matched.add(pattern.getId());
          if (!firstByClass.containsKey(pattern.getDrugClass())) {
            firstByClass.put(pattern.getDrugClass(), pattern.getId());
            classes.add(pattern.getDrugClass());
          }
        }
      } catch (MatchTimeoutException e) {
        log.warn(
            "Scaffold pattern {} abandoned after {} ms, confidence degraded: {}",
            pattern.getId(),
            timeout.toMillis(),
            e.getMessage());
        timedOut.add(pattern.getId());
      }
    }
    return new ScaffoldReport(
        List.copyOf(matched),
        List.copyOf(classes),
        Collections.unmodifiableMap(firstByClass),
        List.copyOf(timedOut));
  }

  private boolean matches(List<Molecule> fragments, CompiledPattern pattern, long deadline)
      throws MatchTimeoutException {
    for (Molecule fragment : fragments) {
      if (matcher.isSubstructureMatch(fragment, pattern.getQuery(), deadline)) {
        return true;
      }
    }
    return false;
  }
}
