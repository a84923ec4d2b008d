package com.quantori.faves.api.match;

import com.quantori.faves.api.model.Molecule;
import com.quantori.faves.api.query.QueryMolecule;

/**
 * A molecules matcher for substructure search.
 * <p>
 * Checks whether a query graph is contained in a molecule. The containment need not be induced:
 * target atoms mapped to non-adjacent query atoms may still be bonded.
 */
public interface MoleculesMatcher {
  /** Deadline value meaning the search is never abandoned. */
  long NO_DEADLINE = Long.MAX_VALUE;

  /**
   * Checks a molecule against a substructure query.
   *
   * @param target        a normalized molecule
   * @param query         a compiled query
   * @param deadlineNanos {@link System#nanoTime()} value after which the search is abandoned, or
   *                      {@link #NO_DEADLINE}
   * @return true if the query maps into the molecule, otherwise false
   * @throws MatchTimeoutException if the deadline passes or the thread is interrupted first
   */
  boolean isSubstructureMatch(Molecule target, QueryMolecule query, long deadlineNanos)
      throws MatchTimeoutException;

  /**
   * Checks a molecule against a substructure query without a deadline.
   */
  default boolean isSubstructureMatch(Molecule target, QueryMolecule query) {
    try {
      return isSubstructureMatch(target, query, NO_DEADLINE);
    } catch (MatchTimeoutException e) {
      throw new IllegalStateException("Unbounded match interrupted", e);
    }
  }
}
