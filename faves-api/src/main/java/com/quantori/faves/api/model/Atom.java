package com.quantori.faves.api.model;

import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * An atom of a molecular graph. Hydrogens are normally carried as a count rather than as separate
 * atoms.
 */
@Value
@Builder(toBuilder = true)
public class Atom {
  int atomicNumber;
  int charge;
  /** Mass number, 0 when unspecified. */
  int isotope;
  int hydrogenCount;
  boolean aromatic;
  @Builder.Default Chirality chirality = Chirality.NONE;

  /**
   * Neighbour atom indices in the order they were written, used to interpret {@link #chirality}.
   * An entry of -1 stands for the implicit hydrogen.
   */
  @Builder.Default List<Integer> stereoNeighbors = List.of();

  public String symbol() {
    return PeriodicTable.symbol(atomicNumber);
  }

  public boolean isHydrogen() {
    return atomicNumber == PeriodicTable.HYDROGEN;
  }
}
