package com.quantori.faves.api.model;

import lombok.experimental.UtilityClass;

/**
 * Implicit hydrogen rules shared by the SMILES reader and writer, so that a written structure reads
 * back with the same hydrogen counts.
 */
@UtilityClass
public final class Hydrogens {

  /**
   * Hydrogen count implied for an unbracketed atom.
   *
   * @param atomicNumber  element
   * @param aromatic      whether the atom is written in lowercase form
   * @param bondOrderSum  sum of bond valences, aromatic bonds counting one each
   * @return implied hydrogen count, or -1 when no standard valence accommodates the bonds
   */
  public static int implicitCount(int atomicNumber, boolean aromatic, int bondOrderSum) {
    if (aromatic) {
      int[] valences = PeriodicTable.standardValences(atomicNumber);
      if (valences.length == 0) {
        return 0;
      }
      return Math.max(0, valences[0] - bondOrderSum - 1);
    }
    int target = PeriodicTable.targetValence(atomicNumber, bondOrderSum);
    return target < 0 ? -1 : target - bondOrderSum;
  }
}
