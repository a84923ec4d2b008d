package com.quantori.faves.api.structure;

import com.quantori.faves.api.model.Molecule;
import lombok.Value;

/**
 * A normalized molecular graph together with its exact-match keys.
 */
@Value
public class NormalizedStructure {
  Molecule molecule;
  String canonicalForm;
  /** Canonical tetrahedral descriptors, empty when the structure defines no stereocentre. */
  String stereoLayer;
  String secondaryHash;

  public boolean isStereoDefined() {
    return !stereoLayer.isEmpty();
  }
}
