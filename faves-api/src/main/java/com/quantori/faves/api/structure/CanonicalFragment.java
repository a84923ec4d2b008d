package com.quantori.faves.api.structure;

/**
 * Canonical serialization of one connected fragment.
 *
 * @param smiles      canonical SMILES without stereo descriptors
 * @param stereoLayer tetrahedral descriptors keyed by canonical rank
 */
public record CanonicalFragment(String smiles, String stereoLayer)
    implements Comparable<CanonicalFragment> {

  @Override
  public int compareTo(CanonicalFragment other) {
    int bySmiles = smiles.compareTo(other.smiles);
    return bySmiles != 0 ? bySmiles : stereoLayer.compareTo(other.stereoLayer);
  }
}
