package com.quantori.faves.api.structure;

import com.quantori.faves.api.model.Atom;
import com.quantori.faves.api.model.Chirality;
import com.quantori.faves.api.model.Molecule;
import com.quantori.faves.api.smiles.SmilesWriter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.StringJoiner;

/**
 * Canonical labelling of a connected molecule.
 *
 * <p>Atoms are first partitioned by their invariants (atomic number, charge, degree, hydrogen
 * count, isotope, aromaticity, ring membership) and the partition is refined by neighbour ranks and
 * bond orders until stable. When classes remain tied, every member of the first tied class is
 * individualized in turn, the remaining ties are broken towards the lowest atom index, and the
 * labelling with the lexicographically smallest serialization wins.
 */
public final class Canonicalizer {
  private final Molecule molecule;
  private final int[][] neighborCodes;

  private Canonicalizer(Molecule molecule) {
    this.molecule = molecule;
    int n = molecule.atomCount();
    neighborCodes = new int[n][];
    for (int atom = 0; atom < n; atom++) {
      int[] incident = molecule.incidentBonds(atom);
      neighborCodes[atom] = new int[incident.length];
      for (int i = 0; i < incident.length; i++) {
        neighborCodes[atom][i] = molecule.bond(incident[i]).getOrder().ordinal() + 1;
      }
    }
  }

  /**
   * Computes the canonical serialization of a connected, normalized molecule.
   *
   * @param fragment connected molecule
   * @return canonical SMILES and stereo layer
   */
  public static CanonicalFragment canonicalize(Molecule fragment) {
    return new Canonicalizer(fragment).run();
  }

  private CanonicalFragment run() {
    int n = molecule.atomCount();
    if (n == 0) {
      return new CanonicalFragment("", "");
    }
    int[] symmetry = refine(initialRanks());
    if (isDiscrete(symmetry)) {
      return serialize(symmetry, symmetry);
    }
    CanonicalFragment best = null;
    for (int atom : firstTiedClass(symmetry)) {
      int[] ranks = refine(individualize(symmetry, atom));
      while (!isDiscrete(ranks)) {
        ranks = refine(individualize(ranks, firstTiedClass(ranks).get(0)));
      }
      CanonicalFragment candidate = serialize(ranks, symmetry);
      if (best == null || candidate.compareTo(best) < 0) {
        best = candidate;
      }
    }
    return best;
  }

  private int[] initialRanks() {
    int n = molecule.atomCount();
    int[][] invariants = new int[n][];
    for (int i = 0; i < n; i++) {
      Atom atom = molecule.atom(i);
      invariants[i] =
          new int[] {
            atom.getAtomicNumber(),
            atom.getCharge(),
            molecule.degree(i),
            atom.getHydrogenCount(),
            atom.getIsotope(),
            atom.isAromatic() ? 1 : 0,
            molecule.isRingAtom(i) ? 1 : 0
          };
    }
    return rankBy(invariants);
  }

  private int[] refine(int[] ranks) {
    int classes = countClasses(ranks);
    while (true) {
      int n = ranks.length;
      int[][] keys = new int[n][];
      for (int atom = 0; atom < n; atom++) {
        int[] neighbors = molecule.neighbors(atom);
        int[] key = new int[neighbors.length + 1];
        key[0] = ranks[atom];
        for (int i = 0; i < neighbors.length; i++) {
          key[i + 1] = ranks[neighbors[i]] * 8 + neighborCodes[atom][i];
        }
        Arrays.sort(key, 1, key.length);
        keys[atom] = key;
      }
      int[] refined = rankBy(keys);
      int refinedClasses = countClasses(refined);
      if (refinedClasses == classes) {
        return refined;
      }
      ranks = refined;
      classes = refinedClasses;
    }
  }

  /** Rank of each row is the number of rows strictly smaller than it. */
  private static int[] rankBy(int[][] keys) {
    Integer[] order = new Integer[keys.length];
    for (int i = 0; i < order.length; i++) {
      order[i] = i;
    }
    Comparator<Integer> byKey = (a, b) -> Arrays.compare(keys[a], keys[b]);
    Arrays.sort(order, byKey);
    int[] ranks = new int[keys.length];
    for (int i = 0; i < order.length; i++) {
      boolean tied = i > 0 && byKey.compare(order[i - 1], order[i]) == 0;
      ranks[order[i]] = tied ? ranks[order[i - 1]] : i;
    }
    return ranks;
  }

  private static int countClasses(int[] ranks) {
    return (int) Arrays.stream(ranks).distinct().count();
  }

  private static boolean isDiscrete(int[] ranks) {
    return countClasses(ranks) == ranks.length;
  }

  private static List<Integer> firstTiedClass(int[] ranks) {
    int[] sizes = new int[ranks.length];
    for (int rank : ranks) {
      sizes[rank]++;
    }
    int tied = -1;
    for (int rank = 0; rank < sizes.length; rank++) {
      if (sizes[rank] > 1) {
        tied = rank;
        break;
      }
    }
    List<Integer> members = new ArrayList<>();
    for (int atom = 0; atom < ranks.length; atom++) {
      if (ranks[atom] == tied) {
        members.add(atom);
      }
    }
    return members;
  }

  private static int[] individualize(int[] ranks, int atom) {
    int[] result = ranks.clone();
    for (int other = 0; other < ranks.length; other++) {
      if (other != atom && ranks[other] == ranks[atom]) {
        result[other] = ranks[atom] + 1;
      }
    }
    return result;
  }

  private CanonicalFragment serialize(int[] ranks, int[] symmetry) {
    return new CanonicalFragment(SmilesWriter.write(molecule, ranks), stereoLayer(ranks, symmetry));
  }

  /**
   * Tetrahedral descriptors relative to canonical ranks. A centre is described by its written
   * chirality combined with the parity of the permutation that sorts its written neighbour order
   * by rank, the implicit hydrogen or lone pair ranking lowest. Centres with two
   * symmetry-equivalent neighbours are not stereogenic and are skipped.
   */
  private String stereoLayer(int[] ranks, int[] symmetry) {
    List<int[]> centres = new ArrayList<>();
    for (int atom = 0; atom < molecule.atomCount(); atom++) {
      Atom centre = molecule.atom(atom);
      if (centre.getChirality() == Chirality.NONE) {
        continue;
      }
      List<Integer> order = centre.getStereoNeighbors();
      if (order.size() != 4 || !isStereogenic(order, symmetry)) {
        continue;
      }
      int[] keys = order.stream().mapToInt(n -> n < 0 ? -1 : ranks[n]).toArray();
      int parity = inversions(keys) % 2;
      int clockwise = centre.getChirality() == Chirality.CLOCKWISE ? 1 : 0;
      centres.add(new int[] {ranks[atom], clockwise ^ parity});
    }
    centres.sort(Comparator.comparingInt(entry -> entry[0]));
    StringJoiner layer = new StringJoiner(",");
    for (int[] entry : centres) {
      layer.add(entry[0] + (entry[1] == 1 ? "@@" : "@"));
    }
    return layer.toString();
  }

  private static boolean isStereogenic(List<Integer> order, int[] symmetry) {
    for (int i = 0; i < order.size(); i++) {
      for (int j = i + 1; j < order.size(); j++) {
        int a = order.get(i);
        int b = order.get(j);
        if ((a < 0 && b < 0) || (a >= 0 && b >= 0 && symmetry[a] == symmetry[b])) {
          return false;
        }
      }
    }
    return true;
  }

  private static int inversions(int[] keys) {
    int count = 0;
    for (int i = 0; i < keys.length; i++) {
      for (int j = i + 1; j < keys.length; j++) {
        if (keys[i] > keys[j]) {
          count++;
        }
      }
    }
    return count;
  }
}
