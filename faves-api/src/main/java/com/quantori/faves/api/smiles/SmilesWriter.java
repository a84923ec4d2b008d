package com.quantori.faves.api.smiles;

import com.quantori.faves.api.model.Atom;
import com.quantori.faves.api.model.Bond;
import com.quantori.faves.api.model.Hydrogens;
import com.quantori.faves.api.model.Molecule;
import com.quantori.faves.api.model.PeriodicTable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Writes a connected molecule as SMILES following a total order on its atoms. Traversal starts at
 * the lowest ranked atom and visits neighbours in rank order; ring closures take the lowest free
 * digit. Stereo descriptors are not written.
 */
public final class SmilesWriter {
  private static final int MAX_RING_NUMBER = 99;

  private final Molecule molecule;
  private final int[] ranks;
  private final int[][] orderedNeighbors;
  private final boolean[] visited;
  private final boolean[] closure;
  private final int[] parentBond;
  private final List<List<Integer>> children;
  private final boolean[] written;
  private final int[] ringNumber;
  private final boolean[] ringNumberInUse = new boolean[MAX_RING_NUMBER + 1];
  private final StringBuilder out = new StringBuilder();

  private SmilesWriter(Molecule molecule, int[] ranks) {
    this.molecule = molecule;
    this.ranks = ranks;
    int n = molecule.atomCount();
    orderedNeighbors = new int[n][];
    for (int atom = 0; atom < n; atom++) {
      orderedNeighbors[atom] =
          Arrays.stream(molecule.neighbors(atom))
              .boxed()
              .sorted(Comparator.comparingInt(neighbor -> ranks[neighbor]))
              .mapToInt(Integer::intValue)
              .toArray();
    }
    visited = new boolean[n];
    written = new boolean[n];
    parentBond = new int[n];
    Arrays.fill(parentBond, -1);
    children = new ArrayList<>(n);
    for (int atom = 0; atom < n; atom++) {
      children.add(new ArrayList<>(3));
    }
    closure = new boolean[molecule.bondCount()];
    ringNumber = new int[molecule.bondCount()];
  }

  /**
   * Serializes a connected molecule.
   *
   * @param molecule a connected molecule
   * @param ranks    distinct rank per atom
   * @return SMILES text
   */
  public static String write(Molecule molecule, int[] ranks) {
    if (molecule.atomCount() == 0) {
      return "";
    }
    SmilesWriter writer = new SmilesWriter(molecule, ranks);
    int start = 0;
    for (int atom = 1; atom < ranks.length; atom++) {
      if (ranks[atom] < ranks[start]) {
        start = atom;
      }
    }
    writer.findClosures(start);
    writer.writeAtom(start);
    return writer.out.toString();
  }

  private void findClosures(int atom) {
    visited[atom] = true;
    for (int next : orderedNeighbors[atom]) {
      int bond = molecule.bondIndex(atom, next);
      if (bond == parentBond[atom]) {
        continue;
      }
      if (!visited[next]) {
        parentBond[next] = bond;
        children.get(atom).add(next);
        findClosures(next);
      } else {
        closure[bond] = true;
      }
    }
  }

  private void writeAtom(int atom) {
    written[atom] = true;
    out.append(atomToken(atom));
    List<Integer> opening = new ArrayList<>();
    for (int next : orderedNeighbors[atom]) {
      int bond = molecule.bondIndex(atom, next);
      if (!closure[bond]) {
        continue;
      }
      if (written[next]) {
        out.append(ringLabel(ringNumber[bond]));
        ringNumberInUse[ringNumber[bond]] = false;
      } else {
        opening.add(bond);
      }
    }
    for (int bond : opening) {
      int number = lowestFreeRingNumber();
      ringNumber[bond] = number;
      ringNumberInUse[number] = true;
      out.append(bondSymbol(molecule.bond(bond))).append(ringLabel(number));
    }
    List<Integer> branches = children.get(atom);
    for (int i = 0; i < branches.size(); i++) {
      int child = branches.get(i);
      boolean last = i == branches.size() - 1;
      if (!last) {
        out.append('(');
      }
      out.append(bondSymbol(molecule.bond(parentBond[child])));
      writeAtom(child);
      if (!last) {
        out.append(')');
      }
    }
  }

  private int lowestFreeRingNumber() {
    for (int number = 1; number <= MAX_RING_NUMBER; number++) {
      if (!ringNumberInUse[number]) {
        return number;
      }
    }
    throw new IllegalStateException("Too many open ring bonds");
  }

  private static String ringLabel(int number) {
    return number < 10 ? Integer.toString(number) : "%" + number;
  }

  private String bondSymbol(Bond bond) {
    boolean aromaticEnds =
        molecule.atom(bond.getBegin()).isAromatic() && molecule.atom(bond.getEnd()).isAromatic();
    return switch (bond.getOrder()) {
      case SINGLE -> aromaticEnds ? "-" : "";
      case AROMATIC -> aromaticEnds ? "" : ":";
      default -> bond.getOrder().getSymbol();
    };
  }

  private String atomToken(int index) {
    Atom atom = molecule.atom(index);
    int element = atom.getAtomicNumber();
    String symbol = atom.symbol();
    if (atom.isAromatic()) {
      symbol = symbol.toLowerCase(Locale.ROOT);
    }
    boolean organic = element == 0 || PeriodicTable.isOrganicSubset(element);
    int implied =
        element == 0
            ? 0
            : Hydrogens.implicitCount(element, atom.isAromatic(), molecule.bondOrderSum(index));
    if (organic && atom.getCharge() == 0 && atom.getIsotope() == 0
        && implied == atom.getHydrogenCount()) {
      return symbol;
    }
    StringBuilder token = new StringBuilder("[");
    if (atom.getIsotope() > 0) {
      token.append(atom.getIsotope());
    }
    token.append(symbol);
    if (atom.getHydrogenCount() > 0) {
      token.append('H');
      if (atom.getHydrogenCount() > 1) {
        token.append(atom.getHydrogenCount());
      }
    }
    int charge = atom.getCharge();
    if (charge != 0) {
      token.append(charge > 0 ? '+' : '-');
      if (Math.abs(charge) > 1) {
        token.append(Math.abs(charge));
      }
    }
    return token.append(']').toString();
  }
}
