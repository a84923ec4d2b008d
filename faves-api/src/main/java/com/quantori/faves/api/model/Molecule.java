package com.quantori.faves.api.model;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Immutable molecular graph. The graph is simple: at most one bond joins any pair of atoms.
 * Adjacency and ring information are computed once on construction.
 */
public final class Molecule {
  private final List<Atom> atoms;
  private final List<Bond> bonds;
  private final int[][] neighbors;
  private final int[][] incidentBonds;
  private final int[] component;
  private final int componentCount;
  private final RingInfo rings;

  public Molecule(List<Atom> atoms, List<Bond> bonds) {
    this.atoms = List.copyOf(atoms);
    this.bonds = List.copyOf(bonds);
    int n = atoms.size();
    int[] degree = new int[n];
    for (Bond bond : bonds) {
      degree[bond.getBegin()]++;
      degree[bond.getEnd()]++;
    }
    neighbors = new int[n][];
    incidentBonds = new int[n][];
    for (int i = 0; i < n; i++) {
      neighbors[i] = new int[degree[i]];
      incidentBonds[i] = new int[degree[i]];
    }
    int[] fill = new int[n];
    for (int b = 0; b < bonds.size(); b++) {
      Bond bond = bonds.get(b);
      int u = bond.getBegin();
      int v = bond.getEnd();
      neighbors[u][fill[u]] = v;
      incidentBonds[u][fill[u]++] = b;
      neighbors[v][fill[v]] = u;
      incidentBonds[v][fill[v]++] = b;
    }
    component = new int[n];
    componentCount = labelComponents();
    rings = RingInfo.perceive(this);
  }

  private int labelComponents() {
    Arrays.fill(component, -1);
    int count = 0;
    Deque<Integer> queue = new ArrayDeque<>();
    for (int start = 0; start < atoms.size(); start++) {
      if (component[start] >= 0) {
        continue;
      }
      component[start] = count;
      queue.add(start);
      while (!queue.isEmpty()) {
        int atom = queue.poll();
        for (int next : neighbors[atom]) {
          if (component[next] < 0) {
            component[next] = count;
            queue.add(next);
          }
        }
      }
      count++;
    }
    return count;
  }

  public int atomCount() {
    return atoms.size();
  }

  public int bondCount() {
    return bonds.size();
  }

  public Atom atom(int index) {
    return atoms.get(index);
  }

  public Bond bond(int index) {
    return bonds.get(index);
  }

  public List<Atom> atoms() {
    return atoms;
  }

  public List<Bond> bonds() {
    return bonds;
  }

  public int[] neighbors(int atom) {
    return neighbors[atom];
  }

  /** Indices of the bonds incident to an atom, parallel to {@link #neighbors(int)}. */
  public int[] incidentBonds(int atom) {
    return incidentBonds[atom];
  }

  public int degree(int atom) {
    return neighbors[atom].length;
  }

  /** Degree plus hydrogen count. */
  public int connectivity(int atom) {
    return neighbors[atom].length + atoms.get(atom).getHydrogenCount();
  }

  /**
   * Index of the bond joining two atoms.
   *
   * @return bond index or -1 when the atoms are not bonded
   */
  public int bondIndex(int a, int b) {
    int[] adjacent = neighbors[a];
    for (int i = 0; i < adjacent.length; i++) {
      if (adjacent[i] == b) {
        return incidentBonds[a][i];
      }
    }
    return -1;
  }

  public Bond bondBetween(int a, int b) {
    int index = bondIndex(a, b);
    return index < 0 ? null : bonds.get(index);
  }

  /** Sum of bond valences at an atom, aromatic bonds counting one each. */
  public int bondOrderSum(int atom) {
    int sum = 0;
    for (int b : incidentBonds[atom]) {
      sum += bonds.get(b).getOrder().getValence();
    }
    return sum;
  }

  public int componentOf(int atom) {
    return component[atom];
  }

  public int componentCount() {
    return componentCount;
  }

  public RingInfo rings() {
    return rings;
  }

  public boolean isRingAtom(int atom) {
    return rings.isRingAtom(atom);
  }

  public boolean isRingBond(int bond) {
    return rings.isRingBond(bond);
  }

  /**
   * Splits the graph into its connected components, each in order of the lowest atom index it
   * contains. A connected molecule is returned as a single element list containing itself.
   */
  public List<Molecule> fragments() {
    if (componentCount <= 1) {
      return List.of(this);
    }
    List<Molecule> result = new ArrayList<>(componentCount);
    for (int c = 0; c < componentCount; c++) {
      int[] mapping = new int[atoms.size()];
      List<Atom> fragmentAtoms = new ArrayList<>();
      for (int i = 0; i < atoms.size(); i++) {
        mapping[i] = component[i] == c ? fragmentAtoms.size() : -1;
        if (component[i] == c) {
          fragmentAtoms.add(atoms.get(i));
        }
      }
      result.add(remap(fragmentAtoms, mapping));
    }
    return result;
  }

  /**
   * Builds a new molecule from the atoms kept by {@code mapping} (old index to new index, -1 to
   * drop). Bonds to dropped atoms are removed and stereo neighbour lists are renumbered.
   */
  public Molecule remap(List<Atom> keptAtoms, int[] mapping) {
    UnaryOperator<Integer> renumber = old -> old < 0 ? old : mapping[old];
    List<Atom> renumbered = new ArrayList<>(keptAtoms.size());
    for (Atom atom : keptAtoms) {
      if (atom.getStereoNeighbors().isEmpty()) {
        renumbered.add(atom);
      } else {
        List<Integer> order = new ArrayList<>();
        for (Integer neighbor : atom.getStereoNeighbors()) {
          order.add(renumber.apply(neighbor));
        }
        renumbered.add(atom.toBuilder().stereoNeighbors(List.copyOf(order)).build());
      }
    }
    List<Bond> keptBonds = new ArrayList<>();
    for (Bond bond : bonds) {
      int begin = mapping[bond.getBegin()];
      int end = mapping[bond.getEnd()];
      if (begin >= 0 && end >= 0) {
        keptBonds.add(bond.toBuilder().begin(begin).end(end).build());
      }
    }
    return new Molecule(renumbered, keptBonds);
  }

  /** Molecular formula-style element counts indexed by atomic number. */
  public int[] elementCounts() {
    int[] counts = new int[PeriodicTable.maxAtomicNumber() + 1];
    for (Atom atom : atoms) {
      counts[atom.getAtomicNumber()]++;
    }
    return counts;
  }

  @Override
  public String toString() {
    return "Molecule{atoms=" + atoms.size() + ", bonds=" + bonds.size() + "}";
  }
}
