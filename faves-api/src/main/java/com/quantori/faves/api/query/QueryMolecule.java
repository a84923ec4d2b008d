package com.quantori.faves.api.query;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Substructure query graph: atom and bond expressions over a simple graph.
 */
public final class QueryMolecule {
  private final List<AtomExpression> atoms;
  private final List<QueryBond> bonds;
  private final int[][] neighbors;
  private final int[][] incidentBonds;

  public QueryMolecule(List<AtomExpression> atoms, List<QueryBond> bonds) {
    this.atoms = List.copyOf(atoms);
    this.bonds = List.copyOf(bonds);
    int[] degree = new int[atoms.size()];
    for (QueryBond bond : bonds) {
      degree[bond.begin()]++;
      degree[bond.end()]++;
    }
    neighbors = new int[atoms.size()][];
    incidentBonds = new int[atoms.size()][];
    for (int i = 0; i < degree.length; i++) {
      neighbors[i] = new int[degree[i]];
      incidentBonds[i] = new int[degree[i]];
    }
    int[] fill = new int[atoms.size()];
    for (int b = 0; b < bonds.size(); b++) {
      QueryBond bond = bonds.get(b);
      neighbors[bond.begin()][fill[bond.begin()]] = bond.end();
      incidentBonds[bond.begin()][fill[bond.begin()]++] = b;
      neighbors[bond.end()][fill[bond.end()]] = bond.begin();
      incidentBonds[bond.end()][fill[bond.end()]++] = b;
    }
  }

  public int atomCount() {
    return atoms.size();
  }

  public int bondCount() {
    return bonds.size();
  }

  public AtomExpression atom(int index) {
    return atoms.get(index);
  }

  public QueryBond bond(int index) {
    return bonds.get(index);
  }

  public int[] neighbors(int atom) {
    return neighbors[atom];
  }

  public int[] incidentBonds(int atom) {
    return incidentBonds[atom];
  }

  public int degree(int atom) {
    return neighbors[atom].length;
  }

  public boolean isConnected() {
    if (atoms.isEmpty()) {
      return false;
    }
    boolean[] seen = new boolean[atoms.size()];
    Deque<Integer> queue = new ArrayDeque<>();
    queue.add(0);
    seen[0] = true;
    int count = 1;
    while (!queue.isEmpty()) {
      for (int next : neighbors[queue.poll()]) {
        if (!seen[next]) {
          seen[next] = true;
          count++;
          queue.add(next);
        }
      }
    }
    return count == atoms.size();
  }

  /**
   * Minimum number of atoms of each element a target must contain, indexed by atomic number.
   */
  public int[] requiredElementCounts(int size) {
    int[] counts = new int[size];
    for (AtomExpression atom : atoms) {
      int element = atom.requiredElement();
      if (element > 0 && element < size) {
        counts[element]++;
      }
    }
    return counts;
  }

  public record QueryBond(int begin, int end, BondExpression expression) {}
}
