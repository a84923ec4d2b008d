package com.quantori.faves.api.model;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Ring perception: ring bonds are the non-bridge bonds of the graph, and the smallest set of
 * smallest rings is selected from Horton candidate cycles by Gaussian elimination over their bond
 * sets.
 */
public final class RingInfo {
  private final boolean[] ringAtom;
  private final boolean[] ringBond;
  private final List<int[]> rings;
  private final List<BitSet> ringBonds;
  private final int[] membership;
  private final int[] smallestRing;
  private final int[] ringConnectivity;

  private RingInfo(int atomCount, int bondCount) {
    ringAtom = new boolean[atomCount];
    ringBond = new boolean[bondCount];
    rings = new ArrayList<>();
    ringBonds = new ArrayList<>();
    membership = new int[atomCount];
    smallestRing = new int[atomCount];
    ringConnectivity = new int[atomCount];
  }

  static RingInfo perceive(Molecule molecule) {
    RingInfo info = new RingInfo(molecule.atomCount(), molecule.bondCount());
    int cyclomatic = molecule.bondCount() - molecule.atomCount() + molecule.componentCount();
    if (cyclomatic <= 0) {
      return info;
    }
    info.markRingBonds(molecule);
    info.selectSmallestRings(molecule, cyclomatic);
    return info;
  }

  private void markRingBonds(Molecule molecule) {
    int n = molecule.atomCount();
    int[] discovery = new int[n];
    int[] low = new int[n];
    Arrays.fill(discovery, -1);
    int[] time = {0};
    for (int start = 0; start < n; start++) {
      if (discovery[start] < 0) {
        findBridges(molecule, start, -1, discovery, low, time);
      }
    }
    for (int b = 0; b < ringBond.length; b++) {
      if (ringBond[b]) {
        Bond bond = molecule.bond(b);
        ringAtom[bond.getBegin()] = true;
        ringAtom[bond.getEnd()] = true;
        ringConnectivity[bond.getBegin()]++;
        ringConnectivity[bond.getEnd()]++;
      }
    }
  }

  private void findBridges(
      Molecule molecule, int atom, int viaBond, int[] discovery, int[] low, int[] time) {
    discovery[atom] = low[atom] = time[0]++;
    int[] adjacent = molecule.neighbors(atom);
    int[] incident = molecule.incidentBonds(atom);
    for (int i = 0; i < adjacent.length; i++) {
      int next = adjacent[i];
      int bond = incident[i];
      if (bond == viaBond) {
        continue;
      }
      if (discovery[next] < 0) {
        findBridges(molecule, next, bond, discovery, low, time);
        low[atom] = Math.min(low[atom], low[next]);
        // not a bridge: the subtree reaches back above this atom
        ringBond[bond] = low[next] <= discovery[atom];
      } else {
        low[atom] = Math.min(low[atom], discovery[next]);
        ringBond[bond] = true;
      }
    }
  }

  private void selectSmallestRings(Molecule molecule, int cyclomatic) {
    List<int[]> candidates = hortonCandidates(molecule);
    candidates.sort(Comparator.<int[]>comparingInt(cycle -> cycle.length));
    Map<Integer, BitSet> basis = new HashMap<>();
    for (int[] cycle : candidates) {
      if (rings.size() == cyclomatic) {
        break;
      }
      BitSet bondSet = bondSet(molecule, cycle);
      if (isIndependent((BitSet) bondSet.clone(), basis)) {
        rings.add(cycle);
        ringBonds.add(bondSet);
        for (int atom : cycle) {
          membership[atom]++;
          if (smallestRing[atom] == 0 || cycle.length < smallestRing[atom]) {
            smallestRing[atom] = cycle.length;
          }
        }
      }
    }
  }

  private static boolean isIndependent(BitSet vector, Map<Integer, BitSet> basis) {
    while (true) {
      int pivot = vector.nextSetBit(0);
      if (pivot < 0) {
        return false;
      }
      BitSet reducer = basis.get(pivot);
      if (reducer == null) {
        basis.put(pivot, vector);
        return true;
      }
      vector.xor(reducer);
    }
  }

  private List<int[]> hortonCandidates(Molecule molecule) {
    int n = molecule.atomCount();
    List<int[]> candidates = new ArrayList<>();
    Set<BitSet> seen = new HashSet<>();
    int[] parent = new int[n];
    for (int root = 0; root < n; root++) {
      if (!ringAtom[root]) {
        continue;
      }
      Arrays.fill(parent, -2);
      parent[root] = -1;
      Deque<Integer> queue = new ArrayDeque<>();
      queue.add(root);
      while (!queue.isEmpty()) {
        int atom = queue.poll();
        int[] adjacent = molecule.neighbors(atom);
        int[] incident = molecule.incidentBonds(atom);
        for (int i = 0; i < adjacent.length; i++) {
          if (ringBond[incident[i]] && parent[adjacent[i]] == -2) {
            parent[adjacent[i]] = atom;
            queue.add(adjacent[i]);
          }
        }
      }
      for (int b = 0; b < ringBond.length; b++) {
        if (!ringBond[b]) {
          continue;
        }
        Bond bond = molecule.bond(b);
        int x = bond.getBegin();
        int y = bond.getEnd();
        if (parent[x] == -2 || parent[y] == -2 || parent[x] == y || parent[y] == x) {
          continue;
        }
        List<Integer> pathX = pathToRoot(x, parent);
        List<Integer> pathY = pathToRoot(y, parent);
        Set<Integer> shared = new HashSet<>(pathX);
        shared.retainAll(pathY);
        if (shared.size() != 1) {
          continue;
        }
        int[] cycle = new int[pathX.size() + pathY.size() - 1];
        int k = 0;
        for (int i = pathX.size() - 1; i >= 0; i--) {
          cycle[k++] = pathX.get(i);
        }
        for (int i = 0; i < pathY.size() - 1; i++) {
          cycle[k++] = pathY.get(i);
        }
        if (seen.add(bondSet(molecule, cycle))) {
          candidates.add(cycle);
        }
      }
    }
    return candidates;
  }

  private static List<Integer> pathToRoot(int atom, int[] parent) {
    List<Integer> path = new ArrayList<>();
    for (int current = atom; current >= 0; current = parent[current]) {
      path.add(current);
    }
    return path;
  }

  private static BitSet bondSet(Molecule molecule, int[] cycle) {
    BitSet set = new BitSet(molecule.bondCount());
    for (int i = 0; i < cycle.length; i++) {
      set.set(molecule.bondIndex(cycle[i], cycle[(i + 1) % cycle.length]));
    }
    return set;
  }

  public boolean isRingAtom(int atom) {
    return ringAtom[atom];
  }

  public boolean isRingBond(int bond) {
    return ringBond[bond];
  }

  /** Smallest set of smallest rings, each as atom indices in cyclic order. */
  public List<int[]> rings() {
    return rings;
  }

  /** Bond index sets parallel to {@link #rings()}. */
  public List<BitSet> ringBondSets() {
    return ringBonds;
  }

  /** Number of smallest rings the atom belongs to. */
  public int membership(int atom) {
    return membership[atom];
  }

  /** Size of the smallest ring containing the atom, 0 for chain atoms. */
  public int smallestRingSize(int atom) {
    return smallestRing[atom];
  }

  public boolean isInRingOfSize(int atom, int size) {
    for (int[] ring : rings) {
      if (ring.length == size) {
        for (int member : ring) {
          if (member == atom) {
            return true;
          }
        }
      }
    }
    return false;
  }

  /** Number of ring bonds at the atom. */
  public int ringConnectivity(int atom) {
    return ringConnectivity[atom];
  }
}
