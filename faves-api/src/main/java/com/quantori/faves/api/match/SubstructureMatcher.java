package com.quantori.faves.api.match;

import com.quantori.faves.api.model.Molecule;
import com.quantori.faves.api.model.PeriodicTable;
import com.quantori.faves.api.query.QueryMolecule;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;

/**
 * VF2-style subgraph monomorphism.
 *
 * <p>Query atoms are visited in breadth-first order starting from the most constrained atom, so
 * every atom after the first of its component has a mapped parent and its candidates are the
 * unmapped target neighbours of the parent's image. A candidate pair is feasible when the atom
 * expression holds, the target degree is large enough, every bond to an already mapped neighbour
 * exists and matches, and the target has at least as many unmapped neighbours as the query atom.
 * Searches are abandoned when a deadline passes, checked every {@value #CHECK_INTERVAL} steps.
 */
public class SubstructureMatcher implements MoleculesMatcher {
  private static final int CHECK_INTERVAL = 1024;

  @Override
  public boolean isSubstructureMatch(Molecule target, QueryMolecule query, long deadlineNanos)
      throws MatchTimeoutException {
    int queryAtoms = query.atomCount();
    int targetAtoms = target.atomCount();
    if (queryAtoms == 0) {
      return true;
    }
    if (queryAtoms > targetAtoms || query.bondCount() > target.bondCount()) {
      return false;
    }
    int[] required = query.requiredElementCounts(PeriodicTable.maxAtomicNumber() + 1);
    int[] available = target.elementCounts();
    for (int element = 0; element < required.length; element++) {
      if (required[element] > available[element]) {
        return false;
      }
    }
    boolean[][] compatible = new boolean[queryAtoms][targetAtoms];
    int[] candidateCount = new int[queryAtoms];
    for (int q = 0; q < queryAtoms; q++) {
      for (int t = 0; t < targetAtoms; t++) {
        if (target.degree(t) >= query.degree(q) && query.atom(q).matches(target, t)) {
          compatible[q][t] = true;
          candidateCount[q]++;
        }
      }
      if (candidateCount[q] == 0) {
        return false;
      }
    }
    return new State(target, query, compatible, searchOrder(query, candidateCount), deadlineNanos)
        .search();
  }

  private static int[][] searchOrder(QueryMolecule query, int[] candidateCount) {
    int n = query.atomCount();
    int[] order = new int[n];
    int[] parent = new int[n];
    boolean[] queued = new boolean[n];
    int filled = 0;
    Deque<Integer> queue = new ArrayDeque<>();
    while (filled < n) {
      int root = -1;
      for (int q = 0; q < n; q++) {
        if (!queued[q] && (root < 0 || candidateCount[q] < candidateCount[root])) {
          root = q;
        }
      }
      queued[root] = true;
      parent[root] = -1;
      queue.add(root);
      while (!queue.isEmpty()) {
        int atom = queue.poll();
        order[filled++] = atom;
        for (int next : query.neighbors(atom)) {
          if (!queued[next]) {
            queued[next] = true;
            parent[next] = atom;
            queue.add(next);
          }
        }
      }
    }
    return new int[][] {order, parent};
  }

  private static final class State {
    private final Molecule target;
    private final QueryMolecule query;
    private final boolean[][] compatible;
    private final int[] order;
    private final int[] parent;
    private final long deadlineNanos;
    private final int[] queryToTarget;
    private final int[] targetToQuery;
    private final int[] cursor;
    private long steps;

    State(
        Molecule target,
        QueryMolecule query,
        boolean[][] compatible,
        int[][] searchOrder,
        long deadlineNanos) {
      this.target = target;
      this.query = query;
      this.compatible = compatible;
      this.order = searchOrder[0];
      this.parent = searchOrder[1];
      this.deadlineNanos = deadlineNanos;
      queryToTarget = new int[query.atomCount()];
      targetToQuery = new int[target.atomCount()];
      Arrays.fill(queryToTarget, -1);
      Arrays.fill(targetToQuery, -1);
      cursor = new int[query.atomCount()];
    }

    boolean search() throws MatchTimeoutException {
      int depth = 0;
      cursor[0] = 0;
      while (true) {
        if (depth == order.length) {
          return true;
        }
        int q = order[depth];
        int anchor = parent[q] < 0 ? -1 : queryToTarget[parent[q]];
        int limit = anchor < 0 ? target.atomCount() : target.degree(anchor);
        boolean extended = false;
        while (cursor[depth] < limit) {
          int index = cursor[depth]++;
          int t = anchor < 0 ? index : target.neighbors(anchor)[index];
          if (steps++ % CHECK_INTERVAL == 0) {
            checkDeadline();
          }
          if (targetToQuery[t] >= 0 || !compatible[q][t] || !isFeasible(q, t)) {
            continue;
          }
          queryToTarget[q] = t;
          targetToQuery[t] = q;
          depth++;
          if (depth < order.length) {
            cursor[depth] = 0;
          }
          extended = true;
          break;
        }
        if (!extended) {
          depth--;
          if (depth < 0) {
            return false;
          }
          int undone = order[depth];
          targetToQuery[queryToTarget[undone]] = -1;
          queryToTarget[undone] = -1;
        }
      }
    }

    private boolean isFeasible(int q, int t) {
      int[] queryNeighbors = query.neighbors(q);
      int[] queryBonds = query.incidentBonds(q);
      int unmappedQuery = 0;
      for (int i = 0; i < queryNeighbors.length; i++) {
        int mapped = queryToTarget[queryNeighbors[i]];
        if (mapped < 0) {
          unmappedQuery++;
          continue;
        }
        int bond = target.bondIndex(t, mapped);
        if (bond < 0 || !query.bond(queryBonds[i]).expression().matches(target, bond)) {
          return false;
        }
      }
      int unmappedTarget = 0;
      for (int neighbor : target.neighbors(t)) {
        if (targetToQuery[neighbor] < 0) {
          unmappedTarget++;
        }
      }
      return unmappedQuery <= unmappedTarget;
    }

    private void checkDeadline() throws MatchTimeoutException {
      if (Thread.currentThread().isInterrupted()) {
        throw new MatchTimeoutException("Substructure search interrupted");
      }
      if (deadlineNanos != NO_DEADLINE && System.nanoTime() - deadlineNanos > 0) {
        throw new MatchTimeoutException("Substructure search exceeded its deadline");
      }
    }
  }
}
