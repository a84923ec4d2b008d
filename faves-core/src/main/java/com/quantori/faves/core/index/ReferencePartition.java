package com.quantori.faves.core.index;

import com.quantori.faves.api.util.StructureHashes;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Immutable open-addressing table from canonical form to reference records.
 *
 * <p>Records are held in an arena sorted by their 64-bit canonical key, so that records sharing a
 * canonical form occupy one contiguous run. Each table slot stores a key and the start and length
 * of its run; collisions are resolved by linear probing.
 */
final class ReferencePartition {
  private final ReferenceRecord[] arena;
  private final long[] slotKeys;
  private final int[] slotStart;
  private final int[] slotLength;
  private final int mask;

  ReferencePartition(List<ReferenceRecord> records) {
    long[] keys = new long[records.size()];
    Integer[] order = new Integer[records.size()];
    for (int i = 0; i < keys.length; i++) {
      keys[i] = StructureHashes.canonicalKey(records.get(i).getCanonicalForm());
      order[i] = i;
    }
    Arrays.sort(order, Comparator.comparingLong(i -> keys[i]));
    arena = new ReferenceRecord[records.size()];
    for (int i = 0; i < order.length; i++) {
      arena[i] = records.get(order[i]);
    }
    int distinct = 0;
    for (int i = 0; i < order.length; i++) {
      if (i == 0 || keys[order[i]] != keys[order[i - 1]]) {
        distinct++;
      }
    }
    int capacity = Integer.highestOneBit(Math.max(2, distinct * 2 - 1)) << 1;
    mask = capacity - 1;
    slotKeys = new long[capacity];
    slotStart = new int[capacity];
    slotLength = new int[capacity];
    for (int i = 0; i < order.length; ) {
      long key = keys[order[i]];
      int end = i;
      while (end < order.length && keys[order[end]] == key) {
        end++;
      }
      int slot = slotOf(key);
      while (slotLength[slot] != 0) {
        slot = (slot + 1) & mask;
      }
      slotKeys[slot] = key;
      slotStart[slot] = i;
      slotLength[slot] = end - i;
      i = end;
    }
  }

  private int slotOf(long key) {
    return (int) (key ^ (key >>> 32)) & mask;
  }

  /**
   * Records whose canonical form equals the given one, in snapshot order within their key run.
   */
  List<ReferenceRecord> find(String canonicalForm) {
    long key = StructureHashes.canonicalKey(canonicalForm);
    int slot = slotOf(key);
    while (slotLength[slot] != 0) {
      if (slotKeys[slot] == key) {
        List<ReferenceRecord> found = new ArrayList<>(1);
        for (int i = slotStart[slot]; i < slotStart[slot] + slotLength[slot]; i++) {
          if (arena[i].getCanonicalForm().equals(canonicalForm)) {
            found.add(arena[i]);
          }
        }
        return found;
      }
      slot = (slot + 1) & mask;
    }
    return List.of();
  }

  int size() {
    return arena.length;
  }
}
