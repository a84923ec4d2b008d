package com.quantori.faves.api.structure;

import com.quantori.faves.api.model.Atom;
import com.quantori.faves.api.model.Bond;
import com.quantori.faves.api.model.BondOrder;
import com.quantori.faves.api.model.Molecule;
import com.quantori.faves.api.model.PeriodicTable;
import com.quantori.faves.api.model.RingInfo;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import lombok.experimental.UtilityClass;

/**
 * Hückel aromaticity over the smallest rings and over pairs of fused rings. Pi electron
 * contributions are taken from the bond orders as written; atoms already written in aromatic form
 * are trusted.
 */
@UtilityClass
public final class Aromaticity {
  private static final int NOT_CONJUGATED = -1;

  /**
   * Returns a copy of the molecule with aromatic rings marked: their atoms flagged aromatic and
   * their ring bonds set to {@link BondOrder#AROMATIC}. Hydrogen counts are unchanged.
   */
  public static Molecule perceive(Molecule molecule) {
    RingInfo info = molecule.rings();
    List<int[]> rings = info.rings();
    if (rings.isEmpty()) {
      return molecule;
    }
    int[] electrons = new int[molecule.atomCount()];
    for (int atom = 0; atom < electrons.length; atom++) {
      electrons[atom] = info.isRingAtom(atom) ? piElectrons(molecule, atom) : NOT_CONJUGATED;
    }
    boolean[] aromaticRing = new boolean[rings.size()];
    boolean changed = false;
    for (int r = 0; r < rings.size(); r++) {
      if (isWrittenAromatic(molecule, rings.get(r))) {
        continue;
      }
      if (isHuckel(electrons, atomSet(rings.get(r)))) {
        aromaticRing[r] = true;
        changed = true;
      }
    }
    List<BitSet> bondSets = info.ringBondSets();
    for (int i = 0; i < rings.size(); i++) {
      for (int j = i + 1; j < rings.size(); j++) {
        if (aromaticRing[i] || aromaticRing[j]
            || isWrittenAromatic(molecule, rings.get(i))
            || isWrittenAromatic(molecule, rings.get(j))
            || !bondSets.get(i).intersects(bondSets.get(j))) {
          continue;
        }
        BitSet union = atomSet(rings.get(i));
        union.or(atomSet(rings.get(j)));
        if (isHuckel(electrons, union)) {
          aromaticRing[i] = true;
          aromaticRing[j] = true;
          changed = true;
        }
      }
    }
    if (!changed) {
      return molecule;
    }
    return markAromatic(molecule, rings, bondSets, aromaticRing);
  }

  private static Molecule markAromatic(
      Molecule molecule, List<int[]> rings, List<BitSet> bondSets, boolean[] aromaticRing) {
    List<Atom> atoms = new ArrayList<>(molecule.atoms());
    List<Bond> bonds = new ArrayList<>(molecule.bonds());
    for (int r = 0; r < rings.size(); r++) {
      if (!aromaticRing[r]) {
        continue;
      }
      for (int atom : rings.get(r)) {
        if (!atoms.get(atom).isAromatic()) {
          atoms.set(atom, atoms.get(atom).toBuilder().aromatic(true).build());
        }
      }
      BitSet ringBonds = bondSets.get(r);
      for (int b = ringBonds.nextSetBit(0); b >= 0; b = ringBonds.nextSetBit(b + 1)) {
        if (bonds.get(b).getOrder() != BondOrder.AROMATIC) {
          bonds.set(b, bonds.get(b).toBuilder().order(BondOrder.AROMATIC).build());
        }
      }
    }
    return new Molecule(atoms, bonds);
  }

  private static boolean isWrittenAromatic(Molecule molecule, int[] ring) {
    for (int atom : ring) {
      if (!molecule.atom(atom).isAromatic()) {
        return false;
      }
    }
    return true;
  }

  private static BitSet atomSet(int[] ring) {
    BitSet set = new BitSet();
    for (int atom : ring) {
      set.set(atom);
    }
    return set;
  }

  private static boolean isHuckel(int[] electrons, BitSet atoms) {
    int total = 0;
    for (int atom = atoms.nextSetBit(0); atom >= 0; atom = atoms.nextSetBit(atom + 1)) {
      if (electrons[atom] == NOT_CONJUGATED) {
        return false;
      }
      total += electrons[atom];
    }
    return total >= 2 && total % 4 == 2;
  }

  static int piElectrons(Molecule molecule, int index) {
    Atom atom = molecule.atom(index);
    int element = atom.getAtomicNumber();
    int connections = molecule.connectivity(index);
    int charge = atom.getCharge();
    if (atom.isAromatic()) {
      return switch (element) {
        case PeriodicTable.CARBON -> charge < 0 ? 2 : charge > 0 ? 0 : 1;
        case PeriodicTable.NITROGEN, PeriodicTable.PHOSPHORUS, PeriodicTable.ARSENIC ->
            charge == 0 && (atom.getHydrogenCount() > 0 || molecule.degree(index) == 3) ? 2 : 1;
        case PeriodicTable.OXYGEN, PeriodicTable.SULFUR, PeriodicTable.SELENIUM,
            PeriodicTable.TELLURIUM -> charge > 0 ? 1 : 2;
        case PeriodicTable.BORON -> 0;
        default -> NOT_CONJUGATED;
      };
    }
    int ringDoubles = 0;
    int exocyclicDoubles = 0;
    int[] neighbors = molecule.neighbors(index);
    int[] incident = molecule.incidentBonds(index);
    for (int i = 0; i < neighbors.length; i++) {
      BondOrder order = molecule.bond(incident[i]).getOrder();
      if (order == BondOrder.TRIPLE || order == BondOrder.QUADRUPLE) {
        return NOT_CONJUGATED;
      }
      if (order == BondOrder.DOUBLE || order == BondOrder.AROMATIC) {
        if (molecule.isRingAtom(neighbors[i])) {
          ringDoubles++;
        } else {
          exocyclicDoubles++;
        }
      }
    }
    if (ringDoubles > 1) {
      return NOT_CONJUGATED;
    }
    if (ringDoubles == 1) {
      return 1;
    }
    if (exocyclicDoubles > 0) {
      return 0;
    }
    return switch (element) {
      case PeriodicTable.CARBON -> charge < 0 ? 2 : charge > 0 ? 0 : NOT_CONJUGATED;
      case PeriodicTable.NITROGEN, PeriodicTable.PHOSPHORUS, PeriodicTable.ARSENIC ->
          (charge == 0 && connections == 3) || (charge < 0 && connections == 2)
              ? 2
              : NOT_CONJUGATED;
      case PeriodicTable.OXYGEN, PeriodicTable.SULFUR, PeriodicTable.SELENIUM,
          PeriodicTable.TELLURIUM -> charge == 0 && connections == 2 ? 2 : NOT_CONJUGATED;
      case PeriodicTable.BORON -> charge == 0 && connections == 3 ? 0 : NOT_CONJUGATED;
      default -> NOT_CONJUGATED;
    };
  }
}
