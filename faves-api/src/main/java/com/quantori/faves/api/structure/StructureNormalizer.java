package com.quantori.faves.api.structure;

import com.quantori.faves.api.model.Atom;
import com.quantori.faves.api.model.Bond;
import com.quantori.faves.api.model.BondOrder;
import com.quantori.faves.api.model.Molecule;
import com.quantori.faves.api.model.PeriodicTable;
import com.quantori.faves.api.smiles.SmilesParser;
import com.quantori.faves.api.util.StructureHashes;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Turns structure text into a normalized graph and its exact-match keys. Instances are stateless
 * and may be shared between threads.
 */
public class StructureNormalizer {

  /**
   * Parses and normalizes a structure.
   *
   * @param smiles structure text
   * @return the normalized graph with canonical form and secondary hash
   * @throws com.quantori.faves.api.StructureParseException when the text is malformed
   */
  public NormalizedStructure normalize(String smiles) {
    return normalize(SmilesParser.parse(smiles));
  }

  /**
   * Normalizes a parsed molecule and computes its keys.
   *
   * @param parsed a molecule as read from text
   * @return the normalized graph with canonical form and secondary hash
   */
  public NormalizedStructure normalize(Molecule parsed) {
    Molecule molecule = standardize(parsed);
    List<CanonicalFragment> fragments =
        molecule.fragments().stream()
            .map(Canonicalizer::canonicalize)
            .sorted()
            .collect(Collectors.toList());
    String canonicalForm =
        fragments.stream().map(CanonicalFragment::smiles).collect(Collectors.joining("."));
    boolean stereo = fragments.stream().anyMatch(fragment -> !fragment.stereoLayer().isEmpty());
    String stereoLayer =
        stereo
            ? fragments.stream()
                .map(CanonicalFragment::stereoLayer)
                .collect(Collectors.joining("."))
            : "";
    return new NormalizedStructure(
        molecule,
        canonicalForm,
        stereoLayer,
        StructureHashes.secondaryHash(canonicalForm, stereoLayer));
  }

  /**
   * Canonical form of a structure.
   *
   * @param smiles structure text
   * @return canonical SMILES
   */
  public String canonicalForm(String smiles) {
    return normalize(smiles).getCanonicalForm();
  }

  /**
   * Applies hydrogen folding, nitro group charge separation and aromaticity perception.
   */
  public Molecule standardize(Molecule molecule) {
    return Aromaticity.perceive(separateNitroCharges(foldHydrogens(molecule)));
  }

  static Molecule foldHydrogens(Molecule molecule) {
    int n = molecule.atomCount();
    int[] extraHydrogens = new int[n];
    boolean[] removed = new boolean[n];
    boolean any = false;
    for (int atom = 0; atom < n; atom++) {
      Atom hydrogen = molecule.atom(atom);
      if (!hydrogen.isHydrogen() || hydrogen.getCharge() != 0 || hydrogen.getIsotope() != 0
          || hydrogen.getHydrogenCount() != 0 || molecule.degree(atom) != 1) {
        continue;
      }
      int heavy = molecule.neighbors(atom)[0];
      if (molecule.atom(heavy).isHydrogen()
          || molecule.bond(molecule.incidentBonds(atom)[0]).getOrder() != BondOrder.SINGLE) {
        continue;
      }
      removed[atom] = true;
      extraHydrogens[heavy]++;
      any = true;
    }
    if (!any) {
      return molecule;
    }
    List<Atom> kept = new ArrayList<>();
    int[] mapping = new int[n];
    for (int atom = 0; atom < n; atom++) {
      if (removed[atom]) {
        mapping[atom] = -1;
        continue;
      }
      mapping[atom] = kept.size();
      Atom original = molecule.atom(atom);
      kept.add(
          extraHydrogens[atom] == 0
              ? original
              : original.toBuilder()
                  .hydrogenCount(original.getHydrogenCount() + extraHydrogens[atom])
                  .build());
    }
    return molecule.remap(kept, mapping);
  }

  static Molecule separateNitroCharges(Molecule molecule) {
    List<Atom> atoms = null;
    List<Bond> bonds = null;
    for (int atom = 0; atom < molecule.atomCount(); atom++) {
      Atom nitrogen = molecule.atom(atom);
      if (nitrogen.getAtomicNumber() != PeriodicTable.NITROGEN || nitrogen.getCharge() != 0
          || nitrogen.isAromatic()) {
        continue;
      }
      List<Integer> oxoBonds = new ArrayList<>(2);
      int[] neighbors = molecule.neighbors(atom);
      int[] incident = molecule.incidentBonds(atom);
      for (int i = 0; i < neighbors.length; i++) {
        Atom oxygen = molecule.atom(neighbors[i]);
        if (oxygen.getAtomicNumber() == PeriodicTable.OXYGEN && oxygen.getCharge() == 0
            && molecule.degree(neighbors[i]) == 1
            && molecule.bond(incident[i]).getOrder() == BondOrder.DOUBLE) {
          oxoBonds.add(incident[i]);
        }
      }
      if (oxoBonds.size() != 2) {
        continue;
      }
      if (atoms == null) {
        atoms = new ArrayList<>(molecule.atoms());
        bonds = new ArrayList<>(molecule.bonds());
      }
      int bond = Math.min(oxoBonds.get(0), oxoBonds.get(1));
      int oxygen = molecule.bond(bond).other(atom);
      atoms.set(atom, nitrogen.toBuilder().charge(1).build());
      atoms.set(oxygen, atoms.get(oxygen).toBuilder().charge(-1).build());
      bonds.set(bond, bonds.get(bond).toBuilder().order(BondOrder.SINGLE).build());
    }
    return atoms == null ? molecule : new Molecule(atoms, bonds);
  }
}
