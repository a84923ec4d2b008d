package com.quantori.faves.api.query;

import com.quantori.faves.api.model.Atom;
import com.quantori.faves.api.model.Molecule;
import java.util.List;

/**
 * Constraint on a target atom. Implementations are small value variants combined with
 * {@link Not}, {@link And} and {@link Or}.
 */
public interface AtomExpression {

  /**
   * Tests an atom of a target molecule.
   *
   * @param molecule target molecule
   * @param atom     atom index
   * @return true if the atom satisfies the constraint
   */
  boolean matches(Molecule molecule, int atom);

  /** Atomic number every matching atom must have, or -1 when unconstrained. */
  default int requiredElement() {
    return -1;
  }

  record Any() implements AtomExpression {
    @Override
    public boolean matches(Molecule molecule, int atom) {
      return true;
    }
  }

  /**
   * Exact element. {@code aromatic} is null when either form is accepted ({@code #n}).
   */
  record Element(int atomicNumber, Boolean aromatic) implements AtomExpression {
    @Override
    public boolean matches(Molecule molecule, int atom) {
      Atom target = molecule.atom(atom);
      return target.getAtomicNumber() == atomicNumber
          && (aromatic == null || target.isAromatic() == aromatic);
    }

    @Override
    public int requiredElement() {
      return atomicNumber;
    }
  }

  record Aromatic(boolean aromatic) implements AtomExpression {
    @Override
    public boolean matches(Molecule molecule, int atom) {
      return molecule.atom(atom).isAromatic() == aromatic;
    }
  }

  record Charge(int charge) implements AtomExpression {
    @Override
    public boolean matches(Molecule molecule, int atom) {
      return molecule.atom(atom).getCharge() == charge;
    }
  }

  record Isotope(int massNumber) implements AtomExpression {
    @Override
    public boolean matches(Molecule molecule, int atom) {
      return molecule.atom(atom).getIsotope() == massNumber;
    }
  }

  record HydrogenCount(int count) implements AtomExpression {
    @Override
    public boolean matches(Molecule molecule, int atom) {
      return molecule.atom(atom).getHydrogenCount() == count;
    }
  }

  /** Number of explicit connections ({@code D}). */
  record Degree(int degree) implements AtomExpression {
    @Override
    public boolean matches(Molecule molecule, int atom) {
      return molecule.degree(atom) == degree;
    }
  }

  /** Connections including hydrogens ({@code X}). */
  record Connectivity(int connectivity) implements AtomExpression {
    @Override
    public boolean matches(Molecule molecule, int atom) {
      return molecule.connectivity(atom) == connectivity;
    }
  }

  /**
   * Number of smallest rings containing the atom ({@code R<n>}); a negative count means any ring
   * ({@code R}).
   */
  record RingMembership(int count) implements AtomExpression {
    @Override
    public boolean matches(Molecule molecule, int atom) {
      return count < 0 ? molecule.isRingAtom(atom) : molecule.rings().membership(atom) == count;
    }
  }

  /** Membership in a smallest ring of the given size ({@code r<n>}); 0 or less means any ring. */
  record RingSize(int size) implements AtomExpression {
    @Override
    public boolean matches(Molecule molecule, int atom) {
      return size <= 0 ? molecule.isRingAtom(atom) : molecule.rings().isInRingOfSize(atom, size);
    }
  }

  /** Number of ring bonds at the atom ({@code x<n>}). */
  record RingConnectivity(int count) implements AtomExpression {
    @Override
    public boolean matches(Molecule molecule, int atom) {
      return molecule.rings().ringConnectivity(atom) == count;
    }
  }

  record Not(AtomExpression operand) implements AtomExpression {
    @Override
    public boolean matches(Molecule molecule, int atom) {
      return !operand.matches(molecule, atom);
    }
  }

  record And(List<AtomExpression> operands) implements AtomExpression {
    public And {
      operands = List.copyOf(operands);
    }

    @Override
    public boolean matches(Molecule molecule, int atom) {
      for (AtomExpression operand : operands) {
        if (!operand.matches(molecule, atom)) {
          return false;
        }
      }
      return true;
    }

    @Override
    public int requiredElement() {
      for (AtomExpression operand : operands) {
        int element = operand.requiredElement();
        if (element >= 0) {
          return element;
        }
      }
      return -1;
    }
  }

  record Or(List<AtomExpression> operands) implements AtomExpression {
    public Or {
      operands = List.copyOf(operands);
    }

    @Override
    public boolean matches(Molecule molecule, int atom) {
      for (AtomExpression operand : operands) {
        if (operand.matches(molecule, atom)) {
          return true;
        }
      }
      return false;
    }

    @Override
    public int requiredElement() {
      int element = -1;
      for (AtomExpression operand : operands) {
        int required = operand.requiredElement();
        if (required < 0 || (element >= 0 && required != element)) {
          return -1;
        }
        element = required;
      }
      return element;
    }
  }
}
