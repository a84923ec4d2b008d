package com.quantori.faves.api.query;

import com.quantori.faves.api.model.BondOrder;
import com.quantori.faves.api.model.Molecule;
import java.util.List;

/**
 * Constraint on a target bond.
 */
public interface BondExpression {

  boolean matches(Molecule molecule, int bond);

  /** {@code ~}. */
  record Any() implements BondExpression {
    @Override
    public boolean matches(Molecule molecule, int bond) {
      return true;
    }
  }

  record Order(BondOrder order) implements BondExpression {
    @Override
    public boolean matches(Molecule molecule, int bond) {
      return molecule.bond(bond).getOrder() == order;
    }
  }

  /** Bond written without a symbol. */
  record SingleOrAromatic() implements BondExpression {
    @Override
    public boolean matches(Molecule molecule, int bond) {
      BondOrder order = molecule.bond(bond).getOrder();
      return order == BondOrder.SINGLE || order == BondOrder.AROMATIC;
    }
  }

  /** {@code @}. */
  record Ring() implements BondExpression {
    @Override
    public boolean matches(Molecule molecule, int bond) {
      return molecule.isRingBond(bond);
    }
  }

  record Not(BondExpression operand) implements BondExpression {
    @Override
    public boolean matches(Molecule molecule, int bond) {
      return !operand.matches(molecule, bond);
    }
  }

  record And(List<BondExpression> operands) implements BondExpression {
    public And {
      operands = List.copyOf(operands);
    }

    @Override
    public boolean matches(Molecule molecule, int bond) {
      return operands.stream().allMatch(operand -> operand.matches(molecule, bond));
    }
  }

  record Or(List<BondExpression> operands) implements BondExpression {
    public Or {
      operands = List.copyOf(operands);
    }

    @Override
    public boolean matches(Molecule molecule, int bond) {
      return operands.stream().anyMatch(operand -> operand.matches(molecule, bond));
    }
  }
}
