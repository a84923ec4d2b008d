package com.quantori.faves.api.model;

import java.util.HashMap;
import java.util.Map;
import lombok.experimental.UtilityClass;

/**
 * Element symbols, atomic numbers and the standard valences used to resolve implicit hydrogens.
 */
@UtilityClass
public final class PeriodicTable {

  private static final String[] SYMBOLS = {
    "*", "H", "He", "Li", "Be", "B", "C", "N", "O", "F", "Ne", "Na", "Mg", "Al", "Si", "P", "S",
    "Cl", "Ar", "K", "Ca", "Sc", "Ti", "V", "Cr", "Mn", "Fe", "Co", "Ni", "Cu", "Zn", "Ga", "Ge",
    "As", "Se", "Br", "Kr", "Rb", "Sr", "Y", "Zr", "Nb", "Mo", "Tc", "Ru", "Rh", "Pd", "Ag", "Cd",
    "In", "Sn", "Sb", "Te", "I", "Xe", "Cs", "Ba", "La", "Ce", "Pr", "Nd", "Pm", "Sm", "Eu", "Gd",
    "Tb", "Dy", "Ho", "Er", "Tm", "Yb", "Lu", "Hf", "Ta", "W", "Re", "Os", "Ir", "Pt", "Au", "Hg",
    "Tl", "Pb", "Bi", "Po", "At", "Rn", "Fr", "Ra", "Ac", "Th", "Pa", "U", "Np", "Pu", "Am", "Cm",
    "Bk", "Cf", "Es", "Fm", "Md", "No", "Lr", "Rf", "Db", "Sg", "Bh", "Hs", "Mt", "Ds", "Rg", "Cn",
    "Nh", "Fl", "Mc", "Lv", "Ts", "Og"
  };

  public static final int HYDROGEN = 1;
  public static final int BORON = 5;
  public static final int CARBON = 6;
  public static final int NITROGEN = 7;
  public static final int OXYGEN = 8;
  public static final int PHOSPHORUS = 15;
  public static final int SULFUR = 16;
  public static final int ARSENIC = 33;
  public static final int SELENIUM = 34;
  public static final int TELLURIUM = 52;

  private static final Map<String, Integer> NUMBERS = new HashMap<>();

  private static final int[][] VALENCES = new int[SYMBOLS.length][];

  static {
    for (int i = 0; i < SYMBOLS.length; i++) {
      NUMBERS.put(SYMBOLS[i], i);
    }
    VALENCES[BORON] = new int[] {3};
    VALENCES[CARBON] = new int[] {4};
    VALENCES[NITROGEN] = new int[] {3, 5};
    VALENCES[OXYGEN] = new int[] {2};
    VALENCES[PHOSPHORUS] = new int[] {3, 5};
    VALENCES[SULFUR] = new int[] {2, 4, 6};
    VALENCES[9] = new int[] {1};
    VALENCES[17] = new int[] {1};
    VALENCES[35] = new int[] {1};
    VALENCES[53] = new int[] {1};
    VALENCES[ARSENIC] = new int[] {3, 5};
    VALENCES[SELENIUM] = new int[] {2, 4, 6};
    VALENCES[TELLURIUM] = new int[] {2, 4, 6};
  }

  /**
   * Returns the atomic number of an element symbol.
   *
   * @param symbol element symbol with standard capitalization
   * @return atomic number, 0 for the wildcard {@code *}, or -1 for an unknown symbol
   */
  public static int atomicNumber(String symbol) {
    Integer number = NUMBERS.get(symbol);
    return number == null ? -1 : number;
  }

  public static String symbol(int atomicNumber) {
    return SYMBOLS[atomicNumber];
  }

  public static int maxAtomicNumber() {
    return SYMBOLS.length - 1;
  }

  /**
   * Returns true if an element belongs to the SMILES organic subset and may be written outside of
   * brackets.
   */
  public static boolean isOrganicSubset(int atomicNumber) {
    return switch (atomicNumber) {
      case BORON, CARBON, NITROGEN, OXYGEN, PHOSPHORUS, SULFUR, 9, 17, 35, 53 -> true;
      default -> false;
    };
  }

  /** Elements that may be written in lowercase aromatic form. */
  public static boolean canBeAromatic(int atomicNumber) {
    return switch (atomicNumber) {
      case BORON, CARBON, NITROGEN, OXYGEN, PHOSPHORUS, SULFUR -> true;
      case ARSENIC, SELENIUM, TELLURIUM -> true;
      default -> false;
    };
  }

  /**
   * Standard valences in ascending order, or an empty array when the element has no default valence
   * and must carry its hydrogens explicitly.
   */
  public static int[] standardValences(int atomicNumber) {
    if (atomicNumber < 0 || atomicNumber >= VALENCES.length || VALENCES[atomicNumber] == null) {
      return new int[0];
    }
    return VALENCES[atomicNumber].clone();
  }

  /**
   * Lowest standard valence that can accommodate the given bond order sum, or -1 when none can.
   */
  public static int targetValence(int atomicNumber, int bondOrderSum) {
    int[] valences = atomicNumber < VALENCES.length ? VALENCES[atomicNumber] : null;
    if (valences == null) {
      return -1;
    }
    for (int valence : valences) {
      if (valence >= bondOrderSum) {
        return valence;
      }
    }
    return -1;
  }
}
