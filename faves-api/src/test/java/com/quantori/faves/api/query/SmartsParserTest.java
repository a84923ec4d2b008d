package com.quantori.faves.api.query;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.quantori.faves.api.StructureParseException;
import com.quantori.faves.api.model.Molecule;
import com.quantori.faves.api.model.PeriodicTable;
import com.quantori.faves.api.structure.StructureNormalizer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

class SmartsParserTest {
  private final StructureNormalizer normalizer = new StructureNormalizer();

  @Test
  void buildsGraphWithRingClosure() {
    QueryMolecule barbiturate = SmartsParser.parse("[O,S]=C1NC(=O)CC(=O)N1");

    assertEquals(9, barbiturate.atomCount());
    assertEquals(9, barbiturate.bondCount());
    assertTrue(barbiturate.isConnected());
    assertInstanceOf(AtomExpression.Or.class, barbiturate.atom(0));
  }

  @Test
  void unwrittenBondsAcceptSingleOrAromatic() {
    QueryMolecule query = SmartsParser.parse("CC");

    assertInstanceOf(BondExpression.SingleOrAromatic.class, query.bond(0).expression());
  }

  @Test
  void ringClosureCarriesBondExpression() {
    QueryMolecule query = SmartsParser.parse("C1CCC~1");

    assertInstanceOf(BondExpression.Any.class, query.bond(3).expression());
  }

  @Test
  void countsRequiredElements() {
    QueryMolecule query = SmartsParser.parse("[#6]C(=O)N[O,S]");

    int[] counts = query.requiredElementCounts(PeriodicTable.maxAtomicNumber() + 1);
    assertEquals(2, counts[PeriodicTable.CARBON]);
    assertEquals(1, counts[PeriodicTable.NITROGEN]);
    assertEquals(1, counts[PeriodicTable.OXYGEN]);
    assertEquals(0, counts[PeriodicTable.SULFUR]);
  }

  @Test
  void detectsDisconnectedPatterns() {
    assertFalse(SmartsParser.parse("CC.N").isConnected());
  }

  @ParameterizedTest
  @CsvSource({
    "'[OX2H]', 'CCO', 0, 2, true",
    "'[OX2H]', 'CCOC', 0, 2, false",
    "'[#7]', 'c1ccncc1', 0, 3, true",
    "'n', 'c1ccncc1', 0, 3, true",
    "'N', 'c1ccncc1', 0, 3, false",
    "'[N;!H0]', 'CN', 0, 1, true",
    "'[N;!H0]', 'CN(C)C', 0, 1, false",
    "'[O-]', 'C(=O)[O-]', 0, 2, true",
    "'[+1]', 'C[NH3+]', 0, 1, true",
    "'[D3]', 'CC(C)C', 0, 1, true",
    "'[D3]', 'CC(C)C', 0, 0, false",
    "'[R]', 'C1CC1C', 0, 0, true",
    "'[R]', 'C1CC1C', 0, 3, false",
    "'[r5]', 'C1CCCC1', 0, 0, true",
    "'[r5]', 'C1CCCCC1', 0, 0, false",
    "'[x3]', 'c1ccc2ccccc2c1', 0, 3, true",
    "'[13C]', '[13CH4]', 0, 0, true",
    "'[13C]', 'C', 0, 0, false",
    "'[c,n;H1]', 'c1cc[nH]c1', 0, 3, true",
    "'[!#6]', 'CO', 0, 1, true",
    "'[!#6]', 'CO', 0, 0, false"
  })
  void atomPrimitivesTestTargetAtoms(
      String smarts, String smiles, int queryAtom, int targetAtom, boolean expected) {
    QueryMolecule query = SmartsParser.parse(smarts);
    Molecule target = normalizer.normalize(smiles).getMolecule();

    assertEquals(expected, query.atom(queryAtom).matches(target, targetAtom));
  }

  @ParameterizedTest
  @ValueSource(
      strings = {
        "",
        "C(",
        "C)",
        "[C",
        "C1CC",
        "[#]",
        "C=",
        "Q",
        "[Q]",
        "C%1",
        "C>C",
        "C11",
        "[#99999999999]",
        "[CH99999999999]",
        "[C+99999999999]"
      })
  void rejectsMalformedPatterns(String smarts) {
    assertThrows(StructureParseException.class, () -> SmartsParser.parse(smarts));
  }
}
