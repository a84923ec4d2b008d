package com.quantori.faves.api.structure;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.quantori.faves.api.StructureParseException;
import com.quantori.faves.api.util.StructureHashes;
import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

class StructureNormalizerTest {
  private final StructureNormalizer normalizer = new StructureNormalizer();

  static Stream<Arguments> equivalentWritings() {
    return Stream.of(
        Arguments.of(List.of("CCO", "OCC", "C(O)C", "[CH3][CH2][OH]")),
        Arguments.of(List.of("Cc1ccccc1", "c1ccccc1C", "CC1=CC=CC=C1", "C1=CC=CC(C)=C1")),
        Arguments.of(
            List.of(
                "OC(=O)c1ccccc1O",
                "O=C(O)c1ccccc1O",
                "Oc1ccccc1C(O)=O",
                "OC(=O)C1=CC=CC=C1O")),
        Arguments.of(
            List.of("CC(C)Cc1ccc(cc1)C(C)C(=O)O", "OC(=O)C(C)c1ccc(CC(C)C)cc1")),
        Arguments.of(
            List.of("Cn1cnc2c1c(=O)n(C)c(=O)n2C", "CN1C=NC2=C1C(=O)N(C)C(=O)N2C")),
        Arguments.of(List.of("c1ccc2ccccc2c1", "C1=CC=C2C=CC=CC2=C1")),
        Arguments.of(List.of("c1cc[nH]c1", "C1=CNC=C1")),
        Arguments.of(List.of("CN(=O)=O", "C[N+](=O)[O-]", "[O-][N+](C)=O")),
        Arguments.of(List.of("CO", "[H]OC([H])([H])[H]")),
        Arguments.of(List.of("[Na+].[Cl-]", "[Cl-].[Na+]")),
        Arguments.of(List.of("CCO.O", "O.OCC")));
  }

  @ParameterizedTest
  @MethodSource("equivalentWritings")
  void equivalentWritingsShareCanonicalForm(List<String> writings) {
    String expected = normalizer.canonicalForm(writings.get(0));
    for (String smiles : writings) {
      assertEquals(expected, normalizer.canonicalForm(smiles), smiles);
      assertEquals(
          StructureHashes.stereoAgnosticHash(expected),
          normalizer.normalize(smiles).getSecondaryHash(),
          smiles);
    }
  }

  @ParameterizedTest
  @ValueSource(
      strings = {
        "CC(=O)Oc1ccccc1C(=O)O",
        "CN1C(=O)CN=C(c2ccccc2)c2cc(Cl)ccc21",
        "Cc1nnc2n1-c1ccc(Cl)cc1C(c1ccccc1)=NC2",
        "CCN(CC)C(=O)C1CN(C)C2Cc3c[nH]c4cccc(C2=C1)c34",
        "CCCCCc1cc(O)c2c(c1)OC(C)(C)C1CCC(C)=CC21",
        "Cc1ncc([N+](=O)[O-])n1CCO",
        "OC(=O)CC(O)(CC(=O)O)C(=O)O",
        "C[NH3+].[Cl-]"
      })
  void canonicalFormIsIdempotent(String smiles) {
    String canonical = normalizer.canonicalForm(smiles);

    assertEquals(canonical, normalizer.canonicalForm(canonical));
  }

  @Test
  void differentStructuresHaveDifferentCanonicalForms() {
    assertNotEquals(normalizer.canonicalForm("CCO"), normalizer.canonicalForm("COC"));
    assertNotEquals(
        normalizer.canonicalForm("Cc1ccccc1O"), normalizer.canonicalForm("Cc1ccc(O)cc1"));
    assertNotEquals(normalizer.canonicalForm("C1CCCCC1"), normalizer.canonicalForm("c1ccccc1"));
  }

  @Test
  void separatesFragmentsWithDots() {
    String canonical = normalizer.canonicalForm("[Cl-].C[NH3+]");

    assertThat(canonical.split("\\.")).hasSize(2);
  }

  @Test
  void nitroGroupsAreChargeSeparated() {
    String canonical = normalizer.canonicalForm("c1ccccc1N(=O)=O");

    assertThat(canonical).contains("[N+]").contains("[O-]");
  }

  @Test
  void stereoIsExcludedFromCanonicalFormButNotFromHash() {
    NormalizedStructure left = normalizer.normalize("N[C@@H](C)C(=O)O");
    NormalizedStructure leftReordered = normalizer.normalize("C[C@H](N)C(=O)O");
    NormalizedStructure right = normalizer.normalize("N[C@H](C)C(=O)O");
    NormalizedStructure flat = normalizer.normalize("NC(C)C(=O)O");

    assertEquals(flat.getCanonicalForm(), left.getCanonicalForm());
    assertEquals(flat.getCanonicalForm(), right.getCanonicalForm());
    assertTrue(left.isStereoDefined());
    assertFalse(flat.isStereoDefined());

    assertEquals(left.getSecondaryHash(), leftReordered.getSecondaryHash());
    assertNotEquals(left.getSecondaryHash(), right.getSecondaryHash());
    assertNotEquals(left.getSecondaryHash(), flat.getSecondaryHash());
    assertEquals(
        StructureHashes.stereoAgnosticHash(flat.getCanonicalForm()), flat.getSecondaryHash());
  }

  @Test
  void enantiomersOfPolycyclicStructureDifferOnlyInHash() {
    NormalizedStructure dextro =
        normalizer.normalize("CN1CC[C@]23CCCC[C@H]2[C@H]1CC4=C3C=C(C=C4)OC");
    NormalizedStructure levo =
        normalizer.normalize("CN1CC[C@@]23CCCC[C@@H]2[C@@H]1CC4=C3C=C(C=C4)OC");

    assertEquals(dextro.getCanonicalForm(), levo.getCanonicalForm());
    assertNotEquals(dextro.getSecondaryHash(), levo.getSecondaryHash());
  }

  @Test
  void lonePairCentreKeepsItsConfigurationWhenWrittenFirst() {
    NormalizedStructure leading = normalizer.normalize("[S@](=O)(C)CC");
    NormalizedStructure inner = normalizer.normalize("C[S@](=O)CC");
    NormalizedStructure mirror = normalizer.normalize("C[S@@](=O)CC");

    assertTrue(leading.isStereoDefined());
    assertEquals(inner.getSecondaryHash(), leading.getSecondaryHash());
    assertNotEquals(mirror.getSecondaryHash(), leading.getSecondaryHash());
    assertEquals(mirror.getCanonicalForm(), leading.getCanonicalForm());
  }

  @Test
  void centreWithEquivalentNeighboursIsNotStereogenic() {
    NormalizedStructure isopropanol = normalizer.normalize("C[C@H](C)O");

    assertFalse(isopropanol.isStereoDefined());
    assertEquals(normalizer.normalize("CC(C)O").getSecondaryHash(), isopropanol.getSecondaryHash());
  }

  @Test
  void secondaryHashIsUpperCaseMd5() {
    String hash = normalizer.normalize("CCO").getSecondaryHash();

    assertThat(hash).hasSize(32).matches("[0-9A-F]+");
  }

  @ParameterizedTest
  @ValueSource(strings = {"C1CC((", "[99999999999C]", "[C+99999999999]", "[CH4:99999999999]"})
  void malformedTextIsRejected(String smiles) {
    assertThrows(StructureParseException.class, () -> normalizer.normalize(smiles));
  }
}
