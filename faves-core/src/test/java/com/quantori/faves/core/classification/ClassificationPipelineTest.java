package com.quantori.faves.core.classification;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.quantori.faves.api.StructureParseException;
import com.quantori.faves.api.match.MatchTimeoutException;
import com.quantori.faves.api.match.MoleculesMatcher;
import com.quantori.faves.api.match.SubstructureMatcher;
import com.quantori.faves.api.structure.StructureNormalizer;
import com.quantori.faves.core.configuration.FavesBootstrap;
import com.quantori.faves.core.configuration.FavesConfiguration;
import com.quantori.faves.core.configuration.FavesConfigurationProperties;
import com.quantori.faves.core.index.ExactMatchIndex;
import com.quantori.faves.core.index.ReferenceCategory;
import com.quantori.faves.core.index.ReferenceSetLoader;
import com.quantori.faves.core.pattern.DrugClass;
import com.quantori.faves.core.pattern.PatternLibrary;
import com.quantori.faves.core.pattern.PatternLibraryLoader;
import com.quantori.faves.core.scaffold.ScaffoldMatcher;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.Mockito;

class ClassificationPipelineTest {
  private static final String FENTANYL = "CCC(=O)N(c1ccccc1)C1CCN(CCc2ccccc2)CC1";
  private static final String DEXTROMETHORPHAN = "CN1CC[C@]23CCCC[C@H]2[C@H]1CC4=C3C=C(C=C4)OC";
  private static final String LEVOMETHORPHAN = "CN1CC[C@@]23CCCC[C@@H]2[C@@H]1CC4=C3C=C(C=C4)OC";
  private static final String METHORPHAN = "CN1CCC23CCCCC2C1CC4=C3C=C(C=C4)OC";

  private static ClassificationPipeline pipeline;

  @BeforeAll
  static void startPipeline() {
    pipeline = FavesBootstrap.createPipeline(FavesConfiguration.load());
  }

  private static ClassificationPipeline fixturePipeline(String whitelistPath, String patternsPath) {
    StructureNormalizer normalizer = new StructureNormalizer();
    ReferenceSetLoader loader = new ReferenceSetLoader(normalizer);
    ExactMatchIndex index =
        new ExactMatchIndex(
            loader.load(whitelistPath, ReferenceCategory.WHITELISTED),
            loader.load("classpath:fixtures/controlled-small.tsv", ReferenceCategory.CONTROLLED));
    PatternLibrary library = new PatternLibraryLoader().load(patternsPath);
    return new ClassificationPipeline(
        normalizer,
        index,
        new ScaffoldMatcher(library, new SubstructureMatcher(), Duration.ofSeconds(1)));
  }

  @Test
  void controlledSubstanceRaisesTwoFlags() {
    ClassificationResult result = pipeline.classify(FENTANYL);

    assertTrue(result.isDeaControlled());
    assertTrue(result.isScaffoldMatch());
    assertFalse(result.isWhitelisted());
    assertEquals(2, result.getFlagCount());
    assertEquals(ComplianceStatus.CONTROLLED, result.getStatus());
    assertEquals("fentanyl", result.getMatchedName());
    assertEquals("II", result.getDeaSchedule());
    assertTrue(result.isInDatabase());
    assertThat(result.getMatchedPatternIds()).contains("opioid-4-anilidopiperidine");
    assertThat(result.getMatchedDrugClasses()).contains(DrugClass.OPIOID);
    assertThat(result.getWarnings()).isEmpty();
  }

  @Test
  void whitelistedDrugIsCleared() {
    ClassificationResult result = pipeline.classify("CC(=O)Oc1ccccc1C(=O)O");

    assertTrue(result.isWhitelisted());
    assertTrue(result.isInDatabase());
    assertEquals(ComplianceStatus.CLEARED, result.getStatus());
    assertEquals(0, result.getFlagCount());
    assertEquals("aspirin", result.getMatchedName());
  }

  @ParameterizedTest
  @ValueSource(
      strings = {
        "COc1cc(Cc2cnc(N)nc2N)cc(OC)c1OC",
        "CN1CCC[C@H]1c1cccnc1",
        "OC[C@H](O)[C@H]1OC(=O)C(O)=C1O",
        "O"
      })
  void approvedDrugsAndCommonCompoundsAreCleared(String smiles) {
    ClassificationResult result = pipeline.classify(smiles);

    assertTrue(result.isWhitelisted());
    assertEquals(ComplianceStatus.CLEARED, result.getStatus());
  }

  @Test
  void morphineIsNotReportedAsStimulant() {
    ClassificationResult result =
        pipeline.classify("CN1CCC23C4C1Cc5c2c(c(cc5)O)OC3C(C=C4)O");

    assertTrue(result.isDeaControlled());
    assertThat(result.getMatchedDrugClasses()).doesNotContain(DrugClass.STIMULANT);
  }

  @Test
  void whitelistSuppressesScaffoldResemblance() {
    // bupropion carries the cathinone scaffold
    ClassificationResult result = pipeline.classify("CC(NC(C)(C)C)C(=O)c1cccc(Cl)c1");

    assertEquals(ComplianceStatus.CLEARED, result.getStatus());
    assertFalse(result.isScaffoldMatch());
    assertThat(result.getMatchedPatternIds()).isEmpty();
  }

  @Test
  void unknownStructureWithoutScaffoldRaisesNothing() {
    ClassificationResult result = pipeline.classify("CCCCCCCC(=O)O");

    assertEquals(ComplianceStatus.NONE, result.getStatus());
    assertEquals(0, result.getFlagCount());
    assertFalse(result.isInDatabase());
    assertNull(result.getMatchedName());
    assertNull(result.getDeaSchedule());
  }

  @Test
  void novelAnalogueGoesToReview() {
    // para-fluoro analogue, not in either reference set
    ClassificationResult result =
        pipeline.classify("CCC(=O)N(c1ccc(F)cc1)C1CCN(CCc2ccccc2)CC1");

    assertEquals(ComplianceStatus.REVIEW, result.getStatus());
    assertFalse(result.isDeaControlled());
    assertTrue(result.isScaffoldMatch());
    assertEquals(1, result.getFlagCount());
    assertThat(result.getFirstMatchByClass())
        .containsEntry(DrugClass.OPIOID, "opioid-4-anilidopiperidine");
  }

  @Test
  void fdaBannedSubstanceRaisesThreeFlags() {
    ClassificationResult result = pipeline.classify("Cc1ccccc1-n1c(C)nc2ccccc2c1=O");

    assertTrue(result.isFdaBanned());
    assertEquals("I", result.getDeaSchedule());
    assertEquals(3, result.getFlagCount());
  }

  @Test
  void malformedStructureIsRejected() {
    assertThrows(StructureParseException.class, () -> pipeline.classify("C1CC(("));
    assertThrows(StructureParseException.class, () -> pipeline.classify(""));
  }

  @Test
  void enantiomersAreClassifiedSeparately() {
    ClassificationResult dextro = pipeline.classify(DEXTROMETHORPHAN);
    ClassificationResult levo = pipeline.classify(LEVOMETHORPHAN);

    assertEquals(ComplianceStatus.CLEARED, dextro.getStatus());
    assertEquals(ComplianceStatus.CONTROLLED, levo.getStatus());
    assertEquals("levomethorphan", levo.getMatchedName());
    assertThat(levo.getWarnings()).containsExactly(ConfidenceWarning.AMBIGUOUS_WHITELIST_MATCH);
    assertEquals(dextro.getCanonicalForm(), levo.getCanonicalForm());
  }

  @Test
  void unresolvedStereoSurfacesWarningsInsteadOfVerdict() {
    ClassificationResult result = pipeline.classify(METHORPHAN);

    assertFalse(result.isWhitelisted());
    assertFalse(result.isDeaControlled());
    assertTrue(result.isScaffoldMatch());
    assertEquals(ComplianceStatus.REVIEW, result.getStatus());
    assertThat(result.getWarnings())
        .containsExactly(
            ConfidenceWarning.AMBIGUOUS_WHITELIST_MATCH,
            ConfidenceWarning.AMBIGUOUS_CONTROLLED_MATCH);
    assertTrue(result.isDegraded());
  }

  @Test
  void cwcScheduledRecordIsCounted() {
    ClassificationPipeline fixtures =
        fixturePipeline(
            "classpath:fixtures/whitelist-small.tsv", "classpath:fixtures/patterns-small.json");

    ClassificationResult result = fixtures.classify("CN(C)P(=O)(OCC)C#N");

    assertTrue(result.isDeaControlled());
    assertTrue(result.isCwcScheduled());
    assertNull(result.getDeaSchedule());
    assertEquals(2, result.getFlagCount());
  }

  @Test
  void whitelistWinsOverControlledEntry() {
    ClassificationPipeline overlap =
        fixturePipeline(
            "classpath:fixtures/whitelist-overlap.tsv", "classpath:fixtures/patterns-small.json");

    ClassificationResult result = overlap.classify(FENTANYL);

    assertEquals(ComplianceStatus.CLEARED, result.getStatus());
    assertTrue(result.isWhitelisted());
    assertFalse(result.isDeaControlled());
    assertEquals(0, result.getFlagCount());
  }

  @ParameterizedTest
  @ValueSource(
      strings = {
        "CCC(=O)N(c1ccccc1)C1CCN(CCc2ccccc2)CC1",
        "O=C(CC)N(C1CCN(CCc2ccccc2)CC1)c1ccccc1",
        "c1ccc(cc1)CCN1CCC(CC1)N(c1ccccc1)C(=O)CC",
        "CCC(=O)N(C1=CC=CC=C1)C1CCN(CCC2=CC=CC=C2)CC1"
      })
  void controlledEntryIsFoundFromAnyRestatement(String fentanyl) {
    assertTrue(pipeline.classify(fentanyl).isDeaControlled());
  }

  @Test
  void classificationIsIdempotent() {
    for (String smiles : List.of(FENTANYL, METHORPHAN, "CCCCCCCC(=O)O", "Cl.CNC(C)Cc1ccccc1")) {
      assertEquals(pipeline.classify(smiles), pipeline.classify(smiles));
    }
  }

  @Test
  void morePatternsNeverLowerTheFlagCount() {
    ClassificationPipeline few =
        fixturePipeline(
            "classpath:fixtures/whitelist-small.tsv", "classpath:fixtures/patterns-small.json");
    ClassificationPipeline all =
        fixturePipeline(
            "classpath:fixtures/whitelist-small.tsv", "classpath:scaffold-patterns.json");

    for (String smiles :
        List.of(
            FENTANYL,
            "CCC(=O)N(c1ccc(F)cc1)C1CCN(CCc2ccccc2)CC1",
            "CNC(C)C(=O)c1ccc(C)cc1",
            "CN1C(=O)CN=C(c2ccccc2)c2cc(Cl)ccc21",
            "CCCCCCCC(=O)O")) {
      assertThat(all.classify(smiles).getFlagCount())
          .isGreaterThanOrEqualTo(few.classify(smiles).getFlagCount());
    }
  }

  @Test
  void patternsOutsideTheLibraryAreNotReported() {
    FavesConfigurationProperties properties = FavesConfiguration.load();
    properties.setPatternsPath("classpath:fixtures/patterns-small.json");
    ClassificationPipeline small = FavesBootstrap.createPipeline(properties);

    ClassificationResult result = small.classify("CN1C(=O)CN=C(c2ccccc2)c2cc(Cl)ccc21");

    assertTrue(result.isDeaControlled());
    assertFalse(result.isScaffoldMatch());
    assertEquals(1, result.getFlagCount());
  }

  @Test
  void scaffoldTimeoutDegradesVerdict() throws Exception {
    StructureNormalizer normalizer = new StructureNormalizer();
    ReferenceSetLoader loader = new ReferenceSetLoader(normalizer);
    ExactMatchIndex index =
        new ExactMatchIndex(
            loader.load("classpath:fixtures/whitelist-small.tsv", ReferenceCategory.WHITELISTED),
            loader.load("classpath:fixtures/controlled-small.tsv", ReferenceCategory.CONTROLLED));
    MoleculesMatcher slow = Mockito.mock(MoleculesMatcher.class);
    Mockito.when(slow.isSubstructureMatch(Mockito.any(), Mockito.any(), Mockito.anyLong()))
        .thenThrow(new MatchTimeoutException("deadline passed"));
    PatternLibrary library =
        new PatternLibraryLoader().load("classpath:fixtures/patterns-small.json");
    ClassificationPipeline degraded =
        new ClassificationPipeline(
            normalizer, index, new ScaffoldMatcher(library, slow, Duration.ofMillis(10)));

    ClassificationResult result = degraded.classify(FENTANYL);

    assertTrue(result.isDeaControlled());
    assertFalse(result.isScaffoldMatch());
    assertEquals(ComplianceStatus.CONTROLLED, result.getStatus());
    assertThat(result.getWarnings()).containsExactly(ConfidenceWarning.SCAFFOLD_MATCH_TIMEOUT);
    assertThat(result.getTimedOutPatternIds()).hasSize(3);
  }
}
