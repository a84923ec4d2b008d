package com.quantori.faves.core.index;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.quantori.faves.api.StructureParseException;
import com.quantori.faves.api.structure.StructureNormalizer;
import com.quantori.faves.api.util.StructureHashes;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class ReferenceSetLoaderTest {
  private final StructureNormalizer normalizer = new StructureNormalizer();
  private final ReferenceSetLoader loader = new ReferenceSetLoader(normalizer);

  @Test
  void loadsClasspathSnapshot() {
    List<ReferenceRecord> records =
        loader.load("classpath:fixtures/controlled-small.tsv", ReferenceCategory.CONTROLLED);

    Map<String, ReferenceRecord> byName =
        records.stream().collect(Collectors.toMap(ReferenceRecord::getName, Function.identity()));
    assertThat(byName).containsOnlyKeys("fentanyl", "methaqualone", "levomethorphan", "tabun");

    ReferenceRecord fentanyl = byName.get("fentanyl");
    assertEquals(ReferenceCategory.CONTROLLED, fentanyl.getCategory());
    assertEquals("II", fentanyl.getSchedule());
    assertEquals(
        normalizer.canonicalForm("CCC(=O)N(c1ccccc1)C1CCN(CCc2ccccc2)CC1"),
        fentanyl.getCanonicalForm());
    assertTrue(fentanyl.isStereoAgnostic());

    assertTrue(byName.get("methaqualone").isFdaBanned());
    assertEquals("II", byName.get("levomethorphan").getSchedule());
    assertFalse(byName.get("levomethorphan").isStereoAgnostic());

    ReferenceRecord tabun = byName.get("tabun");
    assertNull(tabun.getSchedule());
    assertTrue(tabun.isCwcScheduled());
    assertFalse(tabun.isFdaBanned());
  }

  @Test
  void keepsPrecomputedCanonicalForms() {
    List<ReferenceRecord> records =
        loader.load("classpath:fixtures/precomputed.tsv", ReferenceCategory.WHITELISTED);

    ReferenceRecord ethanol = records.get(0);
    assertEquals("CCO", ethanol.getCanonicalForm());
    assertEquals(StructureHashes.stereoAgnosticHash("CCO"), ethanol.getSecondaryHash());
    assertTrue(ethanol.isStereoAgnostic());
    assertEquals(normalizer.canonicalForm("NCC(=O)O"), records.get(1).getCanonicalForm());
  }

  @Test
  void loadsFileSnapshot(@TempDir Path directory) throws Exception {
    Path snapshot = directory.resolve("whitelist.tsv");
    Files.writeString(
        snapshot,
        "name\tstructure\n"
            + "# comment lines are skipped\n"
            + "caffeine\tCn1cnc2c1c(=O)n(C)c(=O)n2C\n"
            + "\n"
            + "ethanol\tCCO\n");

    List<ReferenceRecord> records =
        loader.load(snapshot.toString(), ReferenceCategory.WHITELISTED);

    assertThat(records).extracting(ReferenceRecord::getName).containsExactly("caffeine", "ethanol");
  }

  @Test
  void wrapsInvalidStructureWithRowNumber() {
    IndexLoadException error =
        assertThrows(
            IndexLoadException.class,
            () ->
                loader.load(
                    "classpath:fixtures/broken-structure.tsv", ReferenceCategory.WHITELISTED));

    assertThat(error.getMessage()).contains("row 2").contains("garbage");
    assertThat(error.getCause()).isInstanceOf(StructureParseException.class);
  }

  @ParameterizedTest
  @ValueSource(
      strings = {
        "classpath:fixtures/broken-schedule.tsv",
        "classpath:fixtures/broken-flag.tsv",
        "classpath:fixtures/missing-name.tsv",
        "classpath:fixtures/does-not-exist.tsv"
      })
  void rejectsInvalidSnapshots(String location) {
    assertThrows(
        IndexLoadException.class, () -> loader.load(location, ReferenceCategory.CONTROLLED));
  }

  @Test
  void rejectsRowWithoutStructureOrCanonicalForm() {
    String snapshot = "name\tstructure\tcanonical_form\nempty\t\t\n";

    IndexLoadException error =
        assertThrows(
            IndexLoadException.class,
            () ->
                loader.read(
                    new StringReader(snapshot), ReferenceCategory.WHITELISTED, "inline"));

    assertThat(error.getMessage()).startsWith("inline, row 1");
  }

  @Test
  void rejectsPrecomputedFormThatIsNotCanonical() {
    String snapshot = "name\tstructure\tcanonical_form\nethanol\t\tOCC\n";

    IndexLoadException error =
        assertThrows(
            IndexLoadException.class,
            () ->
                loader.read(
                    new StringReader(snapshot), ReferenceCategory.WHITELISTED, "inline"));

    assertThat(error.getMessage())
        .startsWith("inline, row 1")
        .contains("OCC")
        .contains("expected CCO");
  }

  @Test
  void rejectsPrecomputedFormThatDoesNotParse() {
    String snapshot = "name\tstructure\tcanonical_form\nbroken\t\tC1CC((\n";

    IndexLoadException error =
        assertThrows(
            IndexLoadException.class,
            () ->
                loader.read(
                    new StringReader(snapshot), ReferenceCategory.WHITELISTED, "inline"));

    assertThat(error.getMessage()).startsWith("inline, row 1").contains("broken");
    assertThat(error.getCause()).isInstanceOf(StructureParseException.class);
  }
}
