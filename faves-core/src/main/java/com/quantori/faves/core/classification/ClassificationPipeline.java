package com.quantori.faves.core.classification;

import com.quantori.faves.api.structure.NormalizedStructure;
import com.quantori.faves.api.structure.StructureNormalizer;
import com.quantori.faves.core.index.ExactMatchIndex;
import com.quantori.faves.core.index.IndexLookup;
import com.quantori.faves.core.index.ReferenceRecord;
import com.quantori.faves.core.scaffold.ScaffoldMatcher;
import com.quantori.faves.core.scaffold.ScaffoldReport;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;

/**
 * Three-tier classification: whitelist, direct controlled-substance match, scaffold match. Only the
 * whitelist tier short-circuits. Holds read-only state and may be shared between threads.
 */
@Slf4j
public class ClassificationPipeline {
  private final StructureNormalizer normalizer;
  private final ExactMatchIndex index;
  private final ScaffoldMatcher scaffoldMatcher;

  public ClassificationPipeline(
      StructureNormalizer normalizer, ExactMatchIndex index, ScaffoldMatcher scaffoldMatcher) {
    this.normalizer = normalizer;
    this.index = index;
    this.scaffoldMatcher = scaffoldMatcher;
  }

  /**
   * Classifies a structure.
   *
   * @param structure SMILES text
   * @return the verdict
   * @throws com.quantori.faves.api.StructureParseException if the text is malformed
   */
  public ClassificationResult classify(String structure) {
    return classify(normalizer.normalize(structure));
  }

  public ClassificationResult classify(NormalizedStructure structure) {
    String canonicalForm = structure.getCanonicalForm();
    String secondaryHash = structure.getSecondaryHash();
    List<ConfidenceWarning> warnings = new ArrayList<>();

    IndexLookup whitelist = index.findWhitelist(canonicalForm, secondaryHash);
    if (whitelist.isMatch()) {
      ReferenceRecord record = whitelist.getRecord();
      log.debug("{} whitelisted as {}", canonicalForm, record.getName());
      return ClassificationResult.builder()
          .canonicalForm(canonicalForm)
          .secondaryHash(secondaryHash)
          .whitelisted(true)
          .inDatabase(true)
          .matchedName(record.getName())
          .status(ComplianceStatus.CLEARED)
          .build();
    }
    if (whitelist.isAmbiguous()) {
      log.warn("Whitelist hit on {} rejected by secondary hash", canonicalForm);
      warnings.add(ConfidenceWarning.AMBIGUOUS_WHITELIST_MATCH);
    }

    IndexLookup controlled = index.findControlled(canonicalForm, secondaryHash);
    ReferenceRecord record = controlled.getRecord();
    boolean deaControlled = controlled.isMatch();
    if (controlled.isAmbiguous()) {
      log.warn("Controlled-substance hit on {} rejected by secondary hash", canonicalForm);
      warnings.add(ConfidenceWarning.AMBIGUOUS_CONTROLLED_MATCH);
    }
    boolean fdaBanned = deaControlled && record.isFdaBanned();
    boolean cwcScheduled = deaControlled && record.isCwcScheduled();

    ScaffoldReport scaffolds = scaffoldMatcher.matchAll(structure.getMolecule());
    if (scaffolds.isDegraded()) {
      warnings.add(ConfidenceWarning.SCAFFOLD_MATCH_TIMEOUT);
    }
    int flagCount =
        (int) Stream.of(deaControlled, scaffolds.isMatch(), fdaBanned, cwcScheduled)
            .filter(Boolean::booleanValue)
            .count();
    ComplianceStatus status = ComplianceStatus.of(false, deaControlled, scaffolds.isMatch());
    log.debug(
        "{} classified {}: controlled={}, scaffolds={}",
        canonicalForm,
        status,
        deaControlled,
        scaffolds.getMatchedPatternIds());

    return ClassificationResult.builder()
        .canonicalForm(canonicalForm)
        .secondaryHash(secondaryHash)
        .deaControlled(deaControlled)
        .scaffoldMatch(scaffolds.isMatch())
        .fdaBanned(fdaBanned)
        .cwcScheduled(cwcScheduled)
        .inDatabase(deaControlled)
        .flagCount(flagCount)
        .status(status)
        .matchedName(deaControlled ? record.getName() : null)
        .deaSchedule(deaControlled ? record.getSchedule() : null)
        .matchedPatternIds(scaffolds.getMatchedPatternIds())
        .matchedDrugClasses(scaffolds.getMatchedDrugClasses())
        .firstMatchByClass(scaffolds.getFirstMatchByClass())
        .timedOutPatternIds(scaffolds.getTimedOutPatternIds())
        .warnings(List.copyOf(warnings))
        .build();
  }
}
