package com.quantori.faves.core.configuration;

import com.quantori.faves.api.FavesException;
import com.quantori.faves.api.match.SubstructureMatcher;
import com.quantori.faves.api.structure.StructureNormalizer;
import com.quantori.faves.core.classification.ClassificationPipeline;
import com.quantori.faves.core.index.ExactMatchIndex;
import com.quantori.faves.core.index.ReferenceCategory;
import com.quantori.faves.core.index.ReferenceRecord;
import com.quantori.faves.core.index.ReferenceSetLoader;
import com.quantori.faves.core.pattern.PatternLibrary;
import com.quantori.faves.core.pattern.PatternLibraryLoader;
import com.quantori.faves.core.scaffold.ScaffoldMatcher;
import java.util.List;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

/**
 * Loads the reference snapshots and the pattern library once and wires the pipeline. Any load
 * failure aborts startup.
 */
@Slf4j
@UtilityClass
public final class FavesBootstrap {

  public static ClassificationPipeline createPipeline(FavesConfigurationProperties properties) {
    FavesConfiguration.validate(properties);
    StructureNormalizer normalizer = new StructureNormalizer();
    try {
      ReferenceSetLoader referenceLoader = new ReferenceSetLoader(normalizer);
      List<ReferenceRecord> whitelist =
          referenceLoader.load(properties.getWhitelistPath(), ReferenceCategory.WHITELISTED);
      List<ReferenceRecord> controlled =
          referenceLoader.load(properties.getControlledPath(), ReferenceCategory.CONTROLLED);
      ExactMatchIndex index = new ExactMatchIndex(whitelist, controlled);
      PatternLibrary library = new PatternLibraryLoader().load(properties.getPatternsPath());
      return new ClassificationPipeline(
          normalizer,
          index,
          new ScaffoldMatcher(library, new SubstructureMatcher(), properties.getMatchTimeout()));
    } catch (FavesException e) {
      log.error("Classification core failed to start: {}", e.getMessage());
      throw e;
    }
  }
}
