package com.quantori.faves.core.scaffold;

import com.quantori.faves.core.pattern.DrugClass;
import java.util.List;
import java.util.Map;
import lombok.Value;

/**
 * Scaffold stage outcome for one candidate.
 */
@Value
public class ScaffoldReport {
  /** Ids of every matched pattern, in library order. */
  List<String> matchedPatternIds;
  /** Distinct classes of the matched patterns, in library order. */
  List<DrugClass> matchedDrugClasses;
  /** First matched pattern id for each class. */
  Map<DrugClass, String> firstMatchByClass;
  /** Patterns abandoned at their deadline and counted as not matched. */
  List<String> timedOutPatternIds;

  public boolean isMatch() {
    return !matchedPatternIds.isEmpty();
  }

  public boolean isDegraded() {
    return !timedOutPatternIds.isEmpty();
  }
}
