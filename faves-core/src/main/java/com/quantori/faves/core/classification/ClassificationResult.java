package com.quantori.faves.core.classification;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.quantori.faves.core.pattern.DrugClass;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Compliance verdict for one structure. Property names follow the compliance vocabulary used by
 * callers ({@code is_dea_controlled}, {@code faves_flag_count}, ...).
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"status", "faves_flag_count", "is_whitelisted", "is_dea_controlled",
    "is_scaffold_match", "is_fda_banned", "is_cwc_scheduled", "in_database"})
public class ClassificationResult {
  @JsonProperty("canonical_form")
  String canonicalForm;

  @JsonProperty("secondary_hash")
  String secondaryHash;

  @JsonProperty("is_whitelisted")
  boolean whitelisted;

  @JsonProperty("is_dea_controlled")
  boolean deaControlled;

  @JsonProperty("is_scaffold_match")
  boolean scaffoldMatch;

  @JsonProperty("is_fda_banned")
  boolean fdaBanned;

  @JsonProperty("is_cwc_scheduled")
  boolean cwcScheduled;

  /** Found in either reference set. */
  @JsonProperty("in_database")
  boolean inDatabase;

  @JsonProperty("faves_flag_count")
  int flagCount;

  @JsonProperty("status")
  ComplianceStatus status;

  @JsonProperty("matched_name")
  String matchedName;

  @JsonProperty("dea_schedule")
  String deaSchedule;

  @Builder.Default
  @JsonProperty("matched_patterns")
  List<String> matchedPatternIds = List.of();

  @Builder.Default
  @JsonProperty("drug_classes")
  List<DrugClass> matchedDrugClasses = List.of();

  @Builder.Default
  @JsonProperty("first_match_by_class")
  Map<DrugClass, String> firstMatchByClass = Map.of();

  @Builder.Default
  @JsonProperty("timed_out_patterns")
  List<String> timedOutPatternIds = List.of();

  @Builder.Default
  @JsonProperty("warnings")
  List<ConfidenceWarning> warnings = List.of();

  @JsonIgnore
  public boolean isDegraded() {
    return !warnings.isEmpty();
  }
}
