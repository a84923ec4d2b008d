package com.quantori.faves.core.index;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/**
 * One row of a tab-separated reference snapshot.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
class ReferenceRow {
  @JsonProperty("name")
  private String name;

  @JsonProperty("structure")
  private String structure;

  @JsonProperty("canonical_form")
  private String canonicalForm;

  @JsonProperty("secondary_hash")
  private String secondaryHash;

  @JsonProperty("schedule")
  private String schedule;

  @JsonProperty("fda_banned")
  private String fdaBanned;

  @JsonProperty("cwc_scheduled")
  private String cwcScheduled;
}
