package com.quantori.faves.core.index;

import lombok.Builder;
import lombok.Value;

/**
 * An entry of the exact-match index.
 */
@Value
@Builder
public class ReferenceRecord {
  String name;
  String canonicalForm;
  String secondaryHash;
  ReferenceCategory category;
  /** DEA schedule (I to V), null when unscheduled. */
  String schedule;
  boolean fdaBanned;
  boolean cwcScheduled;
  /** The record carries no stereo information and matches every stereoisomer. */
  boolean stereoAgnostic;
}
