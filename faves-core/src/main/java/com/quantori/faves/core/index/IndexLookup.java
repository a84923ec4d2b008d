package com.quantori.faves.core.index;

import java.util.Optional;
import lombok.Value;

/**
 * Outcome of a hash-aware lookup in one partition.
 */
@Value
public class IndexLookup {
  private static final IndexLookup MISS = new IndexLookup(LookupStatus.MISS, null);
  private static final IndexLookup AMBIGUOUS = new IndexLookup(LookupStatus.AMBIGUOUS, null);

  LookupStatus status;
  ReferenceRecord record;

  public static IndexLookup miss() {
    return MISS;
  }

  public static IndexLookup ambiguous() {
    return AMBIGUOUS;
  }

  public static IndexLookup match(ReferenceRecord record) {
    return new IndexLookup(LookupStatus.MATCH, record);
  }

  public boolean isMatch() {
    return status == LookupStatus.MATCH;
  }

  public boolean isAmbiguous() {
    return status == LookupStatus.AMBIGUOUS;
  }

  public Optional<ReferenceRecord> toOptional() {
    return Optional.ofNullable(record);
  }
}
