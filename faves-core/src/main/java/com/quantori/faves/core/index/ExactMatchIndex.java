package com.quantori.faves.core.index;

import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Read-only exact-match lookups over the whitelist and the controlled-substance reference set.
 * Built once from immutable snapshots and safe for concurrent readers.
 */
@Slf4j
public class ExactMatchIndex {
  private final ReferencePartition whitelist;
  private final ReferencePartition controlled;

  public ExactMatchIndex(List<ReferenceRecord> whitelist, List<ReferenceRecord> controlled) {
    this.whitelist = new ReferencePartition(whitelist);
    this.controlled = new ReferencePartition(controlled);
    log.info(
        "Exact-match index built with {} whitelist and {} controlled records",
        this.whitelist.size(),
        this.controlled.size());
  }

  /**
   * Looks up a canonical form in the whitelist.
   *
   * @param canonicalForm canonical SMILES
   * @return the first whitelist record with this canonical form
   */
  public Optional<ReferenceRecord> lookupWhitelist(String canonicalForm) {
    return whitelist.find(canonicalForm).stream().findFirst();
  }

  /**
   * Looks up a structure in the controlled-substance set. Canonical-form hits whose secondary hash
   * disagrees are treated as no match.
   *
   * @param canonicalForm canonical SMILES
   * @param secondaryHash secondary hash of the query structure
   * @return the matching record
   */
  public Optional<ReferenceRecord> lookupControlled(String canonicalForm, String secondaryHash) {
    return findControlled(canonicalForm, secondaryHash).toOptional();
  }

  public IndexLookup findWhitelist(String canonicalForm, String secondaryHash) {
    return resolve(whitelist.find(canonicalForm), secondaryHash);
  }

  public IndexLookup findControlled(String canonicalForm, String secondaryHash) {
    return resolve(controlled.find(canonicalForm), secondaryHash);
  }

  public int whitelistSize() {
    return whitelist.size();
  }

  public int controlledSize() {
    return controlled.size();
  }

  private static IndexLookup resolve(List<ReferenceRecord> candidates, String secondaryHash) {
    if (candidates.isEmpty()) {
      return IndexLookup.miss();
    }
    for (ReferenceRecord candidate : candidates) {
      if (candidate.getSecondaryHash().equals(secondaryHash)) {
        return IndexLookup.match(candidate);
      }
    }
    for (ReferenceRecord candidate : candidates) {
      if (candidate.isStereoAgnostic()) {
        return IndexLookup.match(candidate);
      }
    }
    return IndexLookup.ambiguous();
  }
}
