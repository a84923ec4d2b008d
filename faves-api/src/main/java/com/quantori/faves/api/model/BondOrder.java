package com.quantori.faves.api.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum BondOrder {
  SINGLE(1, "-"),
  DOUBLE(2, "="),
  TRIPLE(3, "#"),
  QUADRUPLE(4, "$"),
  AROMATIC(1, ":");

  /** Contribution to the valence of each end; aromatic bonds count one plus the shared pi bond. */
  private final int valence;
  private final String symbol;
}
