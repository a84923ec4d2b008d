package com.quantori.faves.api.model;

/** Directional single bond marks ({@code /} and {@code \}) around double bonds. */
public enum BondStereo {
  NONE,
  UP,
  DOWN
}
