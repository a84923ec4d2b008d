package com.quantori.faves.core.index;

public enum ReferenceCategory {
  WHITELISTED,
  CONTROLLED
}
