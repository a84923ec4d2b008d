package com.quantori.faves.api.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class Bond {
  int begin;
  int end;
  BondOrder order;
  @Builder.Default BondStereo stereo = BondStereo.NONE;

  public int other(int atom) {
    return atom == begin ? end : begin;
  }

  public boolean connects(int a, int b) {
    return (begin == a && end == b) || (begin == b && end == a);
  }
}
