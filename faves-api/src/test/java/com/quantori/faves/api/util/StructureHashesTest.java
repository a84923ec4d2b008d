package com.quantori.faves.api.util;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.core.Is.is;

import java.util.Locale;
import org.apache.commons.codec.digest.DigestUtils;
import org.junit.jupiter.api.Test;

class StructureHashesTest {

  @Test
  void stereoLayerChangesSecondaryHash() {
    String flat = StructureHashes.secondaryHash("CC(N)C(=O)O", "");

    assertThat(StructureHashes.stereoAgnosticHash("CC(N)C(=O)O"), is(equalTo(flat)));
    assertThat(StructureHashes.secondaryHash("CC(N)C(=O)O", "1@"), is(not(equalTo(flat))));
  }

  @Test
  void secondaryHashCoversCanonicalFormAndLayer() {
    String expected = DigestUtils.md5Hex("C/1@").toUpperCase(Locale.ROOT);

    assertThat(StructureHashes.secondaryHash("C", "1@"), is(equalTo(expected)));
  }

  @Test
  void canonicalKeyIsStable() {
    long key = StructureHashes.canonicalKey("CCO");

    assertThat(StructureHashes.canonicalKey("CCO"), is(equalTo(key)));
    assertThat(StructureHashes.canonicalKey("OCC"), is(not(equalTo(key))));
  }
}
