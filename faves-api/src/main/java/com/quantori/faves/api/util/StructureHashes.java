package com.quantori.faves.api.util;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import lombok.experimental.UtilityClass;
import org.apache.commons.codec.digest.DigestUtils;
import org.apache.commons.codec.digest.MurmurHash3;

/**
 * Hashes derived from canonical structures.
 */
@UtilityClass
public final class StructureHashes {
  private static final String LAYER_SEPARATOR = "/";

  /**
   * Secondary hash of a structure: MD5 over the canonical form and its stereo layer.
   *
   * @param canonicalForm canonical SMILES
   * @param stereoLayer   canonical stereo descriptors, empty when no stereocentre is defined
   * @return upper case hex digest
   */
  public static String secondaryHash(String canonicalForm, String stereoLayer) {
    return DigestUtils.md5Hex(canonicalForm + LAYER_SEPARATOR + stereoLayer)
        .toUpperCase(Locale.ROOT);
  }

  /**
   * Hash of a canonical form with no stereo information. Reference records carrying this hash
   * match every stereoisomer of their canonical form.
   */
  public static String stereoAgnosticHash(String canonicalForm) {
    return secondaryHash(canonicalForm, "");
  }

  /** 64-bit table key of a canonical form. */
  public static long canonicalKey(String canonicalForm) {
    return MurmurHash3.hash128x64(canonicalForm.getBytes(StandardCharsets.UTF_8))[0];
  }
}
