package org.hypertrace.alert.router.datamodel;

import com.google.common.hash.HashFunction;
import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.TreeMap;

/** Order independent 64 bit fingerprints of label sets. */
public class Fingerprints {
  private static final HashFunction HASH_FUNCTION = Hashing.farmHashFingerprint64();
  private static final char SEPARATOR = '\u00ff';

  private Fingerprints() {}

  public static long of(Map<String, String> labels) {
    Hasher hasher = HASH_FUNCTION.newHasher();
    new TreeMap<>(labels)
        .forEach(
            (name, value) -> {
              hasher.putString(name, StandardCharsets.UTF_8);
              hasher.putChar(SEPARATOR);
              hasher.putString(value, StandardCharsets.UTF_8);
              hasher.putChar(SEPARATOR);
            });
    return hasher.hash().asLong();
  }

  public static String toHex(long fingerprint) {
    return String.format("%016x", fingerprint);
  }
}
