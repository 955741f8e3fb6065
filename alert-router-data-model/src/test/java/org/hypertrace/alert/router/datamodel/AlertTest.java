package org.hypertrace.alert.router.datamodel;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import org.hypertrace.alert.router.datamodel.json.ObjectMapperProvider;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class AlertTest {
  private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");

  @Test
  void testFingerprintIsOrderIndependent() {
    Map<String, String> first = new LinkedHashMap<>();
    first.put("alertname", "HighLatency");
    first.put("service", "checkout");
    Map<String, String> second = new LinkedHashMap<>();
    second.put("service", "checkout");
    second.put("alertname", "HighLatency");

    Assertions.assertEquals(Fingerprints.of(first), Fingerprints.of(second));
    Assertions.assertEquals(alert(first).getFingerprint(), alert(second).getFingerprint());
  }

  @Test
  void testFingerprintDiffersOnKeyOrValue() {
    long base = Fingerprints.of(Map.of("a", "1", "b", "x"));
    Assertions.assertNotEquals(base, Fingerprints.of(Map.of("a", "1", "b", "y")));
    Assertions.assertNotEquals(base, Fingerprints.of(Map.of("a", "1", "c", "x")));
    Assertions.assertNotEquals(base, Fingerprints.of(Map.of("a", "1")));
    // separators keep "ab=c" apart from "a=bc"
    Assertions.assertNotEquals(
        Fingerprints.of(Map.of("ab", "c")), Fingerprints.of(Map.of("a", "bc")));
  }

  @Test
  void testAlertWithoutLabelsIsRejected() {
    Assertions.assertThrows(
        IllegalArgumentException.class, () -> Alert.builder().labels(Map.of()).build());
  }

  @Test
  void testResolved() {
    Alert firing = alert(Map.of("a", "1"));
    Assertions.assertFalse(firing.isResolved(NOW));

    Alert ended = firing.toBuilder().endsAt(NOW.minusSeconds(1)).build();
    Assertions.assertTrue(ended.isResolved(NOW));
    Assertions.assertTrue(ended.toBuilder().endsAt(NOW).build().isResolved(NOW));

    Alert endsLater = firing.toBuilder().endsAt(NOW.plusSeconds(60)).build();
    Assertions.assertFalse(endsLater.isResolved(NOW));
    Assertions.assertNull(endsLater.snapshotAt(NOW).getEndsAt());
    Assertions.assertEquals(ended, ended.snapshotAt(NOW));
  }

  @Test
  void testMergeKeepsEarliestStartAndNewerVersion() {
    Alert older =
        alert(Map.of("a", "1")).toBuilder()
            .startsAt(NOW.minusSeconds(600))
            .updatedAt(NOW.minusSeconds(60))
            .annotations(Map.of("summary", "old"))
            .build();
    Alert newer =
        alert(Map.of("a", "1")).toBuilder()
            .startsAt(NOW.minusSeconds(300))
            .updatedAt(NOW)
            .annotations(Map.of("summary", "new"))
            .endsAt(NOW.minusSeconds(10))
            .build();

    Alert merged = older.merge(newer, NOW);
    Assertions.assertEquals(NOW.minusSeconds(600), merged.getStartsAt());
    Assertions.assertEquals("new", merged.getAnnotations().get("summary"));
    Assertions.assertEquals(NOW.minusSeconds(10), merged.getEndsAt());
    Assertions.assertEquals(merged, newer.merge(older, NOW));
  }

  @Test
  void testMergeKeepsEarlierResolution() {
    Alert resolvedEarly =
        alert(Map.of("a", "1")).toBuilder()
            .updatedAt(NOW.minusSeconds(60))
            .endsAt(NOW.minusSeconds(120))
            .build();
    Alert resolvedLate =
        alert(Map.of("a", "1")).toBuilder().updatedAt(NOW).endsAt(NOW.minusSeconds(30)).build();

    Assertions.assertEquals(
        NOW.minusSeconds(120), resolvedEarly.merge(resolvedLate, NOW).getEndsAt());
  }

  @Test
  void testMergeRejectsDifferentLabels() {
    Assertions.assertThrows(
        IllegalArgumentException.class,
        () -> alert(Map.of("a", "1")).merge(alert(Map.of("a", "2")), NOW));
  }

  @Test
  void testJsonDecodingFillsDefaults() throws Exception {
    String json = "{\"labels\":{\"alertname\":\"Down\",\"service\":\"x\"},\"unknown\":1}";
    Alert decoded = ObjectMapperProvider.get().readValue(json, Alert.class).withDefaults(NOW);

    Assertions.assertEquals(NOW, decoded.getStartsAt());
    Assertions.assertEquals(NOW, decoded.getUpdatedAt());
    Assertions.assertTrue(decoded.getAnnotations().isEmpty());
    Assertions.assertEquals(
        Fingerprints.of(Map.of("alertname", "Down", "service", "x")), decoded.getFingerprint());

    String encoded = ObjectMapperProvider.get().writeValueAsString(decoded);
    Assertions.assertFalse(encoded.contains("fingerprint"));
    Assertions.assertTrue(encoded.contains("2024-03-01T10:00:00Z"));
  }

  private static Alert alert(Map<String, String> labels) {
    return Alert.builder().labels(labels).startsAt(NOW).updatedAt(NOW).build();
  }
}
