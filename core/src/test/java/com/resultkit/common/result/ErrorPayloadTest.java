package com.resultkit.common.result;

import static org.junit.jupiter.api.Assertions.*;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

/** Tests for ErrorPayload. */
public class ErrorPayloadTest {

  @Test
  void testTypeOnly() {
    ErrorPayload error = ErrorPayload.of("NotFound");
    assertEquals("NotFound", error.type());
    assertTrue(error.fields().isEmpty());
    assertEquals(Optional.empty(), error.cause());
    assertEquals(Map.of("type", "NotFound"), error.toMap());
  }

  @Test
  void testFieldsKeepInsertionOrder() {
    ErrorPayload error =
        ErrorPayload.builder("Timeout").put("ms", 2500).put("host", "db").put("attempt", 3).build();
    assertEquals(List.of("ms", "host", "attempt"), ImmutableList.copyOf(error.fields().keySet()));
    assertEquals(
        List.of("type", "ms", "host", "attempt"), ImmutableList.copyOf(error.toMap().keySet()));
  }

  @Test
  void testGetAnswersReservedKeys() {
    ErrorPayload cause = ErrorPayload.of("IO");
    ErrorPayload error = ErrorPayload.builder("ConfigFileMissing").put("path", "/etc/app.json")
        .cause(cause).build();
    assertEquals("ConfigFileMissing", error.get("type"));
    assertEquals("/etc/app.json", error.get("path"));
    assertSame(cause, error.get("cause"));
    assertNull(error.get("missing"));
    assertTrue(error.has("path"));
    assertFalse(error.has("type"));
  }

  @Test
  void testCauseEntryInFieldsSetsCause() {
    ErrorPayload base = ErrorPayload.of("A", ImmutableMap.of("id", 2));
    ErrorPayload error = ErrorPayload.of("B", ImmutableMap.of("cause", base, "extra", 1));
    assertEquals(Optional.of(base), error.causePayload());
    assertEquals(ImmutableMap.of("extra", 1), error.fields());
  }

  @Test
  void testTypeEntryInFieldsIsRejected() {
    assertThrows(
        IllegalArgumentException.class,
        () -> ErrorPayload.of("A", ImmutableMap.of("type", "B")));
  }

  @Test
  void testEmptyTypeIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> ErrorPayload.of(""));
    assertThrows(IllegalArgumentException.class, () -> ErrorPayload.of(null));
  }

  @Test
  void testNullFieldValueIsRejected() {
    Map<String, Object> fields = new LinkedHashMap<>();
    fields.put("id", null);
    assertThrows(NullPointerException.class, () -> ErrorPayload.of("A", fields));
  }

  @Test
  void testNumericFieldsAreCanonical() {
    ErrorPayload error = ErrorPayload.builder("Timeout")
        .put("ms", 1000L)
        .put("retries", (short) 3)
        .put("epochMs", 5_000_000_000L)
        .put("ratio", 0.1f)
        .put("load", 0.75)
        .build();

    assertEquals(Integer.valueOf(1000), error.get("ms"));
    assertEquals(Integer.valueOf(3), error.get("retries"));
    assertEquals(Long.valueOf(5_000_000_000L), error.get("epochMs"));
    assertEquals(Double.valueOf(0.1), error.get("ratio"));
    assertEquals(Double.valueOf(0.75), error.get("load"));
    assertEquals(ErrorPayload.of("Timeout", ImmutableMap.of("ms", 1000)),
        ErrorPayload.of("Timeout", ImmutableMap.of("ms", 1000L)));
  }

  @Test
  void testCauseChainOutermostFirst() {
    IllegalStateException root = new IllegalStateException("ENOENT");
    ErrorPayload io = ErrorPayload.builder("IO").cause(root).build();
    ErrorPayload config = ErrorPayload.builder("ConfigFileMissing").cause(io).build();
    ErrorPayload startup = ErrorPayload.builder("StartupFailed").cause(config).build();

    assertEquals(List.of(startup, config, io, root), startup.causeChain());
    assertSame(root, startup.rootCause());
    assertSame(io, config.causePayload().orElseThrow());
    assertEquals(Optional.empty(), io.causePayload());
  }

  @Test
  void testRootCauseOfUnchainedPayloadIsItself() {
    ErrorPayload error = ErrorPayload.of("A");
    assertSame(error, error.rootCause());
    assertEquals(List.of(error), error.causeChain());
  }

  @Test
  void testToMapFlattensCausePayloads() {
    ErrorPayload error = ErrorPayload.builder("B").put("extra", 1)
        .cause(ErrorPayload.of("A", ImmutableMap.of("id", 2))).build();
    Map<String, Object> expected = new LinkedHashMap<>();
    expected.put("type", "B");
    expected.put("extra", 1);
    expected.put("cause", Map.of("type", "A", "id", 2));
    assertEquals(expected, error.toMap());
  }

  @Test
  void testEquality() {
    ErrorPayload a = ErrorPayload.of("A", ImmutableMap.of("id", 2));
    ErrorPayload b = ErrorPayload.builder("A").put("id", 2).build();
    assertEquals(a, b);
    assertEquals(a.hashCode(), b.hashCode());
    assertNotEquals(a, ErrorPayload.of("A", ImmutableMap.of("id", 3)));
    assertNotEquals(a, ErrorPayload.builder("A").put("id", 2).cause("x").build());
  }

  @Test
  void testToString() {
    ErrorPayload error = ErrorPayload.builder("Timeout").put("ms", 1000).build();
    assertEquals("ErrorPayload{type=Timeout, ms=1000}", error.toString());
  }
}
