package com.resultkit.common.result;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.verifyNoInteractions;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/** Tests for the Ok and Err variants and the methods they carry. */
@ExtendWith(MockitoExtension.class)
public class ResultTest {

  @Mock private Function<Integer, Integer> valueMapper;
  @Mock private Function<String, String> errorMapper;
  @Mock private Function<Integer, Result<Integer, String>> step;
  @Mock private Supplier<Integer> fallback;

  @Test
  void testOkCreation() {
    Result<Integer, String> result = Result.ok(42);
    assertTrue(result.isOk());
    assertFalse(result.isErr());
    assertEquals(42, result.getValue());
    assertThrows(IllegalStateException.class, result::getError);
    assertInstanceOf(Result.Ok.class, result);
  }

  @Test
  void testOkWithoutValue() {
    Result<Void, String> result = Result.ok();
    assertTrue(result.isOk());
    assertNull(result.getValue());
    assertEquals(Optional.empty(), result.toOptional());
  }

  @Test
  void testErrCreation() {
    Result<Integer, String> result = Result.err("boom");
    assertFalse(result.isOk());
    assertTrue(result.isErr());
    assertEquals("boom", result.getError());
    assertThrows(IllegalStateException.class, result::getValue);
    assertInstanceOf(Result.Err.class, result);
  }

  @Test
  void testErrRequiresError() {
    assertThrows(NullPointerException.class, () -> Result.err(null));
  }

  @Test
  void testMapOnOkAppliesFunction() {
    Result<Integer, String> mapped = Result.<Integer, String>ok(2).map(n -> n * 2);
    assertEquals(Result.ok(4), mapped);
  }

  @Test
  void testMapOnErrSkipsFunction() {
    Result<Integer, String> failure = Result.err("E");
    Result<Integer, String> mapped = failure.map(valueMapper);
    assertSame(failure, mapped);
    verifyNoInteractions(valueMapper);
  }

  @Test
  void testMapErrOnErrAppliesFunction() {
    Result<Integer, ErrorPayload> failure =
        Result.err(ErrorPayload.of("E", ImmutableMap.of("id", 1)));
    Result<Integer, ErrorPayload> tagged = failure.mapErr(
        e -> ErrorPayload.builder(e.type()).putAll(e.fields()).put("tag", "X").build());
    assertEquals("X", tagged.getError().get("tag"));
    assertEquals(1, tagged.getError().get("id"));
  }

  @Test
  void testMapErrOnOkSkipsFunction() {
    Result<Integer, String> success = Result.ok(7);
    Result<Integer, String> mapped = success.mapErr(errorMapper);
    assertSame(success, mapped);
    verifyNoInteractions(errorMapper);
  }

  @Test
  void testFlatMapOnOkReturnsFunctionResult() {
    Result<Integer, String> next = Result.err("Div0");
    Result<Integer, String> chained = Result.<Integer, String>ok(10).flatMap(n -> next);
    assertSame(next, chained);

    Result<Integer, String> divided = Result.<Integer, String>ok(10).flatMap(n -> divide(n, 5));
    assertEquals(Result.ok(2), divided);
  }

  @Test
  void testFlatMapOnErrShortCircuits() {
    Result<Integer, String> failure = Result.err("E");
    assertSame(failure, failure.flatMap(step));
    verifyNoInteractions(step);
  }

  @Test
  void testUnwrapOk() {
    assertEquals(42, Result.ok(42).unwrap());
  }

  @Test
  void testUnwrapRethrowsUncheckedErrorItself() {
    IllegalArgumentException error = new IllegalArgumentException("bad");
    Result<Integer, IllegalArgumentException> failure = Result.err(error);
    IllegalArgumentException thrown = assertThrows(IllegalArgumentException.class, failure::unwrap);
    assertSame(error, thrown);
  }

  @Test
  void testUnwrapCarriesNonThrowableError() {
    ErrorPayload error = ErrorPayload.of("NotFound");
    Result<Integer, ErrorPayload> failure = Result.err(error);
    UnwrapException thrown = assertThrows(UnwrapException.class, failure::unwrap);
    assertSame(error, thrown.getError());
    assertNull(thrown.getCause());
  }

  @Test
  void testUnwrapCarriesCheckedError() {
    IOException error = new IOException("disk");
    Result<Integer, IOException> failure = Result.err(error);
    UnwrapException thrown = assertThrows(UnwrapException.class, failure::unwrap);
    assertSame(error, thrown.getError());
    assertSame(error, thrown.getCause());
  }

  @Test
  void testUnwrapOrThrow() throws IOException {
    assertEquals(1, Result.<Integer, String>ok(1).unwrapOrThrow(IOException::new));
    Result<Integer, String> failure = Result.err("disk full");
    IOException thrown =
        assertThrows(IOException.class, () -> failure.unwrapOrThrow(IOException::new));
    assertEquals("disk full", thrown.getMessage());
  }

  @Test
  void testOrReturnsValueOrFallback() {
    assertEquals(42, Result.<Integer, String>ok(42).or(7));
    assertEquals(7, Result.<Integer, String>err("E").or(7));
  }

  @Test
  void testOrElseGetIsLazy() {
    assertEquals(42, Result.<Integer, String>ok(42).orElseGet(fallback));
    verifyNoInteractions(fallback);

    assertEquals(7, Result.<Integer, String>err("E").orElseGet(() -> 7));
  }

  @Test
  void testMatch() {
    Result<Integer, ErrorPayload> success = Result.ok(5);
    assertEquals(10, (int) success.match(v -> v * 2, e -> 0));

    Result<Integer, ErrorPayload> timeout =
        Result.err(ErrorPayload.of("Timeout", ImmutableMap.of("ms", 1000)));
    assertEquals("Timeout", timeout.match(v -> "value " + v, ErrorPayload::type));
  }

  @Test
  void testIterationYieldsValueOnce() {
    List<Integer> seen = new ArrayList<>();
    for (Integer value : Result.<Integer, String>ok(3)) {
      seen.add(value);
    }
    assertEquals(List.of(3), seen);
  }

  @Test
  void testIterationOfErrIsEmpty() {
    assertFalse(Result.<Integer, String>err("E").iterator().hasNext());
    assertEquals(0, Result.<Integer, String>err("E").stream().count());
  }

  @Test
  void testStreamsConcatenateToSuccessfulValues() {
    List<Result<Integer, String>> results =
        ImmutableList.of(Result.ok(1), Result.err("E"), Result.ok(3));
    List<Integer> values = results.stream().flatMap(Result::stream).collect(Collectors.toList());
    assertEquals(List.of(1, 3), values);
  }

  @Test
  void testAnnotateBuildsCauseChain() {
    Result<Integer, ErrorPayload> base = Result.err(ErrorPayload.of("A", ImmutableMap.of("id", 2)));
    Result<Integer, ErrorPayload> annotated = base.annotate("B", ImmutableMap.of("extra", 1));

    ErrorPayload expected =
        ErrorPayload.builder("B")
            .put("extra", 1)
            .cause(ErrorPayload.of("A", ImmutableMap.of("id", 2)))
            .build();
    assertEquals(Result.err(expected), annotated);
    assertEquals("A", annotated.getError().causePayload().orElseThrow().type());
  }

  @Test
  void testAnnotateWrapsCapturedException() {
    IOException error = new IOException("ENOENT");
    Result<String, IOException> read = Result.err(error);
    Result<String, ErrorPayload> annotated = read.annotate("ConfigFileMissing");
    assertEquals("ConfigFileMissing", annotated.getError().type());
    assertSame(error, annotated.getError().cause().orElseThrow());
  }

  @Test
  void testAnnotateOnOkIsRejected() {
    Result<Integer, ErrorPayload> success = Result.ok(1);
    assertThrows(IllegalStateException.class, () -> success.annotate("B"));
  }

  @Test
  void testAnnotateRejectsReservedFields() {
    Result<Integer, ErrorPayload> failure = Result.err(ErrorPayload.of("A"));
    assertThrows(IllegalArgumentException.class,
        () -> failure.annotate("B", ImmutableMap.of("cause", "other")));
    assertThrows(IllegalArgumentException.class,
        () -> failure.annotate("B", ImmutableMap.of("type", "C")));
  }

  @Test
  void testRawRecord() {
    assertEquals(new ResultRecord<>(true, 1, null), Result.ok(1).raw());
    assertEquals(new ResultRecord<>(false, null, "E"), Result.err("E").raw());
  }

  @Test
  void testEquality() {
    assertEquals(Result.ok(1), Result.ok(1));
    assertEquals(Result.ok(1).hashCode(), Result.ok(1).hashCode());
    assertEquals(Result.err("E"), Result.err("E"));
    assertNotEquals(Result.ok("E"), Result.err("E"));
    assertNotEquals(Result.ok(1), Result.ok(2));
    assertEquals(Result.ok(), Result.ok(null));
  }

  @Test
  void testToString() {
    assertEquals("Ok{value=1}", Result.ok(1).toString());
    assertEquals("Err{error=E}", Result.err("E").toString());
  }

  private static Result<Integer, String> divide(int a, int b) {
    return b == 0 ? Result.err("Div0") : Result.ok(a / b);
  }
}
