package se.alipsa.jrelate.engine.function;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;
import se.alipsa.jrelate.Record;

/**
 * Unit tests for {@link AggregateFunctions}.
 */
class AggregateFunctionsTest {

  private final List<Record> rows = List.of(
      Record.of("s", 100, "name", "Per", "at", "2024-01-01 00:00:00"),
      Record.of("s", "200", "name", null, "at", "2023-05-01T12:00:00Z"),
      Record.of("s", "n/a", "name", "Karin"),
      Record.of("name", "Per", "at", "not a date"),
      Record.of("s", 50.5, "at", "2024-06-01T00:00:00"));

  @Test
  void countVariants() {
    assertEquals(5L, AggregateFunctions.count().apply(rows));
    assertEquals(4L, AggregateFunctions.count("s").apply(rows));
    assertEquals(3L, AggregateFunctions.count("name").apply(rows));
    assertEquals(2L, AggregateFunctions.countDistinct("name").apply(rows));
    assertEquals(0L, AggregateFunctions.count().apply(List.of()));
  }

  @Test
  void sumAndAvgSkipUnconvertibleValues() {
    assertEquals(350.5, AggregateFunctions.sum("s").apply(rows));
    assertEquals(350.5 / 3, (Double) AggregateFunctions.avg("s").apply(rows), 1e-9);
    assertEquals(0.0, AggregateFunctions.sum("missing").apply(rows));
    assertEquals(0.0, AggregateFunctions.avg("missing").apply(rows));
  }

  @Test
  void minMaxDefaultToDouble() {
    assertEquals(50.5, AggregateFunctions.min("s").apply(rows));
    assertEquals(200.0, AggregateFunctions.max("s").apply(rows));
    assertEquals(0.0, AggregateFunctions.min("missing").apply(rows));
  }

  @Test
  void typedMinMax() {
    assertEquals("Karin", AggregateFunctions.min("name", String.class).apply(rows));
    assertEquals("Per", AggregateFunctions.max("name", String.class).apply(rows));
    assertEquals(Instant.parse("2023-05-01T12:00:00Z"), AggregateFunctions.min("at", Instant.class).apply(rows));
    assertEquals(Instant.parse("2024-06-01T00:00:00Z"), AggregateFunctions.max("at", Instant.class).apply(rows));
    assertEquals(0L, AggregateFunctions.max("missing", Long.class).apply(rows));
    assertEquals(0, AggregateFunctions.min("missing", Integer.class).apply(rows));
    assertEquals(0, AggregateFunctions.max("name", Integer.class).apply(rows));
    assertEquals(50, AggregateFunctions.min("s", Integer.class).apply(rows));
    assertEquals(200, AggregateFunctions.max("s", Integer.class).apply(rows));
    List<Record> large = List.of(Record.of("n", 3_000_000_000L), Record.of("n", 12));
    assertEquals(12, AggregateFunctions.max("n", Integer.class).apply(large), "out of range values are skipped");
    assertEquals("", AggregateFunctions.max("missing", String.class).apply(rows));
    assertNull(AggregateFunctions.max("missing", Instant.class).apply(rows));
  }

  @Test
  void firstAndLastIncludeExplicitNulls() {
    assertEquals("Per", AggregateFunctions.first("name").apply(rows));
    assertEquals("Per", AggregateFunctions.last("name").apply(rows));
    assertEquals(100L, AggregateFunctions.first("s").apply(rows));
    assertNull(AggregateFunctions.last("name").apply(rows.subList(0, 2)));
    assertNull(AggregateFunctions.first("missing").apply(rows));
  }

  @Test
  void collectKeepsPresentValues() {
    @SuppressWarnings("unchecked")
    List<Object> names = (List<Object>) AggregateFunctions.collect("name").apply(rows);
    assertEquals(Arrays.asList("Per", null, "Karin", "Per"), names);
    assertThrows(UnsupportedOperationException.class, () -> names.add("x"));
  }

  @Test
  void stringAggJoinsNonNullValues() {
    assertEquals("Per, Karin, Per", AggregateFunctions.stringAgg("name", ", ").apply(rows));
    assertEquals("", AggregateFunctions.stringAgg("missing", ", ").apply(rows));
  }

  @Test
  void blankFieldsAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> AggregateFunctions.sum(" "));
    assertThrows(IllegalArgumentException.class, () -> AggregateFunctions.first(null));
    assertThrows(NullPointerException.class, () -> AggregateFunctions.stringAgg("name", null));
  }
}
