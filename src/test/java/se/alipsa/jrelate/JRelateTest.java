package se.alipsa.jrelate;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import se.alipsa.jrelate.engine.JoinPredicates;
import se.alipsa.jrelate.engine.RecordReader;
import se.alipsa.jrelate.engine.function.AggregateFunction;
import se.alipsa.jrelate.engine.function.AggregateFunctions;

/**
 * Unit tests for {@link JRelate}.
 */
class JRelateTest {

  @Test
  void filtersAreLazy() {
    RecordSequence left = mock(RecordSequence.class);
    RecordSequence right = mock(RecordSequence.class);
    RecordSequence result = RecordFilter.chain(
        JRelate.fullJoin(right, JoinPredicates.onFields("id")),
        JRelate.groupByFields("rows", "id"),
        JRelate.aggregate("rows", Map.of("n", AggregateFunctions.count()))).apply(left);
    assertNotNull(result);
    verifyNoInteractions(left, right);
  }

  @Test
  void closingThePipelineClosesTheSource() throws IOException {
    RecordReader source = mock(RecordReader.class);
    when(source.read()).thenReturn(Record.of("d", "a"), Record.of("d", "b"), (Record) null);
    RecordSequence input = () -> source;
    try (RecordReader reader = input.then(JRelate.groupByFields("rows", "d")).open()) {
      assertEquals("a", reader.read().get("d"));
    }
    verify(source).close();
  }

  @Test
  void aggregateCopiesTheFunctionMap() throws IOException {
    Map<String, AggregateFunction> functions = new LinkedHashMap<>();
    functions.put("n", AggregateFunctions.count());
    RecordFilter aggregate = JRelate.aggregate("rows", functions);
    functions.put("later", AggregateFunctions.count());
    List<Record> rows = RecordSequence.of(Record.of("rows", RecordSequence.of(Record.empty())))
        .then(aggregate).toList();
    assertEquals(List.of(Record.of("n", 1L)), rows);
  }

  @Test
  void argumentsAreValidatedEagerly() {
    assertThrows(NullPointerException.class, () -> JRelate.innerJoin(null, JoinPredicates.onFields("id")));
    assertThrows(NullPointerException.class, () -> JRelate.leftJoin(RecordSequence.empty(), null));
    assertThrows(IllegalArgumentException.class, () -> JRelate.aggregate(" ", Map.of()));
  }
}
