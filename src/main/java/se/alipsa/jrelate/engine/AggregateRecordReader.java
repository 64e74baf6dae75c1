package se.alipsa.jrelate.engine;

import java.io.IOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.alipsa.jrelate.Record;
import se.alipsa.jrelate.RecordSequence;
import se.alipsa.jrelate.engine.function.AggregateFunction;

/**
 * Replaces the member sequence of each group record with named aggregate
 * values.
 *
 * <p>
 * Every field of the input record except the sequence field is copied. When the
 * sequence field holds a {@link RecordSequence} its members are read into a
 * list and each function is applied to that list, the results being added in
 * the iteration order of the function map. Records without a usable sequence
 * field pass through without the field and without aggregate values.
 * </p>
 */
public final class AggregateRecordReader implements RecordReader {

  private static final Logger log = LoggerFactory.getLogger(AggregateRecordReader.class);

  private final RecordSequence input;
  private final String sequenceField;
  private final Map<String, AggregateFunction> functions;

  private RecordReader source;
  private boolean closed;

  /**
   * Create the reader.
   *
   * @param input
   *          the group records
   * @param sequenceField
   *          the field holding the members of each group
   * @param functions
   *          aggregate functions keyed by the name of the field receiving the
   *          result
   */
  public AggregateRecordReader(RecordSequence input, String sequenceField,
      Map<String, ? extends AggregateFunction> functions) {
    this.input = Objects.requireNonNull(input, "input");
    if (sequenceField == null || sequenceField.isBlank()) {
      throw new IllegalArgumentException("sequenceField must not be blank");
    }
    this.sequenceField = sequenceField;
    Objects.requireNonNull(functions, "functions");
    Map<String, AggregateFunction> copy = new LinkedHashMap<>();
    functions.forEach((name, function) -> {
      if (name == null || name.isBlank()) {
        throw new IllegalArgumentException("Aggregate names must not be blank: " + functions.keySet());
      }
      copy.put(name, Objects.requireNonNull(function, "function for " + name));
    });
    this.functions = Collections.unmodifiableMap(copy);
  }

  @Override
  public Record read() throws IOException {
    if (closed) {
      return null;
    }
    if (source == null) {
      source = input.open();
    }
    Record record = source.read();
    if (record == null) {
      return null;
    }
    Record.Builder result = record.toBuilder().remove(sequenceField);
    Object members = record.get(sequenceField);
    if (!(members instanceof RecordSequence sequence)) {
      if (log.isTraceEnabled()) {
        log.trace("No record sequence in field '{}' of {}, passing through", sequenceField, record);
      }
      return result.build();
    }
    List<Record> rows = sequence.toList();
    for (Map.Entry<String, AggregateFunction> entry : functions.entrySet()) {
      result.put(entry.getKey(), entry.getValue().apply(rows));
    }
    return result.build();
  }

  @Override
  public void close() throws IOException {
    if (closed) {
      return;
    }
    closed = true;
    if (source != null) {
      RecordReader open = source;
      source = null;
      open.close();
    }
  }
}
