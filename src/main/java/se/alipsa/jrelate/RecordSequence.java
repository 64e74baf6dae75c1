package se.alipsa.jrelate;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Consumer;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import se.alipsa.jrelate.engine.InMemoryRecordReader;
import se.alipsa.jrelate.engine.RecordReader;

/**
 * A lazy, pull based sequence of {@link Record} instances.
 *
 * <p>
 * Each call to {@link #open()} starts a fresh pass and returns a
 * {@link RecordReader}; no work is done until records are read from it. A
 * sequence may be unbounded. Consumers that stop early must close the reader,
 * which stops all upstream work.
 * </p>
 *
 * <pre>
 * <code>
 *   RecordSequence summary = employees
 *       .then(JRelate.innerJoin(departments, JoinPredicates.onFields("dept_id")))
 *       .then(JRelate.groupByFields("members", "dept_name"))
 *       .then(JRelate.aggregate("members", Map.of("headcount", AggregateFunctions.count())));
 * </code>
 * </pre>
 */
@FunctionalInterface
public interface RecordSequence {

  /**
   * Start a new pass over the sequence.
   *
   * @return a reader positioned before the first record
   * @throws IOException
   *           if the underlying source cannot be opened
   */
  RecordReader open() throws IOException;

  /**
   * Sequence over the supplied records.
   *
   * @param records
   *          the records
   * @return a replayable sequence
   */
  static RecordSequence of(Record... records) {
    Objects.requireNonNull(records, "records");
    return of(List.of(records));
  }

  /**
   * Sequence over a copy of the supplied list.
   *
   * @param records
   *          the records
   * @return a replayable sequence
   */
  static RecordSequence of(List<Record> records) {
    List<Record> copy = List.copyOf(Objects.requireNonNull(records, "records"));
    return () -> new InMemoryRecordReader(copy);
  }

  /**
   * Sequence without records.
   *
   * @return the empty sequence
   */
  static RecordSequence empty() {
    return () -> new InMemoryRecordReader(List.of());
  }

  /**
   * Apply a filter to this sequence.
   *
   * @param filter
   *          the filter to apply
   * @return the filtered sequence
   */
  default RecordSequence then(RecordFilter filter) {
    Objects.requireNonNull(filter, "filter");
    return filter.apply(this);
  }

  /**
   * Read the whole sequence into a list.
   *
   * @return a mutable list with every record in order
   * @throws IOException
   *           if reading fails
   */
  default List<Record> toList() throws IOException {
    List<Record> records = new ArrayList<>();
    try (RecordReader reader = open()) {
      Record record;
      while ((record = reader.read()) != null) {
        records.add(record);
      }
    }
    return records;
  }

  /**
   * Expose a new pass over the sequence as a {@link Stream}. The stream must be
   * closed to release the underlying reader when it is not fully consumed. I/O
   * failures surface as {@link UncheckedIOException}.
   *
   * @return a sequential stream of records
   */
  default Stream<Record> stream() {
    RecordReader reader;
    try {
      reader = open();
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    Spliterator<Record> spliterator = new Spliterators.AbstractSpliterator<>(Long.MAX_VALUE,
        Spliterator.ORDERED | Spliterator.NONNULL) {
      @Override
      public boolean tryAdvance(Consumer<? super Record> action) {
        try {
          Record record = reader.read();
          if (record == null) {
            return false;
          }
          action.accept(record);
          return true;
        } catch (IOException e) {
          throw new UncheckedIOException(e);
        }
      }
    };
    return StreamSupport.stream(spliterator, false).onClose(() -> {
      try {
        reader.close();
      } catch (IOException e) {
        throw new UncheckedIOException(e);
      }
    });
  }
}
