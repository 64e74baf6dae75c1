package se.alipsa.jrelate.engine;

import java.util.List;
import java.util.Objects;
import se.alipsa.jrelate.Record;

/**
 * {@link RecordReader} implementation backed by an in-memory list of
 * {@link Record} instances. The reader iterates over the supplied records
 * without performing any additional I/O which makes it suitable for
 * materialized data such as group members.
 */
public final class InMemoryRecordReader implements RecordReader {

  private final List<Record> records;
  private int index;
  private boolean closed;

  /**
   * Create a new reader that iterates over the provided records. The list is
   * not copied; callers must not modify it while the reader is in use.
   *
   * @param records
   *          the records to expose through the reader
   */
  public InMemoryRecordReader(List<Record> records) {
    this.records = Objects.requireNonNull(records, "records");
    this.index = 0;
  }

  @Override
  public Record read() {
    if (closed || index >= records.size()) {
      return null;
    }
    Record record = records.get(index);
    index++;
    return record;
  }

  @Override
  public void close() {
    closed = true;
  }
}
