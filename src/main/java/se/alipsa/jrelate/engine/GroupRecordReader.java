package se.alipsa.jrelate.engine;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.alipsa.jrelate.Record;
import se.alipsa.jrelate.RecordSequence;
import se.alipsa.jrelate.helper.ValueCoercions;

/**
 * Partitions a record sequence into groups and emits one group record per
 * group.
 *
 * <p>
 * A group record holds the key field(s) of the group and a single sequence
 * field containing the members as a replayable {@link RecordSequence}. The
 * whole input is consumed on the first {@link #read()}; groups are then emitted
 * in the order their key was first seen, members in input order.
 * </p>
 *
 * <p>
 * When grouping by fields, a record whose key field holds a complex value (a
 * nested record, a sequence, a collection ...) is dropped. A missing key field
 * groups as {@code null}.
 * </p>
 */
public final class GroupRecordReader implements RecordReader {

  private static final Logger log = LoggerFactory.getLogger(GroupRecordReader.class);

  /** Derives the key fields of a record, or {@code null} to drop the record. */
  @FunctionalInterface
  private interface Grouping {
    Record keyFields(Record record);
  }

  private final RecordSequence input;
  private final String sequenceField;
  private final Grouping grouping;

  private RecordReader source;
  private Iterator<GroupState> groups;
  private boolean closed;

  private GroupRecordReader(RecordSequence input, String sequenceField, Grouping grouping) {
    this.input = Objects.requireNonNull(input, "input");
    this.sequenceField = requireFieldName(sequenceField, "sequenceField");
    this.grouping = grouping;
  }

  /**
   * Group by the value of an arbitrary key function.
   *
   * @param input
   *          the records to group
   * @param sequenceField
   *          name of the field receiving the members
   * @param keyField
   *          name of the field receiving the key
   * @param keyFunction
   *          computes the group key of a record, {@code null} is a valid key
   * @return the reader
   */
  public static GroupRecordReader byKey(RecordSequence input, String sequenceField, String keyField,
      Function<? super Record, ?> keyFunction) {
    requireFieldName(keyField, "keyField");
    Objects.requireNonNull(keyFunction, "keyFunction");
    requireDistinct(sequenceField, List.of(keyField));
    return new GroupRecordReader(input, sequenceField,
        record -> Record.builder().put(keyField, keyFunction.apply(record)).build());
  }

  /**
   * Group by the values of one or more fields.
   *
   * @param input
   *          the records to group
   * @param sequenceField
   *          name of the field receiving the members
   * @param fields
   *          the grouping fields, copied into every group record
   * @return the reader
   */
  public static GroupRecordReader byFields(RecordSequence input, String sequenceField, List<String> fields) {
    Objects.requireNonNull(fields, "fields");
    if (fields.isEmpty()) {
      throw new IllegalArgumentException("At least one grouping field is required");
    }
    List<String> keyFields = new ArrayList<>(fields.size());
    for (String field : fields) {
      keyFields.add(requireFieldName(field, "fields"));
    }
    requireDistinct(sequenceField, keyFields);
    return new GroupRecordReader(input, sequenceField, record -> {
      Record.Builder key = Record.builder();
      for (String field : keyFields) {
        Object value = record.get(field);
        if (!ValueCoercions.isSimpleValue(value)) {
          return null;
        }
        key.put(field, value);
      }
      return key.build();
    });
  }

  private static String requireFieldName(String field, String argument) {
    if (field == null || field.isBlank()) {
      throw new IllegalArgumentException(argument + " must not be blank");
    }
    return field;
  }

  private static void requireDistinct(String sequenceField, List<String> keyFields) {
    if (keyFields.contains(sequenceField)) {
      throw new IllegalArgumentException(
          "Sequence field '" + sequenceField + "' clashes with a grouping field " + keyFields);
    }
  }

  @Override
  public Record read() throws IOException {
    if (closed) {
      return null;
    }
    if (groups == null) {
      groups = collectGroups().iterator();
    }
    if (!groups.hasNext()) {
      groups = Collections.emptyIterator();
      return null;
    }
    GroupState group = groups.next();
    return Record.builder()
        .putAll(group.keyFields())
        .put(sequenceField, new MemberSequence(group.members()))
        .build();
  }

  private List<GroupState> collectGroups() throws IOException {
    Map<GroupKey, GroupState> states = new LinkedHashMap<>();
    int consumed = 0;
    int dropped = 0;
    source = input.open();
    try {
      Record record;
      while ((record = source.read()) != null) {
        consumed++;
        Record keyFields = grouping.keyFields(record);
        if (keyFields == null) {
          dropped++;
          continue;
        }
        states.computeIfAbsent(new GroupKey(keyFields.asMap().values()), k -> new GroupState(keyFields))
            .add(record);
      }
    } finally {
      RecordReader consumedSource = source;
      source = null;
      consumedSource.close();
    }
    log.debug("Grouped {} records into {} groups ({} dropped for complex key values)", consumed, states.size(),
        dropped);
    return new ArrayList<>(states.values());
  }

  @Override
  public void close() throws IOException {
    if (closed) {
      return;
    }
    closed = true;
    groups = null;
    if (source != null) {
      RecordReader open = source;
      source = null;
      open.close();
    }
  }

  private static final class GroupState {
    private final Record keyFields;
    private final List<Record> members = new ArrayList<>();

    GroupState(Record keyFields) {
      this.keyFields = keyFields;
    }

    void add(Record record) {
      members.add(record);
    }

    Record keyFields() {
      return keyFields;
    }

    List<Record> members() {
      return Collections.unmodifiableList(members);
    }
  }

  private static final class GroupKey {
    private final List<Object> values;
    private final int hash;

    GroupKey(Iterable<Object> values) {
      List<Object> copy = new ArrayList<>();
      values.forEach(copy::add);
      this.values = Collections.unmodifiableList(copy);
      this.hash = this.values.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
      if (this == obj) {
        return true;
      }
      if (!(obj instanceof GroupKey other)) {
        return false;
      }
      return values.equals(other.values);
    }

    @Override
    public int hashCode() {
      return hash;
    }
  }

  /** Replays the members of one group; every {@link #open()} starts over. */
  private static final class MemberSequence implements RecordSequence {
    private final List<Record> members;

    MemberSequence(List<Record> members) {
      this.members = members;
    }

    @Override
    public RecordReader open() {
      return new InMemoryRecordReader(members);
    }

    @Override
    public String toString() {
      return "RecordSequence[" + members.size() + " records]";
    }
  }
}
