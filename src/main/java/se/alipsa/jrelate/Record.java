package se.alipsa.jrelate;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import se.alipsa.jrelate.helper.ValueCoercions;

/**
 * Immutable mapping from field name to a loosely typed value.
 *
 * <p>
 * A value is either a scalar ({@link Long}, {@link Double}, {@link String},
 * {@link Boolean}, a timestamp or {@code null}), a nested {@link Record} or a
 * {@link RecordSequence}. Fields keep their insertion order. Small integral
 * and floating point values are normalized on construction (see
 * {@link ValueCoercions#normalize(Object)}), so {@code Record.of("id", 1)}
 * equals {@code Record.of("id", 1L)}.
 * </p>
 *
 * <p>
 * Records are never modified in place; {@link #with(String, Object)},
 * {@link #without(String)} and {@link #merge(Record, Record)} return copies.
 * </p>
 */
public final class Record {

  private static final Record EMPTY = new Record(new LinkedHashMap<>());

  private final Map<String, Object> fields;

  private Record(LinkedHashMap<String, Object> fields) {
    this.fields = Collections.unmodifiableMap(fields);
  }

  /**
   * Retrieve the record without fields.
   *
   * @return the empty record
   */
  public static Record empty() {
    return EMPTY;
  }

  /**
   * Create a record from alternating field names and values.
   *
   * @param namesAndValues
   *          field name, value, field name, value, ...
   * @return the new record
   */
  public static Record of(Object... namesAndValues) {
    Objects.requireNonNull(namesAndValues, "namesAndValues");
    if (namesAndValues.length % 2 != 0) {
      throw new IllegalArgumentException("Field names and values must come in pairs but got "
          + namesAndValues.length + " arguments");
    }
    Builder builder = builder();
    for (int i = 0; i < namesAndValues.length; i += 2) {
      if (!(namesAndValues[i] instanceof String name)) {
        throw new IllegalArgumentException("Field name at position " + i + " must be a String but was "
            + namesAndValues[i]);
      }
      builder.put(name, namesAndValues[i + 1]);
    }
    return builder.build();
  }

  /**
   * Create a record holding a copy of the supplied map.
   *
   * @param values
   *          field values keyed by field name
   * @return the new record
   */
  public static Record fromMap(Map<String, ?> values) {
    Objects.requireNonNull(values, "values");
    Builder builder = builder();
    values.forEach(builder::put);
    return builder.build();
  }

  /**
   * Create a new, empty builder.
   *
   * @return a builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Merge two records: all fields of {@code left} followed by all fields of
   * {@code right}. When both records hold the same field the right value wins.
   *
   * @param left
   *          the left record
   * @param right
   *          the right record
   * @return the merged record
   */
  public static Record merge(Record left, Record right) {
    Objects.requireNonNull(left, "left");
    Objects.requireNonNull(right, "right");
    LinkedHashMap<String, Object> merged = new LinkedHashMap<>(left.fields);
    merged.putAll(right.fields);
    return new Record(merged);
  }

  /**
   * Retrieve the raw value of a field.
   *
   * @param field
   *          the field name
   * @return the value, or {@code null} when the field is absent or holds
   *         {@code null}; use {@link #has(String)} to tell the two apart
   */
  public Object get(String field) {
    return fields.get(field);
  }

  /**
   * Retrieve a field converted to the requested type.
   *
   * @param field
   *          the field name
   * @param type
   *          the requested type
   * @param <T>
   *          the requested type
   * @return the converted value, empty when the field is absent, {@code null} or
   *         not convertible
   */
  public <T> Optional<T> get(String field, Class<T> type) {
    return ValueCoercions.convert(fields.get(field), type);
  }

  /**
   * Retrieve a field converted to the type of the supplied default value.
   *
   * @param field
   *          the field name
   * @param defaultValue
   *          value returned when the field is absent or not convertible
   * @param <T>
   *          the value type
   * @return the converted value or {@code defaultValue}
   */
  @SuppressWarnings("unchecked")
  public <T> T getOr(String field, T defaultValue) {
    Objects.requireNonNull(defaultValue, "defaultValue");
    Class<T> type = (Class<T>) defaultValue.getClass();
    return get(field, type).orElse(defaultValue);
  }

  /**
   * Determine whether a field is present (possibly holding {@code null}).
   *
   * @param field
   *          the field name
   * @return {@code true} when the record contains the field
   */
  public boolean has(String field) {
    return fields.containsKey(field);
  }

  /**
   * Field names in insertion order.
   *
   * @return immutable view of the field names
   */
  public Set<String> fieldNames() {
    return fields.keySet();
  }

  /**
   * Number of fields.
   *
   * @return the field count
   */
  public int size() {
    return fields.size();
  }

  /**
   * Determine whether the record has no fields.
   *
   * @return {@code true} for an empty record
   */
  public boolean isEmpty() {
    return fields.isEmpty();
  }

  /**
   * Read-only view of the record content.
   *
   * @return an unmodifiable map in field insertion order
   */
  public Map<String, Object> asMap() {
    return fields;
  }

  /**
   * Copy of this record with one field set.
   *
   * @param field
   *          the field name
   * @param value
   *          the new value
   * @return the new record
   */
  public Record with(String field, Object value) {
    return toBuilder().put(field, value).build();
  }

  /**
   * Copy of this record without the named field.
   *
   * @param field
   *          the field to drop
   * @return the new record, or this record when the field is absent
   */
  public Record without(String field) {
    if (!fields.containsKey(field)) {
      return this;
    }
    return toBuilder().remove(field).build();
  }

  /**
   * Create a builder pre-populated with the fields of this record.
   *
   * @return a builder
   */
  public Builder toBuilder() {
    Builder builder = builder();
    builder.values.putAll(fields);
    return builder;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Record other)) {
      return false;
    }
    return fields.equals(other.fields);
  }

  @Override
  public int hashCode() {
    return fields.hashCode();
  }

  @Override
  public String toString() {
    return fields.toString();
  }

  /**
   * Mutable builder used to assemble a {@link Record}. A builder must not be
   * used after {@link #build()}.
   */
  public static final class Builder {

    private LinkedHashMap<String, Object> values = new LinkedHashMap<>();

    private Builder() {
    }

    /**
     * Set a field.
     *
     * @param field
     *          the field name, must not be {@code null}
     * @param value
     *          the value (may be {@code null})
     * @return this builder
     */
    public Builder put(String field, Object value) {
      Objects.requireNonNull(field, "field");
      values.put(field, ValueCoercions.normalize(value));
      return this;
    }

    /**
     * Copy every field of the supplied record into this builder, replacing
     * fields that already exist.
     *
     * @param record
     *          the record to copy from
     * @return this builder
     */
    public Builder putAll(Record record) {
      Objects.requireNonNull(record, "record");
      values.putAll(record.fields);
      return this;
    }

    /**
     * Remove a field.
     *
     * @param field
     *          the field name
     * @return this builder
     */
    public Builder remove(String field) {
      values.remove(field);
      return this;
    }

    /**
     * Determine whether a field has been set.
     *
     * @param field
     *          the field name
     * @return {@code true} when present
     */
    public boolean has(String field) {
      return values.containsKey(field);
    }

    /**
     * Freeze the builder into an immutable record.
     *
     * @return the record
     */
    public Record build() {
      if (values == null) {
        throw new IllegalStateException("Builder has already been used");
      }
      Record record = values.isEmpty() ? EMPTY : new Record(values);
      values = null;
      return record;
    }
  }
}
