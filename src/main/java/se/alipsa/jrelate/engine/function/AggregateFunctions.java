package se.alipsa.jrelate.engine.function;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.StringJoiner;
import se.alipsa.jrelate.Record;
import se.alipsa.jrelate.helper.ValueCoercions;

/**
 * Library of aggregation functions operating on the members of a group.
 *
 * <p>
 * Values that are missing or cannot be converted to the type an aggregate works
 * with are skipped; none of the functions throw for bad data.
 * </p>
 */
public final class AggregateFunctions {

  private AggregateFunctions() {
  }

  /**
   * Number of records in the group.
   *
   * @return a function returning the group size as a {@link Long}
   */
  public static AggregateFunction count() {
    return records -> (long) records.size();
  }

  /**
   * Number of records where the field is present and not {@code null}.
   *
   * @param field
   *          the field to inspect
   * @return a function returning a {@link Long}
   */
  public static AggregateFunction count(String field) {
    requireField(field);
    return records -> {
      long count = 0L;
      for (Record record : records) {
        if (record.get(field) != null) {
          count++;
        }
      }
      return count;
    };
  }

  /**
   * Number of distinct non-null values of a field.
   *
   * @param field
   *          the field to inspect
   * @return a function returning a {@link Long}
   */
  public static AggregateFunction countDistinct(String field) {
    requireField(field);
    return records -> {
      Set<Object> seen = new HashSet<>();
      for (Record record : records) {
        Object value = record.get(field);
        if (value != null) {
          seen.add(value);
        }
      }
      return (long) seen.size();
    };
  }

  /**
   * Sum of every value of the field that converts to a double.
   *
   * @param field
   *          the field to sum
   * @return a function returning a {@link Double}, {@code 0.0} for no values
   */
  public static AggregateFunction sum(String field) {
    requireField(field);
    return records -> {
      double sum = 0d;
      for (Record record : records) {
        Optional<Double> value = record.get(field, Double.class);
        if (value.isPresent()) {
          sum += value.get();
        }
      }
      return sum;
    };
  }

  /**
   * Arithmetic mean of the values of the field that convert to a double.
   *
   * @param field
   *          the field to average
   * @return a function returning a {@link Double}, {@code 0.0} for no values
   */
  public static AggregateFunction avg(String field) {
    requireField(field);
    return records -> {
      double sum = 0d;
      long count = 0L;
      for (Record record : records) {
        Optional<Double> value = record.get(field, Double.class);
        if (value.isPresent()) {
          sum += value.get();
          count++;
        }
      }
      return count == 0L ? 0.0d : sum / count;
    };
  }

  /**
   * Smallest numeric value of the field.
   *
   * @param field
   *          the field to inspect
   * @return a function returning a {@link Double}
   * @see #min(String, Class)
   */
  public static AggregateFunction min(String field) {
    return min(field, Double.class);
  }

  /**
   * Smallest value of the field among the values convertible to {@code type}.
   *
   * @param field
   *          the field to inspect
   * @param type
   *          the type values are converted to before comparing
   * @param <T>
   *          the comparison type
   * @return a function returning the minimum, or the zero value of
   *         {@code type} (see {@link ValueCoercions#zeroValue(Class)}) when no
   *         value converts
   */
  public static <T extends Comparable<? super T>> AggregateFunction min(String field, Class<T> type) {
    return extremum(field, type, false);
  }

  /**
   * Largest numeric value of the field.
   *
   * @param field
   *          the field to inspect
   * @return a function returning a {@link Double}
   * @see #max(String, Class)
   */
  public static AggregateFunction max(String field) {
    return max(field, Double.class);
  }

  /**
   * Largest value of the field among the values convertible to {@code type}.
   *
   * @param field
   *          the field to inspect
   * @param type
   *          the type values are converted to before comparing
   * @param <T>
   *          the comparison type
   * @return a function returning the maximum, or the zero value of
   *         {@code type} when no value converts
   */
  public static <T extends Comparable<? super T>> AggregateFunction max(String field, Class<T> type) {
    return extremum(field, type, true);
  }

  private static <T extends Comparable<? super T>> AggregateFunction extremum(String field, Class<T> type,
      boolean isMax) {
    requireField(field);
    Objects.requireNonNull(type, "type");
    return records -> {
      T extremum = null;
      for (Record record : records) {
        Optional<T> converted = record.get(field, type);
        if (converted.isEmpty()) {
          continue;
        }
        T value = converted.get();
        if (extremum == null) {
          extremum = value;
          continue;
        }
        int cmp = value.compareTo(extremum);
        if ((isMax && cmp > 0) || (!isMax && cmp < 0)) {
          extremum = value;
        }
      }
      return extremum == null ? ValueCoercions.zeroValue(type) : extremum;
    };
  }

  /**
   * Value of the field in the first record that has it.
   *
   * @param field
   *          the field to read
   * @return a function returning the raw value, {@code null} if no record has
   *         the field
   */
  public static AggregateFunction first(String field) {
    requireField(field);
    return records -> {
      for (Record record : records) {
        if (record.has(field)) {
          return record.get(field);
        }
      }
      return null;
    };
  }

  /**
   * Value of the field in the last record that has it.
   *
   * @param field
   *          the field to read
   * @return a function returning the raw value, {@code null} if no record has
   *         the field
   */
  public static AggregateFunction last(String field) {
    requireField(field);
    return records -> {
      for (int i = records.size() - 1; i >= 0; i--) {
        Record record = records.get(i);
        if (record.has(field)) {
          return record.get(field);
        }
      }
      return null;
    };
  }

  /**
   * Every present value of the field, in record order.
   *
   * @param field
   *          the field to collect
   * @return a function returning an unmodifiable {@link List}; explicit
   *         {@code null} values are kept
   */
  public static AggregateFunction collect(String field) {
    requireField(field);
    return records -> {
      List<Object> values = new ArrayList<>();
      for (Record record : records) {
        if (record.has(field)) {
          values.add(record.get(field));
        }
      }
      return Collections.unmodifiableList(values);
    };
  }

  /**
   * Concatenate the non-null values of the field.
   *
   * @param field
   *          the field to concatenate
   * @param separator
   *          text placed between two values
   * @return a function returning a {@link String}, empty when there are no
   *         values
   */
  public static AggregateFunction stringAgg(String field, String separator) {
    requireField(field);
    Objects.requireNonNull(separator, "separator");
    return records -> {
      StringJoiner joiner = new StringJoiner(separator);
      for (Record record : records) {
        Object value = record.get(field);
        if (value != null) {
          joiner.add(String.valueOf(value));
        }
      }
      return joiner.toString();
    };
  }

  private static void requireField(String field) {
    if (field == null || field.isBlank()) {
      throw new IllegalArgumentException("field must not be blank");
    }
  }
}
