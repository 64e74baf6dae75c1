package se.alipsa.jrelate.engine;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BiPredicate;
import se.alipsa.jrelate.Record;
import se.alipsa.jrelate.helper.ValueCoercions;

/**
 * Factory methods for the {@link JoinPredicate} implementations used in
 * pipelines.
 */
public final class JoinPredicates {

  private JoinPredicates() {
  }

  /**
   * Equality join on one or more fields with the same name on both sides, the
   * equivalent of {@code USING (a, b)}. The predicate implements
   * {@link KeyExtractor} so joins using it run as hash joins.
   *
   * @param fields
   *          the join fields
   * @return the predicate
   */
  public static JoinPredicate onFields(String... fields) {
    Objects.requireNonNull(fields, "fields");
    return new FieldsJoinPredicate(List.of(fields));
  }

  /**
   * Join on an arbitrary condition. The predicate has no key and joins using it
   * compare every pair of records.
   *
   * @param condition
   *          the condition
   * @return the predicate
   */
  public static JoinPredicate onCondition(BiPredicate<Record, Record> condition) {
    return new ConditionJoinPredicate(Objects.requireNonNull(condition, "condition"), "onCondition");
  }

  /**
   * Equality join between differently named fields, e.g.
   * {@code left.customer_id = right.id}. Both fields must be present. This is a
   * condition predicate and therefore joins with a nested loop.
   *
   * @param leftField
   *          field read from the left record
   * @param rightField
   *          field read from the right record
   * @return the predicate
   */
  public static JoinPredicate onFieldPair(String leftField, String rightField) {
    requireFieldName(leftField);
    requireFieldName(rightField);
    BiPredicate<Record, Record> condition = (left, right) -> left.has(leftField) && right.has(rightField)
        && Objects.equals(left.get(leftField), right.get(rightField));
    return new ConditionJoinPredicate(condition, "onFieldPair[" + leftField + " = " + rightField + "]");
  }

  private static String requireFieldName(String field) {
    if (field == null || field.isBlank()) {
      throw new IllegalArgumentException("Join field names must not be blank");
    }
    return field;
  }

  /**
   * Equality on named fields. Missing fields never match; values compare with
   * {@link Objects#equals(Object, Object)}.
   */
  static final class FieldsJoinPredicate implements JoinPredicate, KeyExtractor {

    private final List<String> fields;

    FieldsJoinPredicate(List<String> fields) {
      if (fields.isEmpty()) {
        throw new IllegalArgumentException("At least one join field is required");
      }
      List<String> names = new ArrayList<>(fields.size());
      for (String field : fields) {
        names.add(requireFieldName(field));
      }
      this.fields = List.copyOf(names);
    }

    List<String> fields() {
      return fields;
    }

    @Override
    public boolean match(Record left, Record right) {
      for (String field : fields) {
        if (!left.has(field) || !right.has(field)) {
          return false;
        }
        if (!Objects.equals(left.get(field), right.get(field))) {
          return false;
        }
      }
      return true;
    }

    @Override
    public Optional<String> extractKey(Record record) {
      StringBuilder key = new StringBuilder();
      for (int i = 0; i < fields.size(); i++) {
        String field = fields.get(i);
        if (!record.has(field)) {
          return Optional.empty();
        }
        if (i > 0) {
          key.append(KEY_SEPARATOR);
        }
        Object value = record.get(field);
        if (ValueCoercions.isSimpleValue(value)) {
          key.append(value);
        } else {
          // equal nested values may render differently, their hash codes agree
          key.append('#').append(Objects.hashCode(value));
        }
      }
      return Optional.of(key.toString());
    }

    @Override
    public String toString() {
      return "onFields" + fields;
    }
  }

  /** Wraps an arbitrary condition. Not a {@link KeyExtractor}, joins using it run as nested loops. */
  static final class ConditionJoinPredicate implements JoinPredicate {

    private final BiPredicate<Record, Record> condition;
    private final String description;

    ConditionJoinPredicate(BiPredicate<Record, Record> condition, String description) {
      this.condition = condition;
      this.description = description;
    }

    @Override
    public boolean match(Record left, Record right) {
      return condition.test(left, right);
    }

    @Override
    public String toString() {
      return description;
    }
  }
}
