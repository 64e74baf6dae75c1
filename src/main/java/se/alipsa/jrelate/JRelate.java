package se.alipsa.jrelate;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import se.alipsa.jrelate.engine.AggregateRecordReader;
import se.alipsa.jrelate.engine.GroupRecordReader;
import se.alipsa.jrelate.engine.JoinPredicate;
import se.alipsa.jrelate.engine.JoinRecordReader;
import se.alipsa.jrelate.engine.JoinStrategy;
import se.alipsa.jrelate.engine.JoinType;
import se.alipsa.jrelate.engine.function.AggregateFunction;

/**
 * Entry points for building relational pipelines over record sequences. Every
 * method returns a {@link RecordFilter}; nothing is read before the resulting
 * sequence is opened. Example usage:
 *
 * <pre>
 * <code>
 *   RecordSequence perDepartment = employees.then(RecordFilter.chain(
 *       JRelate.leftJoin(departments, JoinPredicates.onFields("dept_id")),
 *       JRelate.groupByFields("members", "dept_name"),
 *       JRelate.aggregate("members", Map.of(
 *           "headcount", AggregateFunctions.count(),
 *           "payroll", AggregateFunctions.sum("salary")))));
 *
 *   try (Stream&lt;Record&gt; rows = perDepartment.stream()) {
 *     rows.forEach(System.out::println);
 *   }
 * </code>
 * </pre>
 */
@SuppressWarnings("checkstyle:AbbreviationAsWordInName")
public final class JRelate {

  private JRelate() {
  }

  /**
   * Join the input (left) sequence with {@code right} using the default
   * strategy, see {@link JoinStrategy#configuredFor(JoinPredicate)}.
   *
   * @param right
   *          the right sequence
   * @param predicate
   *          the join condition
   * @param type
   *          the join variant
   * @return the join filter
   */
  public static RecordFilter join(RecordSequence right, JoinPredicate predicate, JoinType type) {
    Objects.requireNonNull(predicate, "predicate");
    return join(right, predicate, type, JoinStrategy.configuredFor(predicate));
  }

  /**
   * Join the input (left) sequence with {@code right} using the given strategy.
   *
   * @param right
   *          the right sequence
   * @param predicate
   *          the join condition
   * @param type
   *          the join variant
   * @param strategy
   *          the join algorithm
   * @return the join filter
   * @throws IllegalArgumentException
   *           if {@link JoinStrategy#HASH} is requested for a predicate without
   *           a key
   */
  public static RecordFilter join(RecordSequence right, JoinPredicate predicate, JoinType type,
      JoinStrategy strategy) {
    Objects.requireNonNull(right, "right");
    Objects.requireNonNull(predicate, "predicate");
    Objects.requireNonNull(type, "type");
    JoinStrategy resolved = Objects.requireNonNull(strategy, "strategy").resolve(predicate);
    return left -> {
      Objects.requireNonNull(left, "left");
      return () -> new JoinRecordReader(left, right, predicate, type, resolved);
    };
  }

  /**
   * Inner join: only matching pairs.
   *
   * @param right
   *          the right sequence
   * @param predicate
   *          the join condition
   * @return the join filter
   */
  public static RecordFilter innerJoin(RecordSequence right, JoinPredicate predicate) {
    return join(right, predicate, JoinType.INNER);
  }

  /**
   * Left outer join: matching pairs plus every unmatched left record.
   *
   * @param right
   *          the right sequence
   * @param predicate
   *          the join condition
   * @return the join filter
   */
  public static RecordFilter leftJoin(RecordSequence right, JoinPredicate predicate) {
    return join(right, predicate, JoinType.LEFT);
  }

  /**
   * Right outer join: matching pairs followed by every unmatched right record.
   *
   * @param right
   *          the right sequence
   * @param predicate
   *          the join condition
   * @return the join filter
   */
  public static RecordFilter rightJoin(RecordSequence right, JoinPredicate predicate) {
    return join(right, predicate, JoinType.RIGHT);
  }

  /**
   * Full outer join: matching pairs, then unmatched left records, then unmatched
   * right records.
   *
   * @param right
   *          the right sequence
   * @param predicate
   *          the join condition
   * @return the join filter
   */
  public static RecordFilter fullJoin(RecordSequence right, JoinPredicate predicate) {
    return join(right, predicate, JoinType.FULL);
  }

  /**
   * Group records by a computed key.
   *
   * @param sequenceField
   *          field of the group record holding the members
   * @param keyField
   *          field of the group record holding the key
   * @param keyFunction
   *          computes the key of a record
   * @return the grouping filter
   */
  public static RecordFilter groupBy(String sequenceField, String keyField, Function<? super Record, ?> keyFunction) {
    // fail on invalid arguments when the pipeline is built, not when it is read
    GroupRecordReader.byKey(RecordSequence.empty(), sequenceField, keyField, keyFunction);
    return input -> () -> GroupRecordReader.byKey(input, sequenceField, keyField, keyFunction);
  }

  /**
   * Group records on equal values of the named fields.
   *
   * @param sequenceField
   *          field of the group record holding the members
   * @param fields
   *          the grouping fields
   * @return the grouping filter
   */
  public static RecordFilter groupByFields(String sequenceField, String... fields) {
    Objects.requireNonNull(fields, "fields");
    List<String> keyFields = List.of(fields);
    // fail on invalid arguments when the pipeline is built, not when it is read
    GroupRecordReader.byFields(RecordSequence.empty(), sequenceField, keyFields);
    return input -> () -> GroupRecordReader.byFields(input, sequenceField, keyFields);
  }

  /**
   * Replace the member sequence of group records with aggregate values.
   *
   * @param sequenceField
   *          field holding the members
   * @param functions
   *          aggregate functions keyed by result field name; results are added
   *          in the iteration order of the map
   * @return the aggregating filter
   */
  public static RecordFilter aggregate(String sequenceField, Map<String, ? extends AggregateFunction> functions) {
    Objects.requireNonNull(functions, "functions");
    Map<String, AggregateFunction> named = new LinkedHashMap<>(functions);
    // fail on invalid arguments when the pipeline is built, not when it is read
    new AggregateRecordReader(RecordSequence.empty(), sequenceField, named);
    return input -> () -> new AggregateRecordReader(input, sequenceField, named);
  }
}
