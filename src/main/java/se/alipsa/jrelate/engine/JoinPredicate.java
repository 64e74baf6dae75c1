package se.alipsa.jrelate.engine;

import se.alipsa.jrelate.Record;

/**
 * Condition deciding whether a left and a right record are joined.
 *
 * <p>
 * Implementations may additionally implement {@link KeyExtractor}, in which
 * case {@link JoinRecordReader} joins with a hash table instead of comparing
 * every pair.
 * </p>
 *
 * @see JoinPredicates
 */
@FunctionalInterface
public interface JoinPredicate {

  /**
   * Determine whether the records should be joined.
   *
   * @param left
   *          the record from the left sequence
   * @param right
   *          the record from the right sequence
   * @return {@code true} when the pair matches
   */
  boolean match(Record left, Record right);
}
