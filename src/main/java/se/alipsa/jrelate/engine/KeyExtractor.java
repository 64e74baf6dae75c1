package se.alipsa.jrelate.engine;

import java.util.Optional;
import se.alipsa.jrelate.Record;

/**
 * Optional capability of a {@link JoinPredicate} enabling an O(n+m) hash join.
 *
 * <p>
 * Two records that match under {@link JoinPredicate#match(Record, Record)}
 * must produce equal keys. Equal keys do not have to imply a match: every hash
 * hit is verified with {@code match} before it is emitted.
 * </p>
 */
public interface KeyExtractor {

  /** Separator placed between the textual values of a composite key. */
  String KEY_SEPARATOR = "\u0000";

  /**
   * Compute the join key of a record.
   *
   * @param record
   *          the record
   * @return the key, or an empty optional when a key field is missing
   */
  Optional<String> extractKey(Record record);
}
