package se.alipsa.jrelate.engine.function;

import java.util.List;
import se.alipsa.jrelate.Record;

/**
 * Computes a single value from the members of a group.
 */
@FunctionalInterface
public interface AggregateFunction {

  /**
   * Aggregate the supplied records.
   *
   * @param records
   *          the materialized members of one group, never {@code null}
   * @return the aggregated value (may be {@code null})
   */
  Object apply(List<Record> records);
}
