package se.alipsa.jrelate;

import java.util.Objects;

/**
 * Transforms one {@link RecordSequence} into another. Filters are lazy: applying
 * a filter only wires the sequences together, records flow when the resulting
 * sequence is opened and read.
 */
@FunctionalInterface
public interface RecordFilter {

  /**
   * Apply the filter.
   *
   * @param input
   *          the upstream sequence
   * @return the transformed sequence
   */
  RecordSequence apply(RecordSequence input);

  /**
   * Compose this filter with another one applied to its output.
   *
   * @param next
   *          the filter applied after this one
   * @return the composed filter
   */
  default RecordFilter andThen(RecordFilter next) {
    Objects.requireNonNull(next, "next");
    return input -> next.apply(apply(input));
  }

  /**
   * Filter returning its input unchanged.
   *
   * @return the identity filter
   */
  static RecordFilter identity() {
    return input -> input;
  }

  /**
   * Compose filters left to right.
   *
   * @param filters
   *          the filters in application order
   * @return a filter applying every filter in turn, or the identity filter when
   *         none are given
   */
  static RecordFilter chain(RecordFilter... filters) {
    Objects.requireNonNull(filters, "filters");
    RecordFilter result = identity();
    for (RecordFilter filter : filters) {
      result = result.andThen(Objects.requireNonNull(filter, "filter"));
    }
    return result;
  }
}
