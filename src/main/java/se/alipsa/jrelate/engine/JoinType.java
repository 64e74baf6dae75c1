package se.alipsa.jrelate.engine;

/** Join variants supported by {@link JoinRecordReader}. */
public enum JoinType {
  /** Only matched pairs. */
  INNER,
  /** Matched pairs plus every unmatched left record. */
  LEFT,
  /** Matched pairs plus every unmatched right record. */
  RIGHT,
  /** Matched pairs plus every unmatched record from either side. */
  FULL;

  /**
   * Determine whether unmatched left records are part of the result.
   *
   * @return {@code true} for {@link #LEFT} and {@link #FULL}
   */
  public boolean preservesLeft() {
    return this == LEFT || this == FULL;
  }

  /**
   * Determine whether unmatched right records are part of the result.
   *
   * @return {@code true} for {@link #RIGHT} and {@link #FULL}
   */
  public boolean preservesRight() {
    return this == RIGHT || this == FULL;
  }
}
