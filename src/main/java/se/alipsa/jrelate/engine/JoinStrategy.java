package se.alipsa.jrelate.engine;

import java.util.Locale;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Algorithm used to pair left and right records.
 *
 * <p>
 * {@link #AUTO} picks {@link #HASH} when the predicate implements
 * {@link KeyExtractor} and {@link #NESTED_LOOP} otherwise. The default used by
 * the pipeline entry points can be changed with the system property
 * {@value #STRATEGY_PROPERTY} ({@code auto}, {@code hash} or
 * {@code nested_loop}).
 * </p>
 */
public enum JoinStrategy {
  /** Choose based on the predicate capabilities. */
  AUTO,
  /** Build a hash table over the right side and look up each left record in it. */
  HASH,
  /** Compare every left record with every right record. */
  NESTED_LOOP;

  /** System property holding the default strategy. */
  public static final String STRATEGY_PROPERTY = "jrelate.join.strategy";

  private static final Logger log = LoggerFactory.getLogger(JoinStrategy.class);

  /**
   * Resolve the concrete strategy for a predicate.
   *
   * @param predicate
   *          the join predicate
   * @return {@link #HASH} or {@link #NESTED_LOOP}
   * @throws IllegalArgumentException
   *           if {@link #HASH} is requested for a predicate that does not
   *           implement {@link KeyExtractor}
   */
  public JoinStrategy resolve(JoinPredicate predicate) {
    Objects.requireNonNull(predicate, "predicate");
    boolean hashable = predicate instanceof KeyExtractor;
    return switch (this) {
      case AUTO -> hashable ? HASH : NESTED_LOOP;
      case NESTED_LOOP -> NESTED_LOOP;
      case HASH -> {
        if (!hashable) {
          throw new IllegalArgumentException(
              "Hash join requires a predicate implementing KeyExtractor but got " + predicate);
        }
        yield HASH;
      }
    };
  }

  /**
   * Resolve the configured default strategy for a predicate. A configured
   * {@link #HASH} default falls back to {@link #NESTED_LOOP} for predicates
   * without a key.
   *
   * @param predicate
   *          the join predicate
   * @return {@link #HASH} or {@link #NESTED_LOOP}
   */
  public static JoinStrategy configuredFor(JoinPredicate predicate) {
    Objects.requireNonNull(predicate, "predicate");
    JoinStrategy configured = parse(System.getProperty(STRATEGY_PROPERTY));
    if (configured == HASH && !(predicate instanceof KeyExtractor)) {
      log.debug("Configured hash join is not applicable to {}, using nested loop", predicate);
      return NESTED_LOOP;
    }
    return configured.resolve(predicate);
  }

  /**
   * Parse a strategy name. Matching ignores case and treats {@code -} and
   * {@code _} alike.
   *
   * @param value
   *          the name, may be {@code null}
   * @return the strategy, {@link #AUTO} for {@code null}, blank or unknown
   *         values
   */
  public static JoinStrategy parse(String value) {
    if (value == null || value.isBlank()) {
      return AUTO;
    }
    String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
    for (JoinStrategy strategy : values()) {
      if (strategy.name().equals(normalized)) {
        return strategy;
      }
    }
    log.warn("Unknown join strategy '{}' in {}, using {}", value, STRATEGY_PROPERTY, AUTO);
    return AUTO;
  }
}
