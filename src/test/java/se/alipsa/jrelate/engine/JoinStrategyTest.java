package se.alipsa.jrelate.engine;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link JoinStrategy}.
 */
class JoinStrategyTest {

  private final JoinPredicate keyed = JoinPredicates.onFields("id");
  private final JoinPredicate condition = JoinPredicates.onCondition((l, r) -> true);

  @AfterEach
  void clearProperty() {
    System.clearProperty(JoinStrategy.STRATEGY_PROPERTY);
  }

  @Test
  void autoDispatchesOnKeyExtractor() {
    assertEquals(JoinStrategy.HASH, JoinStrategy.AUTO.resolve(keyed));
    assertEquals(JoinStrategy.NESTED_LOOP, JoinStrategy.AUTO.resolve(condition));
  }

  @Test
  void explicitStrategies() {
    assertEquals(JoinStrategy.NESTED_LOOP, JoinStrategy.NESTED_LOOP.resolve(keyed));
    assertEquals(JoinStrategy.HASH, JoinStrategy.HASH.resolve(keyed));
    assertThrows(IllegalArgumentException.class, () -> JoinStrategy.HASH.resolve(condition));
  }

  @Test
  void parseIsLenient() {
    assertEquals(JoinStrategy.NESTED_LOOP, JoinStrategy.parse("nested-loop"));
    assertEquals(JoinStrategy.NESTED_LOOP, JoinStrategy.parse(" Nested_Loop "));
    assertEquals(JoinStrategy.HASH, JoinStrategy.parse("HASH"));
    assertEquals(JoinStrategy.AUTO, JoinStrategy.parse(null));
    assertEquals(JoinStrategy.AUTO, JoinStrategy.parse("merge"));
  }

  @Test
  void configuredDefaultComesFromSystemProperty() {
    assertEquals(JoinStrategy.HASH, JoinStrategy.configuredFor(keyed));
    System.setProperty(JoinStrategy.STRATEGY_PROPERTY, "nested_loop");
    assertEquals(JoinStrategy.NESTED_LOOP, JoinStrategy.configuredFor(keyed));
  }

  @Test
  void configuredHashDegradesForConditions() {
    System.setProperty(JoinStrategy.STRATEGY_PROPERTY, "hash");
    assertEquals(JoinStrategy.NESTED_LOOP, JoinStrategy.configuredFor(condition));
    assertEquals(JoinStrategy.HASH, JoinStrategy.configuredFor(keyed));
  }
}
