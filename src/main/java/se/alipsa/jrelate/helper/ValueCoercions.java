package se.alipsa.jrelate.helper;

import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Date;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.BaseStream;
import se.alipsa.jrelate.Record;
import se.alipsa.jrelate.RecordSequence;

/**
 * Utility class for coercing loosely typed record values to Java types.
 *
 * <p>
 * Conversions never throw for bad data: a value that cannot be converted
 * yields an empty {@link Optional} so that callers can exclude it from the
 * operation at hand.
 */
public final class ValueCoercions {

  private static final DateTimeFormatter SQL_DATE_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

  private ValueCoercions() {
  }

  /**
   * Normalize a value before it is stored in a {@link Record}. Small integral
   * types are widened to {@link Long} and {@link Float} to {@link Double}.
   * Collections, maps and arrays are copied into unmodifiable containers (sets
   * stay sets, other collections and arrays become lists) so that a record
   * cannot change after it is built. All other values are returned as is.
   *
   * @param value
   *          the value to normalize (may be {@code null})
   * @return the canonical representation of {@code value}
   */
  public static Object normalize(Object value) {
    if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
      return ((Number) value).longValue();
    }
    if (value instanceof Float f) {
      return f.doubleValue();
    }
    if (value instanceof Set<?> set) {
      return Collections.unmodifiableSet(new LinkedHashSet<>(set));
    }
    if (value instanceof Collection<?> collection) {
      return Collections.unmodifiableList(new ArrayList<>(collection));
    }
    if (value instanceof Map<?, ?> map) {
      return Collections.unmodifiableMap(new LinkedHashMap<>(map));
    }
    if (value != null && value.getClass().isArray()) {
      int length = Array.getLength(value);
      List<Object> elements = new ArrayList<>(length);
      for (int i = 0; i < length; i++) {
        elements.add(Array.get(value, i));
      }
      return Collections.unmodifiableList(elements);
    }
    return value;
  }

  /**
   * Convert a value to the requested type.
   *
   * @param value
   *          the value to convert (may be {@code null})
   * @param type
   *          the target type
   * @param <T>
   *          the target type
   * @return the converted value, or an empty optional when {@code value} is
   *         {@code null} or not convertible
   */
  public static <T> Optional<T> convert(Object value, Class<T> type) {
    Objects.requireNonNull(type, "type");
    if (value == null) {
      return Optional.empty();
    }
    if (type == Long.class) {
      return toLong(value).map(type::cast);
    }
    if (type == Integer.class) {
      return toLong(value).flatMap(ValueCoercions::toInt).map(type::cast);
    }
    if (type == Double.class) {
      return toDouble(value).map(type::cast);
    }
    if (type == String.class) {
      return Optional.of(type.cast(String.valueOf(value)));
    }
    if (type == Boolean.class) {
      return toBoolean(value).map(type::cast);
    }
    if (type == Instant.class) {
      return toInstant(value).map(type::cast);
    }
    if (type.isInstance(value)) {
      return Optional.of(type.cast(value));
    }
    return Optional.empty();
  }

  /**
   * Convert a value to a {@link Long}. Floating point values are truncated,
   * strings are parsed as base 10 integers and booleans map to 1 and 0.
   *
   * @param value
   *          the value to convert
   * @return the converted value if possible
   */
  public static Optional<Long> toLong(Object value) {
    if (value instanceof Long l) {
      return Optional.of(l);
    }
    if (value instanceof BigDecimal bd) {
      return Optional.of(bd.longValue());
    }
    if (value instanceof Number n) {
      return Optional.of(n.longValue());
    }
    if (value instanceof Boolean b) {
      return Optional.of(b ? 1L : 0L);
    }
    if (value instanceof CharSequence cs) {
      try {
        return Optional.of(Long.parseLong(cs.toString().trim()));
      } catch (NumberFormatException e) {
        return Optional.empty();
      }
    }
    return Optional.empty();
  }

  private static Optional<Integer> toInt(long value) {
    try {
      return Optional.of(Math.toIntExact(value));
    } catch (ArithmeticException e) {
      return Optional.empty();
    }
  }

  /**
   * Convert a value to a {@link Double}. Every {@link Number} converts; strings
   * are parsed.
   *
   * @param value
   *          the value to convert
   * @return the converted value if possible
   */
  public static Optional<Double> toDouble(Object value) {
    if (value instanceof Double d) {
      return Optional.of(d);
    }
    if (value instanceof Number n) {
      return Optional.of(n.doubleValue());
    }
    if (value instanceof CharSequence cs) {
      try {
        return Optional.of(Double.parseDouble(cs.toString().trim()));
      } catch (NumberFormatException e) {
        return Optional.empty();
      }
    }
    return Optional.empty();
  }

  /**
   * Convert a value to a {@link Boolean}. Numbers are {@code true} when
   * non-zero and strings when non-empty.
   *
   * @param value
   *          the value to convert
   * @return the converted value if possible
   */
  public static Optional<Boolean> toBoolean(Object value) {
    if (value instanceof Boolean b) {
      return Optional.of(b);
    }
    if (value instanceof BigDecimal bd) {
      return Optional.of(bd.signum() != 0);
    }
    if (value instanceof BigInteger bi) {
      return Optional.of(bi.signum() != 0);
    }
    if (value instanceof Number n) {
      return Optional.of(n.doubleValue() != 0d);
    }
    if (value instanceof CharSequence cs) {
      return Optional.of(cs.length() > 0);
    }
    return Optional.empty();
  }

  /**
   * Convert a value to an {@link Instant}. Strings are parsed as ISO-8601
   * instants, {@code yyyy-MM-dd HH:mm:ss} or {@code yyyy-MM-ddTHH:mm:ss} (the
   * latter two in UTC). Integral numbers are interpreted as epoch seconds.
   *
   * @param value
   *          the value to convert
   * @return the converted value if possible
   */
  public static Optional<Instant> toInstant(Object value) {
    if (value instanceof Instant i) {
      return Optional.of(i);
    }
    if (value instanceof LocalDateTime ldt) {
      return Optional.of(ldt.toInstant(ZoneOffset.UTC));
    }
    if (value instanceof Date d) {
      return Optional.of(d.toInstant());
    }
    if (value instanceof Long l) {
      return Optional.of(Instant.ofEpochSecond(l));
    }
    if (value instanceof CharSequence cs) {
      return parseInstant(cs.toString().trim());
    }
    return Optional.empty();
  }

  private static Optional<Instant> parseInstant(String text) {
    try {
      return Optional.of(Instant.parse(text));
    } catch (DateTimeParseException e) {
      // fall through to the local formats
    }
    try {
      return Optional.of(LocalDateTime.parse(text, SQL_DATE_TIME).toInstant(ZoneOffset.UTC));
    } catch (DateTimeParseException e) {
      // fall through to the ISO local format
    }
    try {
      return Optional.of(LocalDateTime.parse(text).toInstant(ZoneOffset.UTC));
    } catch (DateTimeParseException e) {
      return Optional.empty();
    }
  }

  /**
   * Determine whether a value is a scalar that may be used as a grouping key.
   * Nested records, record sequences, collections, maps, iterators, streams and
   * arrays are complex; everything else (including {@code null}) is simple.
   *
   * @param value
   *          the value to check
   * @return {@code true} when the value is a scalar
   */
  public static boolean isSimpleValue(Object value) {
    if (value == null) {
      return true;
    }
    if (value instanceof CharSequence || value instanceof Number || value instanceof Boolean
        || value instanceof Character || value instanceof TemporalAccessor || value instanceof Date
        || value instanceof Enum<?>) {
      return true;
    }
    return !(value instanceof Record || value instanceof RecordSequence || value instanceof Collection<?>
        || value instanceof Map<?, ?> || value instanceof Iterator<?> || value instanceof Iterable<?>
        || value instanceof BaseStream<?, ?> || value.getClass().isArray());
  }

  /**
   * Zero value used by ordered aggregates when no entry could be converted.
   *
   * @param type
   *          the value type
   * @return {@code 0L}, {@code 0}, {@code 0.0}, {@code ""} or {@code false} for the
   *         matching types, otherwise {@code null}
   */
  public static Object zeroValue(Class<?> type) {
    if (type == Long.class) {
      return 0L;
    }
    if (type == Integer.class) {
      return 0;
    }
    if (type == Double.class) {
      return 0.0d;
    }
    if (type == String.class) {
      return "";
    }
    if (type == Boolean.class) {
      return Boolean.FALSE;
    }
    return null;
  }
}
