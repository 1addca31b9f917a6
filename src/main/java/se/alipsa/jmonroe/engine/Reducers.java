package se.alipsa.jmonroe.engine;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import se.alipsa.jmonroe.helper.Values;

/**
 * Bucket reducers backing {@link se.alipsa.jmonroe.schema.Aggregation}. Missing values
 * ({@code null}, {@code NaN}) are skipped; an input without present values reduces to
 * {@code NaN}.
 */
public final class Reducers {

  private Reducers() {
  }

  /**
   * Arithmetic mean.
   *
   * @param values
   *          the bucket values
   * @return the mean as a {@code Double}
   * @throws IllegalArgumentException
   *           if a present value is not numeric
   */
  public static Object mean(List<?> values) {
    BigDecimal sum = BigDecimal.ZERO;
    long count = 0;
    for (Object value : values) {
      if (Values.isMissing(value)) {
        continue;
      }
      sum = sum.add(toBigDecimal(value, "mean"));
      count++;
    }
    if (count == 0L) {
      return Double.NaN;
    }
    if (count == 1L) {
      return sum.doubleValue();
    }
    return sum.divide(BigDecimal.valueOf(count), MathContext.DECIMAL64).doubleValue();
  }

  /**
   * Sum of the present values.
   *
   * @param values
   *          the bucket values
   * @return the sum as a {@code Double}
   */
  public static Object sum(List<?> values) {
    BigDecimal sum = BigDecimal.ZERO;
    boolean any = false;
    for (Object value : values) {
      if (Values.isMissing(value)) {
        continue;
      }
      sum = sum.add(toBigDecimal(value, "sum"));
      any = true;
    }
    return any ? sum.doubleValue() : Double.NaN;
  }

  /**
   * Largest present value in natural order.
   *
   * @param values
   *          the bucket values
   * @return the maximum, {@code NaN} when nothing is present
   */
  public static Object max(List<?> values) {
    Object max = null;
    for (Object value : values) {
      if (Values.isMissing(value)) {
        continue;
      }
      if (max == null || Values.compare(value, max) > 0) {
        max = value;
      }
    }
    return max == null ? Double.NaN : max;
  }

  /**
   * Most frequent present value; ties go to the smallest value in natural order.
   *
   * @param values
   *          the bucket values
   * @return the mode, {@code NaN} when nothing is present
   */
  public static Object mode(List<?> values) {
    Map<Object, Integer> counts = new LinkedHashMap<>();
    for (Object value : values) {
      if (Values.isMissing(value)) {
        continue;
      }
      counts.merge(value, 1, Integer::sum);
    }
    Object best = null;
    int bestCount = 0;
    for (Map.Entry<Object, Integer> entry : counts.entrySet()) {
      int count = entry.getValue();
      if (count > bestCount || (count == bestCount && Values.compare(entry.getKey(), best) < 0)) {
        best = entry.getKey();
        bestCount = count;
      }
    }
    return best == null ? Double.NaN : best;
  }

  private static BigDecimal toBigDecimal(Object value, String function) {
    if (value instanceof BigDecimal bd) {
      return bd;
    }
    if (value instanceof BigInteger bi) {
      return new BigDecimal(bi);
    }
    if (value instanceof Number number) {
      if (value instanceof Byte || value instanceof Short || value instanceof Integer || value instanceof Long) {
        return BigDecimal.valueOf(number.longValue());
      }
      return BigDecimal.valueOf(number.doubleValue());
    }
    throw new IllegalArgumentException(
        function + " requires numeric inputs but received " + value.getClass().getName() + " (" + value + ")");
  }
}
