package se.alipsa.jmonroe.helper;

import java.math.BigDecimal;
import java.util.regex.Pattern;

/** Helpers for the loosely typed cell values held by result tables. */
public final class Values {

  private static final Pattern WIDENED_INTEGER = Pattern.compile("-?\\d+\\.0+");

  private Values() {
  }

  /**
   * Determine whether a cell value is missing.
   *
   * @param value
   *          the value to inspect
   * @return {@code true} for {@code null} and for floating point {@code NaN}
   */
  public static boolean isMissing(Object value) {
    if (value == null) {
      return true;
    }
    if (value instanceof Double d) {
      return d.isNaN();
    }
    if (value instanceof Float f) {
      return f.isNaN();
    }
    return false;
  }

  /**
   * Convert a value to a {@code double} when it is numeric.
   *
   * @param value
   *          the value, a {@link Number} or numeric text
   * @return the numeric value, or {@code NaN} when the value is missing or not numeric
   */
  public static double toDouble(Object value) {
    if (isMissing(value)) {
      return Double.NaN;
    }
    if (value instanceof Number number) {
      return number.doubleValue();
    }
    if (value instanceof String s) {
      try {
        return Double.parseDouble(s.trim());
      } catch (NumberFormatException e) {
        return Double.NaN;
      }
    }
    return Double.NaN;
  }

  /**
   * Determine whether the value is a number or text that reads as one.
   *
   * @param value
   *          the value to inspect
   * @return {@code true} when {@link #toDouble(Object)} yields a finite number
   */
  public static boolean isNumeric(Object value) {
    if (value instanceof Boolean) {
      return false;
    }
    double d = toDouble(value);
    return !Double.isNaN(d) && !Double.isInfinite(d);
  }

  /**
   * Render a value as a category label.
   *
   * <p>
   * Integral numbers are rendered without a fractional part so that a code widened to floating
   * point by a missing neighbour ({@code 1.0}) yields the same label as the original ({@code 1}).
   * </p>
   *
   * @param value
   *          the value to render
   * @return the label, or {@code null} when the value is missing
   */
  public static String toLabel(Object value) {
    if (isMissing(value)) {
      return null;
    }
    if (value instanceof String s) {
      String trimmed = s.trim();
      if (WIDENED_INTEGER.matcher(trimmed).matches()) {
        return trimmed.substring(0, trimmed.indexOf('.'));
      }
      return s;
    }
    if (value instanceof Number && isNumeric(value)) {
      BigDecimal stripped = new BigDecimal(value.toString()).stripTrailingZeros();
      if (stripped.scale() <= 0) {
        return stripped.toBigInteger().toString();
      }
      return stripped.toPlainString();
    }
    return value.toString();
  }

  /**
   * Compare two non-null values by their natural order.
   *
   * <p>
   * Numbers compare numerically and sort before any other type; booleans compare as booleans;
   * everything else compares by its string representation.
   * </p>
   *
   * @param left
   *          the left-hand value
   * @param right
   *          the right-hand value
   * @return negative if {@code left < right}, zero if equal, positive otherwise
   */
  public static int compare(Object left, Object right) {
    if (left instanceof Number ln && right instanceof Number rn) {
      return Double.compare(ln.doubleValue(), rn.doubleValue());
    }
    if (left instanceof Number) {
      return -1;
    }
    if (right instanceof Number) {
      return 1;
    }
    if (left instanceof Boolean lb && right instanceof Boolean rb) {
      return Boolean.compare(lb, rb);
    }
    return left.toString().compareTo(right.toString());
  }
}
