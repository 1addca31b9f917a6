package se.alipsa.jmonroe.engine;

import java.util.Locale;

/** Gap filling methods of the {@link Interpolator}. */
public enum InterpolationMethod {
  /** Linear in row position. */
  LINEAR,
  /** Linear in time. */
  TIME,
  /** Value of the nearest valid row. */
  NEAREST,
  /** Last valid value carried forward. */
  FFILL,
  /** Next valid value carried backward. */
  BFILL;

  /**
   * Parse a method name. {@code true} selects {@link #LINEAR}; {@code pad} and {@code backfill}
   * are accepted for the fill methods.
   *
   * @param text
   *          the method name, case-insensitive
   * @return the method
   * @throws IllegalArgumentException
   *           if the name is unknown
   */
  public static InterpolationMethod parse(String text) {
    if (text == null) {
      throw new IllegalArgumentException("Interpolation method must not be null");
    }
    return switch (text.trim().toLowerCase(Locale.ROOT)) {
      case "true", "linear" -> LINEAR;
      case "time" -> TIME;
      case "nearest" -> NEAREST;
      case "ffill", "pad" -> FFILL;
      case "bfill", "backfill" -> BFILL;
      default -> throw new IllegalArgumentException("Unknown interpolation method: " + text);
    };
  }

  /**
   * Whether the method carries values without interpolating and so applies to every column.
   *
   * @return {@code true} for {@link #FFILL} and {@link #BFILL}
   */
  public boolean isFill() {
    return this == FFILL || this == BFILL;
  }
}
