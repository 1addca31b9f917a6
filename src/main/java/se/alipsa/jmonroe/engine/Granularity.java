package se.alipsa.jmonroe.engine;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import se.alipsa.jmonroe.InvalidFrequencyException;

/**
 * Pre-aggregated storage tiers, finest first. A measurement of table {@code ping} at tier
 * {@code 1s} is stored as {@code ping_1s}.
 */
public enum Granularity {
  MILLIS_10("10ms", Duration.ofHours(8), Duration.ofDays(2)),
  SECOND("1s", Duration.ofDays(3), Duration.ofDays(14)),
  MINUTE("1m", Duration.ofDays(30), Duration.ofDays(180)),
  MINUTE_30("30m", null, null);

  private final String suffix;
  private final Duration ceiling;
  private final Duration entityCeiling;

  Granularity(String suffix, Duration ceiling, Duration entityCeiling) {
    this.suffix = suffix;
    this.ceiling = ceiling;
    this.entityCeiling = entityCeiling;
  }

  /**
   * The measurement suffix.
   *
   * @return e.g. {@code 10ms}
   */
  public String suffix() {
    return suffix;
  }

  /**
   * The measurement holding a table at this tier.
   *
   * @param table
   *          the table name
   * @return {@code <table>_<suffix>}
   */
  public String measurement(String table) {
    return table + "_" + suffix;
  }

  /**
   * Longest span served by this tier.
   *
   * @param entityFiltered
   *          whether the query is restricted to specific nodes
   * @return the ceiling, {@code null} when unbounded
   */
  public Duration ceiling(boolean entityFiltered) {
    return entityFiltered ? entityCeiling : ceiling;
  }

  /**
   * Finest tier whose ceiling the span does not exceed.
   *
   * @param span
   *          the queried time span
   * @param entityFiltered
   *          whether the query is restricted to specific nodes
   * @return the tier
   */
  public static Granularity forSpan(Duration span, boolean entityFiltered) {
    for (Granularity tier : values()) {
      Duration limit = tier.ceiling(entityFiltered);
      if (limit == null || span.compareTo(limit) <= 0) {
        return tier;
      }
    }
    return MINUTE_30;
  }

  /**
   * Parse an explicit tier.
   *
   * @param text
   *          the tier suffix, e.g. {@code 1s}, case-insensitive
   * @return the tier
   * @throws InvalidFrequencyException
   *           if the text names no tier
   */
  public static Granularity parse(String text) throws InvalidFrequencyException {
    if (text != null) {
      String trimmed = text.trim();
      for (Granularity tier : values()) {
        if (tier.suffix.equalsIgnoreCase(trimmed)) {
          return tier;
        }
      }
    }
    throw new InvalidFrequencyException(text, suffixes());
  }

  /**
   * All tier suffixes, finest first.
   *
   * @return the suffixes
   */
  public static List<String> suffixes() {
    List<String> names = new ArrayList<>();
    for (Granularity tier : values()) {
      names.add(tier.suffix);
    }
    return List.copyOf(names);
  }
}
