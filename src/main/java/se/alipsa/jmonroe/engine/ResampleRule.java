package se.alipsa.jmonroe.engine;

import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fixed-width bucket rule such as {@code 1h}, {@code 30s} or {@code 15min}.
 *
 * @param width
 *          the bucket width
 */
public record ResampleRule(Duration width) {

  private static final Pattern RULE = Pattern.compile("(\\d*)\\s*(ms|s|sec|m|min|t|h|d|w)",
      Pattern.CASE_INSENSITIVE);

  /** Canonical constructor requiring a positive width. */
  public ResampleRule {
    Objects.requireNonNull(width, "width");
    if (width.isZero() || width.isNegative()) {
      throw new IllegalArgumentException("Resample width must be positive: " + width);
    }
  }

  /**
   * Parse a rule. The count defaults to 1; units are {@code ms}, {@code s}/{@code sec},
   * {@code m}/{@code min}/{@code t}, {@code h}, {@code d} and {@code w}.
   *
   * @param text
   *          the rule text
   * @return the rule
   * @throws IllegalArgumentException
   *           if the text is not a rule
   */
  public static ResampleRule parse(String text) {
    if (text == null) {
      throw new IllegalArgumentException("Resample rule must not be null");
    }
    Matcher m = RULE.matcher(text.trim());
    if (!m.matches()) {
      throw new IllegalArgumentException("Malformed resample rule: " + text);
    }
    long count = m.group(1).isEmpty() ? 1L : Long.parseLong(m.group(1));
    Duration width = switch (m.group(2).toLowerCase(Locale.ROOT)) {
      case "ms" -> Duration.ofMillis(count);
      case "s", "sec" -> Duration.ofSeconds(count);
      case "m", "min", "t" -> Duration.ofMinutes(count);
      case "h" -> Duration.ofHours(count);
      case "d" -> Duration.ofDays(count);
      case "w" -> Duration.ofDays(7 * count);
      default -> throw new IllegalArgumentException("Malformed resample rule: " + text);
    };
    return new ResampleRule(width);
  }

  /**
   * Start of the bucket holding an instant.
   *
   * @param instant
   *          the instant
   * @return the instant floored to a multiple of the width since the epoch
   */
  public Instant floor(Instant instant) {
    long millis = width.toMillis();
    return Instant.ofEpochMilli(Math.floorDiv(instant.toEpochMilli(), millis) * millis);
  }

  /**
   * The rule in the store's duration literal syntax.
   *
   * @return e.g. {@code 1h}, {@code 90s} or {@code 250ms}
   */
  public String toQueryLiteral() {
    long millis = width.toMillis();
    if (millis % Duration.ofDays(7).toMillis() == 0) {
      return millis / Duration.ofDays(7).toMillis() + "w";
    }
    if (millis % Duration.ofDays(1).toMillis() == 0) {
      return millis / Duration.ofDays(1).toMillis() + "d";
    }
    if (millis % Duration.ofHours(1).toMillis() == 0) {
      return millis / Duration.ofHours(1).toMillis() + "h";
    }
    if (millis % Duration.ofMinutes(1).toMillis() == 0) {
      return millis / Duration.ofMinutes(1).toMillis() + "m";
    }
    if (millis % 1000 == 0) {
      return millis / 1000 + "s";
    }
    return millis + "ms";
  }

  @Override
  public String toString() {
    return toQueryLiteral();
  }
}
