package se.alipsa.jmonroe.helper;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Parsing of the loose timestamp literals accepted for fetch windows. Values without a zone are
 * taken to be UTC.
 */
public final class Timestamps {

  private static final Pattern YEAR = Pattern.compile("\\d{4}");
  private static final Pattern EPOCH_MILLIS = Pattern.compile("-?\\d{9,}");

  private Timestamps() {
  }

  /**
   * Parse a timestamp literal.
   *
   * <p>
   * Accepted forms are a year ({@code 2016}), a year and month ({@code 2017-07}), a date
   * ({@code 2017-07-13}), a local date time with either {@code T} or a space separator, an ISO-8601
   * date time with offset or {@code Z}, and epoch milliseconds.
   * </p>
   *
   * @param text
   *          the literal
   * @return the corresponding instant
   * @throws IllegalArgumentException
   *           if the literal cannot be parsed
   */
  public static Instant parse(String text) {
    if (text == null || text.isBlank()) {
      throw new IllegalArgumentException("Timestamp must not be blank");
    }
    String value = text.trim();
    if (YEAR.matcher(value).matches()) {
      return LocalDate.of(Integer.parseInt(value), 1, 1).atStartOfDay().toInstant(ZoneOffset.UTC);
    }
    if (EPOCH_MILLIS.matcher(value).matches()) {
      return Instant.ofEpochMilli(Long.parseLong(value));
    }
    String iso = value.replace(' ', 'T');
    try {
      if (iso.length() == 7) {
        return YearMonth.parse(iso).atDay(1).atStartOfDay().toInstant(ZoneOffset.UTC);
      }
      if (iso.length() == 10) {
        return LocalDate.parse(iso).atStartOfDay().toInstant(ZoneOffset.UTC);
      }
      String upper = iso.toUpperCase(Locale.ROOT);
      if (upper.endsWith("Z") || hasOffset(iso)) {
        return OffsetDateTime.parse(upper).toInstant();
      }
      return LocalDateTime.parse(iso).toInstant(ZoneOffset.UTC);
    } catch (DateTimeParseException e) {
      throw new IllegalArgumentException("Unparseable timestamp: " + text, e);
    }
  }

  /**
   * Convert a value returned by the store in a {@code time} column to an instant.
   *
   * @param value
   *          epoch milliseconds as a {@link Number} or RFC 3339 text
   * @return the instant, or {@code null} when the value is {@code null}
   */
  public static Instant fromStoreValue(Object value) {
    if (value == null) {
      return null;
    }
    if (value instanceof Number number) {
      return Instant.ofEpochMilli(number.longValue());
    }
    if (value instanceof Instant instant) {
      return instant;
    }
    return parse(value.toString());
  }

  /**
   * Render an instant as a quoted literal usable in a query {@code WHERE} clause.
   *
   * @param instant
   *          the instant
   * @return the literal, e.g. {@code '2017-07-13T00:00:00Z'}
   */
  public static String toQueryLiteral(Instant instant) {
    return "'" + instant.toString() + "'";
  }

  private static boolean hasOffset(String iso) {
    int t = iso.indexOf('T');
    if (t < 0) {
      return false;
    }
    String time = iso.substring(t + 1);
    return time.indexOf('+') >= 0 || time.indexOf('-') >= 0;
  }
}
