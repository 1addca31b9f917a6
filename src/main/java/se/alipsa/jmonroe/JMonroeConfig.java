package se.alipsa.jmonroe;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.Properties;
import se.alipsa.jmonroe.helper.JMonroeUtil;

/**
 * Tunables of a fetch.
 *
 * @param limit
 *          maximum rows per series in raw queries, {@code 0} for no limit
 * @param windowDays
 *          length of the default time window in days
 * @param timeoutGraceMillis
 *          time allowed beyond the store timeout before a query batch is abandoned
 */
public record JMonroeConfig(int limit, int windowDays, long timeoutGraceMillis) {

  /** Classpath resource read by {@link #load()}. */
  public static final String RESOURCE = "/jmonroe.properties";
  /** Prefix of system properties overriding the resource. */
  public static final String SYSTEM_PREFIX = "jmonroe.";

  /** Built-in defaults: 1000 rows, 14 days, 5 seconds grace. */
  public static final JMonroeConfig DEFAULTS = new JMonroeConfig(1000, 14, 5000L);

  /** Canonical constructor validating ranges. */
  public JMonroeConfig {
    if (limit < 0) {
      throw new IllegalArgumentException("limit must not be negative: " + limit);
    }
    if (windowDays <= 0) {
      throw new IllegalArgumentException("windowDays must be positive: " + windowDays);
    }
    if (timeoutGraceMillis < 0) {
      throw new IllegalArgumentException("timeoutGraceMillis must not be negative: " + timeoutGraceMillis);
    }
  }

  /**
   * Load the configuration from {@value #RESOURCE} on the classpath, overridden by
   * {@code jmonroe.*} system properties. Missing values keep their defaults.
   *
   * @return the configuration
   */
  public static JMonroeConfig load() {
    Properties props = new Properties();
    try (InputStream in = JMonroeConfig.class.getResourceAsStream(RESOURCE)) {
      if (in != null) {
        props.load(in);
      }
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read " + RESOURCE, e);
    }
    for (String name : System.getProperties().stringPropertyNames()) {
      if (name.startsWith(SYSTEM_PREFIX)) {
        props.setProperty(name.substring(SYSTEM_PREFIX.length()), System.getProperty(name));
      }
    }
    JMonroeConfig config = DEFAULTS.with(props);
    return config;
  }

  /**
   * Parse a URL-style option string such as {@code limit=500&windowDays=7}.
   *
   * @param query
   *          the option string, optionally starting with {@code ?}
   * @return the defaults overridden by the options
   */
  public static JMonroeConfig parse(String query) {
    return DEFAULTS.with(JMonroeUtil.parseUrlQuery(query));
  }

  /**
   * Override values from properties named {@code limit}, {@code windowDays} and
   * {@code timeoutGraceMillis}.
   *
   * @param props
   *          the overrides
   * @return a new configuration
   * @throws IllegalArgumentException
   *           if a value is not a number or out of range
   */
  public JMonroeConfig with(Properties props) {
    return new JMonroeConfig(
        (int) number(props, "limit", limit),
        (int) number(props, "windowDays", windowDays),
        number(props, "timeoutGraceMillis", timeoutGraceMillis));
  }

  /**
   * The default time window.
   *
   * @return {@code windowDays} as a duration
   */
  public Duration window() {
    return Duration.ofDays(windowDays);
  }

  /**
   * The batch timeout grace.
   *
   * @return {@code timeoutGraceMillis} as a duration
   */
  public Duration timeoutGrace() {
    return Duration.ofMillis(timeoutGraceMillis);
  }

  private static long number(Properties props, String key, long fallback) {
    String value = props.getProperty(key);
    if (value == null || value.isBlank()) {
      return fallback;
    }
    try {
      return Long.parseLong(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Configuration value " + key + " is not a number: " + value, e);
    }
  }
}
