package se.alipsa.jmonroe.engine;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Closed time interval {@code [start, end]}.
 *
 * @param start
 *          the first instant
 * @param end
 *          the last instant
 */
public record TimeWindow(Instant start, Instant end) {

  /** Canonical constructor rejecting {@code null} bounds. */
  public TimeWindow {
    Objects.requireNonNull(start, "start");
    Objects.requireNonNull(end, "end");
  }

  /**
   * Length of the window.
   *
   * @return {@code end - start}
   */
  public Duration span() {
    return Duration.between(start, end);
  }

  /**
   * Smallest window covering this one and another.
   *
   * @param other
   *          the other window
   * @return the union hull
   */
  public TimeWindow union(TimeWindow other) {
    Instant s = start.isBefore(other.start) ? start : other.start;
    Instant e = end.isAfter(other.end) ? end : other.end;
    return new TimeWindow(s, e);
  }
}
