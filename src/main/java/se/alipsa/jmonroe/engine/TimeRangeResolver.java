package se.alipsa.jmonroe.engine;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import se.alipsa.jmonroe.InvalidTimeRangeException;
import se.alipsa.jmonroe.StoreException;
import se.alipsa.jmonroe.meta.TimeRangeLookup;
import se.alipsa.jmonroe.schema.TableSchema;

/**
 * Fixes the time window and storage tier of a fetch.
 *
 * <p>
 * A missing end defaults to the earlier of now and the latest data of the requested tables; a
 * missing start to the end minus the default window, but never before the earliest data. The data
 * span is only looked up when a bound is missing.
 * </p>
 */
public final class TimeRangeResolver {

  private final TimeRangeLookup lookup;
  private final Clock clock;
  private final Duration defaultWindow;

  /**
   * Resolved window and tier.
   *
   * @param window
   *          the closed time window
   * @param granularity
   *          the tier to query
   */
  public record Resolution(TimeWindow window, Granularity granularity) {
  }

  /**
   * Create a resolver.
   *
   * @param lookup
   *          source of per-table data spans
   * @param clock
   *          the clock providing "now"
   * @param defaultWindow
   *          length of the window when no start is given
   */
  public TimeRangeResolver(TimeRangeLookup lookup, Clock clock, Duration defaultWindow) {
    this.lookup = Objects.requireNonNull(lookup, "lookup");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.defaultWindow = Objects.requireNonNull(defaultWindow, "defaultWindow");
  }

  /**
   * Resolve the window and tier.
   *
   * @param tables
   *          the requested tables
   * @param start
   *          explicit start, or {@code null}
   * @param end
   *          explicit end, or {@code null}
   * @param granularity
   *          explicit tier, or {@code null} to pick one from the span
   * @param entityIds
   *          canonical node ids the fetch is restricted to (empty for all nodes)
   * @return the resolution
   * @throws InvalidTimeRangeException
   *           if the resolved start is after the resolved end
   * @throws StoreException
   *           if the data span cannot be looked up
   */
  public Resolution resolve(List<TableSchema> tables, Instant start, Instant end, Granularity granularity,
      List<String> entityIds) throws InvalidTimeRangeException, StoreException {
    List<String> ids = entityIds == null ? List.of() : entityIds;
    Instant resolvedStart = start;
    Instant resolvedEnd = end;
    if (resolvedStart == null || resolvedEnd == null) {
      Optional<TimeWindow> data = dataSpan(tables, ids.size() == 1 ? ids.get(0) : null);
      if (resolvedEnd == null) {
        Instant now = clock.instant();
        resolvedEnd = data.map(TimeWindow::end).filter(latest -> latest.isBefore(now)).orElse(now);
      }
      if (resolvedStart == null) {
        Instant candidate = resolvedEnd.minus(defaultWindow);
        Instant earliest = data.map(TimeWindow::start).orElse(null);
        resolvedStart = earliest != null && earliest.isAfter(candidate) ? earliest : candidate;
      }
    }
    if (resolvedStart.isAfter(resolvedEnd)) {
      throw new InvalidTimeRangeException(resolvedStart, resolvedEnd);
    }
    TimeWindow window = new TimeWindow(resolvedStart, resolvedEnd);
    Granularity tier = granularity != null ? granularity : Granularity.forSpan(window.span(), !ids.isEmpty());
    return new Resolution(window, tier);
  }

  private Optional<TimeWindow> dataSpan(List<TableSchema> tables, String entityId) throws StoreException {
    TimeWindow hull = null;
    for (TableSchema table : tables) {
      Optional<TimeWindow> range = lookup.timeRange(table, entityId);
      if (range.isPresent()) {
        hull = hull == null ? range.get() : hull.union(range.get());
      }
    }
    return Optional.ofNullable(hull);
  }
}
