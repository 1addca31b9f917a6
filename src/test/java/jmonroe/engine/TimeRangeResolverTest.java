package jmonroe.engine;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;
import se.alipsa.jmonroe.InvalidTimeRangeException;
import se.alipsa.jmonroe.engine.Granularity;
import se.alipsa.jmonroe.engine.TimeRangeResolver;
import se.alipsa.jmonroe.engine.TimeWindow;
import se.alipsa.jmonroe.meta.TimeRangeLookup;
import se.alipsa.jmonroe.schema.MonroeSchemas;
import se.alipsa.jmonroe.schema.TableSchema;

/** Tests for {@link TimeRangeResolver}. */
class TimeRangeResolverTest {

  private static final Instant NOW = Instant.parse("2017-06-01T00:00:00Z");
  private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

  private static TimeRangeLookup ranges(Map<TableSchema, TimeWindow> spans) {
    return (table, entity) -> Optional.ofNullable(spans.get(table));
  }

  @Test
  void endCapsAtLatestDataAndStartDefaultsToWindow() throws Exception {
    TimeWindow ping = new TimeWindow(Instant.parse("2016-01-01T00:00:00Z"), Instant.parse("2017-01-20T00:00:00Z"));
    TimeWindow gps = new TimeWindow(Instant.parse("2016-05-01T00:00:00Z"), Instant.parse("2017-02-01T00:00:00Z"));
    TimeRangeResolver resolver = new TimeRangeResolver(
        ranges(Map.of(MonroeSchemas.PING, ping, MonroeSchemas.GPS, gps)), CLOCK, Duration.ofDays(14));
    TimeRangeResolver.Resolution resolution = resolver.resolve(List.of(MonroeSchemas.PING, MonroeSchemas.GPS),
        null, null, null, List.of());
    assertEquals(Instant.parse("2017-02-01T00:00:00Z"), resolution.window().end());
    assertEquals(Instant.parse("2017-01-18T00:00:00Z"), resolution.window().start());
    assertEquals(Granularity.MINUTE, resolution.granularity());
  }

  @Test
  void endIsNowWithoutDataAndStartIsFlooredAtEarliestData() throws Exception {
    TimeRangeResolver noData = new TimeRangeResolver(ranges(Map.of()), CLOCK, Duration.ofDays(14));
    TimeRangeResolver.Resolution empty = noData.resolve(List.of(MonroeSchemas.PING), null, null, null, List.of());
    assertEquals(NOW, empty.window().end());
    assertEquals(NOW.minus(Duration.ofDays(14)), empty.window().start());

    TimeWindow recent = new TimeWindow(Instant.parse("2017-05-31T12:00:00Z"), Instant.parse("2017-07-01T00:00:00Z"));
    TimeRangeResolver floored = new TimeRangeResolver(ranges(Map.of(MonroeSchemas.PING, recent)), CLOCK,
        Duration.ofDays(14));
    TimeRangeResolver.Resolution resolution = floored.resolve(List.of(MonroeSchemas.PING), null, null, null,
        List.of("109"));
    assertEquals(NOW, resolution.window().end());
    assertEquals(Instant.parse("2017-05-31T12:00:00Z"), resolution.window().start());
    assertEquals(Granularity.MILLIS_10, resolution.granularity());
  }

  @Test
  void explicitBoundsSkipTheLookup() throws Exception {
    AtomicInteger lookups = new AtomicInteger();
    TimeRangeResolver resolver = new TimeRangeResolver((table, entity) -> {
      lookups.incrementAndGet();
      return Optional.empty();
    }, CLOCK, Duration.ofDays(14));
    TimeRangeResolver.Resolution resolution = resolver.resolve(List.of(MonroeSchemas.PING),
        Instant.parse("2017-01-15T00:00:00Z"), Instant.parse("2017-01-16T00:00:00Z"), null, List.of("109"));
    assertEquals(0, lookups.get());
    assertEquals(Granularity.MILLIS_10, resolution.granularity());
    assertEquals(Granularity.SECOND, resolver.resolve(List.of(MonroeSchemas.PING),
        Instant.parse("2017-01-15T00:00:00Z"), Instant.parse("2017-01-16T00:00:00Z"), null, List.of()).granularity());
  }

  @Test
  void explicitGranularityWins() throws Exception {
    TimeRangeResolver resolver = new TimeRangeResolver(ranges(Map.of()), CLOCK, Duration.ofDays(14));
    assertEquals(Granularity.MINUTE_30, resolver.resolve(List.of(MonroeSchemas.PING),
        Instant.parse("2017-01-15T00:00:00Z"), Instant.parse("2017-01-15T01:00:00Z"), Granularity.MINUTE_30, List.of())
        .granularity());
  }

  @Test
  void passesEntityOnlyForSingleNode() throws Exception {
    StringBuilder seen = new StringBuilder();
    TimeRangeResolver resolver = new TimeRangeResolver((table, entity) -> {
      seen.append(entity).append(';');
      return Optional.empty();
    }, CLOCK, Duration.ofDays(14));
    resolver.resolve(List.of(MonroeSchemas.PING), null, null, null, List.of("109"));
    resolver.resolve(List.of(MonroeSchemas.PING), null, null, null, List.of("109", "200"));
    assertEquals("109;null;", seen.toString());
  }

  @Test
  void startAfterEndFails() {
    TimeRangeResolver resolver = new TimeRangeResolver(ranges(Map.of()), CLOCK, Duration.ofDays(14));
    InvalidTimeRangeException e = assertThrows(InvalidTimeRangeException.class,
        () -> resolver.resolve(List.of(MonroeSchemas.PING), Instant.parse("2017-01-01T00:00:00Z"),
            Instant.parse("2010-01-01T00:00:00Z"), null, List.of()));
    assertTrue(e.getMessage().contains("2017-01-01T00:00:00Z"));
    assertEquals("22007", e.getSQLState());
  }
}
