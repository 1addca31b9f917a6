package jmonroe.engine;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;
import se.alipsa.jmonroe.InvalidFrequencyException;
import se.alipsa.jmonroe.engine.Granularity;

/** Tests for {@link Granularity}. */
class GranularityTest {

  @Test
  void tierNeverGetsFinerAsSpanGrows() {
    for (boolean entity : new boolean[] {false, true}) {
      Granularity previous = Granularity.MILLIS_10;
      for (long hours = 0; hours < 24 * 400; hours += 5) {
        Granularity tier = Granularity.forSpan(Duration.ofHours(hours), entity);
        assertTrue(tier.ordinal() >= previous.ordinal(), "span " + hours + "h entity=" + entity);
        previous = tier;
      }
    }
  }

  @Test
  void entityFilterAllowsFinerTiers() {
    assertEquals(Granularity.MILLIS_10, Granularity.forSpan(Duration.ofDays(1), true));
    assertEquals(Granularity.SECOND, Granularity.forSpan(Duration.ofDays(1), false));
    assertEquals(Granularity.MILLIS_10, Granularity.forSpan(Duration.ofHours(8), false));
    assertEquals(Granularity.MINUTE, Granularity.forSpan(Duration.ofDays(14), false));
    assertEquals(Granularity.SECOND, Granularity.forSpan(Duration.ofDays(14), true));
    assertEquals(Granularity.MINUTE_30, Granularity.forSpan(Duration.ofDays(365), true));
  }

  @Test
  void parsesRegisteredTiersOnly() throws Exception {
    assertEquals(Granularity.SECOND, Granularity.parse("1S"));
    assertEquals(Granularity.MINUTE_30, Granularity.parse(" 30M "));
    InvalidFrequencyException e = assertThrows(InvalidFrequencyException.class, () -> Granularity.parse("x"));
    assertEquals("22023", e.getSQLState());
    assertThrows(InvalidFrequencyException.class, () -> Granularity.parse(null));
  }

  @Test
  void namesMeasurements() {
    assertEquals("ping_10ms", Granularity.MILLIS_10.measurement("ping"));
    assertEquals(List.of("10ms", "1s", "1m", "30m"), Granularity.suffixes());
  }

  @Test
  void coarsestTierIsThirtyMinutes() {
    assertEquals("ping_30m", Granularity.forSpan(Duration.ofDays(365), false).measurement("ping"));
    assertThrows(InvalidFrequencyException.class, () -> Granularity.parse("1h"));
  }
}
