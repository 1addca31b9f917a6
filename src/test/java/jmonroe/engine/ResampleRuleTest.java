package jmonroe.engine;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;
import se.alipsa.jmonroe.engine.ResampleRule;

/** Tests for {@link ResampleRule}. */
class ResampleRuleTest {

  @Test
  void parsesUnits() {
    assertEquals(Duration.ofHours(1), ResampleRule.parse("1h").width());
    assertEquals(Duration.ofHours(2), ResampleRule.parse("2H").width());
    assertEquals(Duration.ofMinutes(15), ResampleRule.parse("15min").width());
    assertEquals(Duration.ofMinutes(5), ResampleRule.parse("5T").width());
    assertEquals(Duration.ofSeconds(30), ResampleRule.parse("30s").width());
    assertEquals(Duration.ofMillis(250), ResampleRule.parse("250ms").width());
    assertEquals(Duration.ofDays(1), ResampleRule.parse("d").width());
    assertEquals(Duration.ofDays(14), ResampleRule.parse("2w").width());
  }

  @Test
  void rejectsMalformedRules() {
    assertThrows(IllegalArgumentException.class, () -> ResampleRule.parse("hourly"));
    assertThrows(IllegalArgumentException.class, () -> ResampleRule.parse("0h"));
    assertThrows(IllegalArgumentException.class, () -> ResampleRule.parse(null));
  }

  @Test
  void rendersQueryLiterals() {
    assertEquals("1h", ResampleRule.parse("60min").toQueryLiteral());
    assertEquals("90s", ResampleRule.parse("90s").toQueryLiteral());
    assertEquals("1w", ResampleRule.parse("7d").toQueryLiteral());
    assertEquals("250ms", ResampleRule.parse("250ms").toQueryLiteral());
  }

  @Test
  void floorsToBucketStart() {
    ResampleRule hour = ResampleRule.parse("1h");
    assertEquals(Instant.parse("2017-01-15T11:00:00Z"), hour.floor(Instant.parse("2017-01-15T11:59:59Z")));
    assertEquals(Instant.parse("2017-01-15T11:00:00Z"), hour.floor(Instant.parse("2017-01-15T11:00:00Z")));
  }
}
