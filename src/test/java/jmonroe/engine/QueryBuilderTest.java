package jmonroe.engine;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;
import se.alipsa.jmonroe.engine.BuiltQuery;
import se.alipsa.jmonroe.engine.ClauseFields;
import se.alipsa.jmonroe.engine.ColumnPlanner;
import se.alipsa.jmonroe.engine.Granularity;
import se.alipsa.jmonroe.engine.QueryBuilder;
import se.alipsa.jmonroe.engine.ResampleRule;
import se.alipsa.jmonroe.schema.MonroeSchemas;
import se.alipsa.jmonroe.schema.TableSchema;

/** Tests for {@link QueryBuilder}. */
class QueryBuilderTest {

  private static ColumnPlanner.Target target(TableSchema table, String... columns) {
    return new ColumnPlanner.Target(table, List.of(columns), false);
  }

  @Test
  void buildsRawQuery() {
    QueryBuilder builder = new QueryBuilder(Granularity.MILLIS_10, null, 1000);
    BuiltQuery query = builder.build(target(MonroeSchemas.PING, "NodeId", "RTT", "Operator"),
        List.of("NodeId = '109'", "time >= '2017-01-15T00:00:00Z'"));
    assertEquals("SELECT RTT, Operator FROM ping_10ms WHERE NodeId = '109' AND time >= '2017-01-15T00:00:00Z'"
        + " GROUP BY NodeId, Iccid LIMIT 1000", query.text());
    assertEquals(List.of("RTT", "Operator"), query.fields());
    assertFalse(query.auxiliary());
  }

  @Test
  void buildsResampledQueryWithRegisteredAggregations() {
    QueryBuilder builder = new QueryBuilder(Granularity.SECOND, ResampleRule.parse("1h"), 0);
    BuiltQuery query = builder.build(target(MonroeSchemas.PING, "RTT", "Operator", "Error"), List.of());
    assertEquals("SELECT mean(RTT) AS RTT, mode(Operator) AS Operator, sum(Error) AS Error FROM ping_1s"
        + " GROUP BY time(1h), NodeId, Iccid", query.text());
  }

  @Test
  void selectsDefaultFieldWhenOnlyKeysRemain() {
    QueryBuilder builder = new QueryBuilder(Granularity.MINUTE, null, 10);
    BuiltQuery query = builder.build(target(MonroeSchemas.SENSOR, "NodeId"), List.of());
    assertEquals("SELECT Uptime FROM sensor_1m GROUP BY NodeId LIMIT 10", query.text());
  }

  @Test
  void auxiliaryQuerySelectsDefaultFieldAndKeys() {
    QueryBuilder builder = new QueryBuilder(Granularity.MINUTE_30, null, 1000);
    BuiltQuery query = builder.build(new ColumnPlanner.Target(MonroeSchemas.MODEM, List.of("Iccid"), true),
        List.of());
    assertEquals("SELECT DeviceMode FROM modem_30m GROUP BY NodeId, Iccid LIMIT 1000", query.text());
    assertTrue(query.auxiliary());
  }

  @Test
  void clauseIsIncludedIffLeadingFieldIsAColumn() {
    List<String> clauses = List.of("Iccid = '8946'", "RTT > 100", "Latitude > 59.0", "Operator =~ /Telia/",
        "time <= '2017-01-16T00:00:00Z'", "NodeId = '109'");
    QueryBuilder builder = new QueryBuilder(Granularity.SECOND, null, 0);
    for (TableSchema table : MonroeSchemas.registry().tables()) {
      String text = builder.build(target(table, table.defaultField()), clauses).text();
      for (String clause : clauses) {
        String field = ClauseFields.leadingField(clause);
        boolean expected = "time".equals(field) || table.hasColumn(field);
        assertEquals(expected, text.contains(clause), table + ": " + clause);
      }
    }
  }
}
