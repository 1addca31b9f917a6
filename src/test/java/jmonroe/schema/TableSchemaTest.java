package jmonroe.schema;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import se.alipsa.jmonroe.schema.Aggregation;
import se.alipsa.jmonroe.schema.MonroeSchemas;
import se.alipsa.jmonroe.schema.TableSchema;

/** Tests for {@link TableSchema}. */
class TableSchemaTest {

  @Test
  void everyMonroeValueColumnHasOneAggregation() {
    for (TableSchema table : MonroeSchemas.registry().tables()) {
      for (String column : table.valueColumns()) {
        assertTrue(table.aggregations().containsKey(column), table + "." + column);
      }
      for (String key : table.groupingKeys()) {
        assertNull(table.aggregation(key), table + "." + key);
      }
      assertFalse(table.isGroupingKey(table.defaultField()));
    }
  }

  @Test
  void pingDeclaresExpectedAggregations() {
    TableSchema ping = MonroeSchemas.PING;
    assertEquals(List.of("NodeId", "Iccid"), ping.groupingKeys());
    assertEquals(Aggregation.MEAN, ping.aggregation("RTT"));
    assertEquals(Aggregation.MODE, ping.aggregation("Operator"));
    assertEquals("RTT", ping.defaultField());
  }

  @Test
  void qualifiesOnlyValueColumnsInOutput() {
    assertEquals("ping_RTT", MonroeSchemas.PING.outputName("RTT"));
    assertEquals("NodeId", MonroeSchemas.PING.outputName("NodeId"));
  }

  @Test
  void rejectsValueColumnWithoutAggregation() {
    assertThrows(IllegalArgumentException.class, () -> new TableSchema("t", null, List.of("NodeId", "x", "y"),
        Map.of("x", Aggregation.MEAN), List.of("NodeId"), "x", null));
  }

  @Test
  void rejectsAggregatedGroupingKey() {
    assertThrows(IllegalArgumentException.class, () -> new TableSchema("t", null, List.of("NodeId", "x"),
        Map.of("x", Aggregation.MEAN, "NodeId", Aggregation.MODE), List.of("NodeId"), "x", null));
  }

  @Test
  void rejectsKeyAsDefaultField() {
    assertThrows(IllegalArgumentException.class,
        () -> TableSchema.builder("t").groupBy("NodeId").columns(Aggregation.MEAN, "x").defaultField("NodeId")
            .build());
  }

  @Test
  void rejectsCaseInsensitiveDuplicates() {
    assertThrows(IllegalArgumentException.class,
        () -> TableSchema.builder("t").groupBy("NodeId").columns(Aggregation.MEAN, "x", "X").defaultField("x")
            .build());
  }

  @Test
  void canonicalColumnIgnoresCaseAndQualifier() {
    assertEquals("RSSI", MonroeSchemas.MODEM.canonicalColumn("modem.rssi"));
    assertNull(MonroeSchemas.MODEM.canonicalColumn("RTT"));
  }
}
