package jmonroe.schema;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;
import se.alipsa.jmonroe.UnknownColumnException;
import se.alipsa.jmonroe.UnknownTableException;
import se.alipsa.jmonroe.engine.Granularity;
import se.alipsa.jmonroe.schema.Aggregation;
import se.alipsa.jmonroe.schema.MonroeSchemas;
import se.alipsa.jmonroe.schema.SchemaRegistry;
import se.alipsa.jmonroe.schema.TableSchema;

/** Tests for {@link SchemaRegistry}. */
class SchemaRegistryTest {

  private final SchemaRegistry registry = MonroeSchemas.registry();

  @Test
  void resolvesTablesByNameAndAliasIgnoringCase() throws Exception {
    assertSame(MonroeSchemas.PING, registry.table("ping"));
    assertSame(MonroeSchemas.PING, registry.table(" PING "));
    assertSame(MonroeSchemas.MODEM, registry.table("monroe_meta_device_modem"));
    assertSame(MonroeSchemas.GPS, registry.table(MonroeSchemas.GPS));
  }

  @Test
  void unknownTableFails() {
    UnknownTableException e = assertThrows(UnknownTableException.class, () -> registry.table("bogus"));
    assertEquals("bogus", e.getTable());
    assertEquals("42S02", e.getSQLState());
  }

  @Test
  void unregisteredHandleFails() {
    TableSchema other = TableSchema.builder("ping").groupBy("NodeId").columns(Aggregation.MEAN, "RTT")
        .defaultField("RTT").build();
    assertThrows(UnknownTableException.class, () -> registry.table(other));
  }

  @Test
  void resolvesColumnsCaseInsensitivelyAndDotted() throws Exception {
    assertEquals("RTT", registry.resolveColumn(MonroeSchemas.PING, "rtt"));
    assertEquals("Operator", registry.resolveColumn(MonroeSchemas.PING, "ping.operator"));
    UnknownColumnException e = assertThrows(UnknownColumnException.class,
        () -> registry.resolveColumn(MonroeSchemas.PING, "Latitude"));
    assertEquals("ping", e.getTable());
    assertEquals("Latitude", e.getColumn());
    assertEquals("42S22", e.getSQLState());
  }

  @Test
  void wildcardEmptyAndOwnNameSelectAllColumns() throws Exception {
    List<String> all = MonroeSchemas.PING.columns();
    assertEquals(all, registry.resolveColumns(MonroeSchemas.PING, List.of("*")));
    assertEquals(all, registry.resolveColumns(MonroeSchemas.PING, List.of()));
    assertEquals(all, registry.resolveColumns(MonroeSchemas.PING, null));
    assertEquals(all, registry.resolveColumns(MonroeSchemas.PING, List.of("ping")));
    assertEquals(all, registry.resolveColumns(MonroeSchemas.PING, List.of("ping.*")));
  }

  @Test
  void explicitColumnsKeepRequestedOrderWithoutDuplicates() throws Exception {
    assertEquals(List.of("Operator", "RTT"),
        registry.resolveColumns(MonroeSchemas.PING, Arrays.asList("operator", "RTT", "rtt")));
    List<String> withWildcard = registry.resolveColumns(MonroeSchemas.PING, List.of("Operator", "*"));
    assertEquals("Operator", withWildcard.get(0));
    assertEquals(MonroeSchemas.PING.columns().size(), withWildcard.size());
  }

  @Test
  void findsOwnerOfGroupingKey() {
    assertSame(MonroeSchemas.PING, registry.ownerOfKey("iccid"));
    assertNull(registry.ownerOfKey("RTT"));
  }

  @Test
  void mapsMeasurementsBackToTables() throws Exception {
    assertSame(MonroeSchemas.PING, registry.tableForMeasurement("ping_10ms", Granularity.suffixes()));
    assertSame(MonroeSchemas.SENSOR, registry.tableForMeasurement("sensor_30m", Granularity.suffixes()));
    assertSame(MonroeSchemas.EVENT, registry.tableForMeasurement("event", Granularity.suffixes()));
    assertThrows(UnknownTableException.class,
        () -> registry.tableForMeasurement("bogus_1s", Granularity.suffixes()));
  }

  @Test
  void registryContainsAllMonroeTables() {
    assertEquals(List.of("ping", "gps", "sensor", "event", "modem", "http", "traceroute"),
        registry.tables().stream().map(TableSchema::name).toList());
  }

  @Test
  void duplicateNamesAreRejected() {
    TableSchema a = TableSchema.builder("a").alias("shared").groupBy("NodeId").columns(Aggregation.MEAN, "x")
        .defaultField("x").build();
    TableSchema b = TableSchema.builder("b").alias("SHARED").groupBy("NodeId").columns(Aggregation.MEAN, "x")
        .defaultField("x").build();
    assertThrows(IllegalArgumentException.class, () -> new SchemaRegistry(List.of(a, b)));
  }
}
