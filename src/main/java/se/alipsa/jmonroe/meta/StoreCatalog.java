package se.alipsa.jmonroe.meta;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.alipsa.jmonroe.MonroeException;
import se.alipsa.jmonroe.StoreException;
import se.alipsa.jmonroe.UnknownTableException;
import se.alipsa.jmonroe.engine.Granularity;
import se.alipsa.jmonroe.engine.TimeWindow;
import se.alipsa.jmonroe.helper.JMonroeUtil;
import se.alipsa.jmonroe.helper.Timestamps;
import se.alipsa.jmonroe.schema.MonroeSchemas;
import se.alipsa.jmonroe.schema.SchemaRegistry;
import se.alipsa.jmonroe.schema.TableSchema;
import se.alipsa.jmonroe.store.ConcurrentQueryExecutor;
import se.alipsa.jmonroe.store.RowSet;
import se.alipsa.jmonroe.store.Series;
import se.alipsa.jmonroe.store.TimeSeriesStore;

/**
 * Metadata lookups against the store: which nodes report to which tables, distinct field values
 * and the time span of each table.
 *
 * <p>
 * Every lookup is memoized per catalog, keyed by its arguments. {@link #clearCaches()} drops all
 * memoized answers; a new catalog starts empty.
 * </p>
 */
public final class StoreCatalog implements TimeRangeLookup {

  private static final Logger log = LoggerFactory.getLogger(StoreCatalog.class);

  /** Column holding the values of a {@code SELECT DISTINCT} query. */
  static final String DISTINCT = "distinct";
  /** Column holding the values of a {@code SHOW TAG VALUES} query. */
  static final String VALUE = "value";

  private final SchemaRegistry schemas;
  private final ConcurrentQueryExecutor executor;

  private final Map<DistinctKey, Set<Object>> distinctCache = new ConcurrentHashMap<>();
  private final Map<RangeKey, Optional<TimeWindow>> rangeCache = new ConcurrentHashMap<>();
  private volatile Map<String, List<String>> nodesByTable;

  private record DistinctKey(TableSchema table, String field, String nodeId, List<String> where,
      Granularity granularity, Instant start, Instant end) {
  }

  private record RangeKey(TableSchema table, String nodeId, Granularity granularity) {
  }

  /**
   * Create a catalog.
   *
   * @param store
   *          the store to query
   * @param schemas
   *          the schema registry
   * @param grace
   *          extra time allowed for concurrent probes beyond the store timeout
   */
  public StoreCatalog(TimeSeriesStore store, SchemaRegistry schemas, Duration grace) {
    this.schemas = Objects.requireNonNull(schemas, "schemas");
    this.executor = new ConcurrentQueryExecutor(store, grace);
  }

  /**
   * Distinct values of a field.
   *
   * @param table
   *          the table name or alias
   * @param field
   *          the field, case-insensitive
   * @param nodeId
   *          restrict to one node, or {@code null}
   * @param where
   *          additional filter clauses (may be {@code null})
   * @param granularity
   *          the tier to query, {@code null} for {@link Granularity#SECOND}
   * @param start
   *          earliest time, or {@code null}
   * @param end
   *          latest time, or {@code null}
   * @return the distinct values in the order the store returned them
   * @throws MonroeException
   *           if the table or field is unknown or the store fails
   */
  public Set<Object> distinctValues(String table, String field, String nodeId, List<String> where,
      Granularity granularity, Instant start, Instant end) throws MonroeException {
    TableSchema schema = schemas.table(table);
    String column = schemas.resolveColumn(schema, field);
    String node = nodeId == null || nodeId.isBlank() ? null : JMonroeUtil.canonicalNodeId(nodeId);
    Granularity tier = granularity == null ? Granularity.SECOND : granularity;
    List<String> clauses = where == null ? List.of() : List.copyOf(where);
    DistinctKey key = new DistinctKey(schema, column, node, clauses, tier, start, end);
    Set<Object> cached = distinctCache.get(key);
    if (cached != null) {
      return cached;
    }
    List<String> conditions = new ArrayList<>(clauses);
    if (node != null) {
      conditions.add(MonroeSchemas.NODE_ID + " = '" + node + "'");
    }
    if (start != null) {
      conditions.add("time >= " + Timestamps.toQueryLiteral(start));
    }
    if (end != null) {
      conditions.add("time <= " + Timestamps.toQueryLiteral(end));
    }
    StringBuilder query = new StringBuilder("SELECT DISTINCT(").append(column).append(") FROM ")
        .append(tier.measurement(schema.name()));
    if (!conditions.isEmpty()) {
      query.append(" WHERE ").append(String.join(" AND ", conditions));
    }
    Set<Object> values = new LinkedHashSet<>();
    for (Series series : executor.execute(query.toString()).series()) {
      int index = series.columnIndex(DISTINCT);
      if (index < 0) {
        continue;
      }
      for (List<Object> row : series.values()) {
        if (row.get(index) != null) {
          values.add(row.get(index));
        }
      }
    }
    Set<Object> result = Collections.unmodifiableSet(values);
    distinctCache.put(key, result);
    return result;
  }

  /**
   * The nodes reporting to each table.
   *
   * @return node ids per table name, tables in name order and nodes in numeric order
   * @throws StoreException
   *           if the store fails
   */
  public Map<String, List<String>> nodesForTable() throws StoreException {
    Map<String, List<String>> cached = nodesByTable;
    if (cached != null) {
      return cached;
    }
    RowSet result = executor.execute("SHOW TAG VALUES WITH KEY = " + MonroeSchemas.NODE_ID);
    Map<String, Set<String>> nodes = new TreeMap<>();
    for (Series series : result.series()) {
      String table;
      try {
        table = schemas.tableForMeasurement(series.measurement(), Granularity.suffixes()).name();
      } catch (UnknownTableException e) {
        log.debug("Ignoring tag values of unregistered measurement {}", series.measurement());
        continue;
      }
      int index = series.columnIndex(VALUE);
      if (index < 0) {
        continue;
      }
      Set<String> ids = nodes.computeIfAbsent(table, t -> new TreeSet<>(StoreCatalog::compareNodeIds));
      for (List<Object> row : series.values()) {
        if (row.get(index) != null) {
          ids.add(row.get(index).toString());
        }
      }
    }
    Map<String, List<String>> byTable = new TreeMap<>();
    for (Map.Entry<String, Set<String>> entry : nodes.entrySet()) {
      byTable.put(entry.getKey(), List.copyOf(entry.getValue()));
    }
    cached = Collections.unmodifiableMap(byTable);
    nodesByTable = cached;
    return cached;
  }

  /**
   * Every node present in any table.
   *
   * @return node ids in numeric order
   * @throws StoreException
   *           if the store fails
   */
  public List<String> allNodes() throws StoreException {
    Set<String> nodes = new TreeSet<>(StoreCatalog::compareNodeIds);
    for (List<String> ids : nodesForTable().values()) {
      nodes.addAll(ids);
    }
    return List.copyOf(nodes);
  }

  /**
   * Every table holding data.
   *
   * @return table names in name order
   * @throws StoreException
   *           if the store fails
   */
  public List<String> allTables() throws StoreException {
    return List.copyOf(nodesForTable().keySet());
  }

  /**
   * The tables a node reports to.
   *
   * @param nodeId
   *          the node id
   * @return table names in name order
   * @throws StoreException
   *           if the store fails
   */
  public Set<String> tablesForNode(String nodeId) throws StoreException {
    String node = JMonroeUtil.canonicalNodeId(nodeId);
    Set<String> tables = new TreeSet<>();
    for (Map.Entry<String, List<String>> entry : nodesForTable().entrySet()) {
      if (entry.getValue().contains(node)) {
        tables.add(entry.getKey());
      }
    }
    return Collections.unmodifiableSet(tables);
  }

  /**
   * Earliest and latest timestamps of a table, found by probing its default field in both time
   * directions concurrently.
   *
   * @param table
   *          the table name or alias
   * @param nodeId
   *          restrict to one node, or {@code null}
   * @param granularity
   *          the tier to probe, {@code null} for the finest
   * @return the span, empty when the table has no data
   * @throws MonroeException
   *           if the table is unknown or the store fails
   */
  public Optional<TimeWindow> tableTimeRange(String table, String nodeId, Granularity granularity)
      throws MonroeException {
    return tableTimeRange(schemas.table(table), nodeId, granularity);
  }

  @Override
  public Optional<TimeWindow> timeRange(TableSchema table, String entityId) throws StoreException {
    return tableTimeRange(table, entityId, Granularity.MILLIS_10);
  }

  private Optional<TimeWindow> tableTimeRange(TableSchema table, String nodeId, Granularity granularity)
      throws StoreException {
    String node = nodeId == null || nodeId.isBlank() ? null : JMonroeUtil.canonicalNodeId(nodeId);
    Granularity tier = granularity == null ? Granularity.MILLIS_10 : granularity;
    RangeKey key = new RangeKey(table, node, tier);
    Optional<TimeWindow> cached = rangeCache.get(key);
    if (cached != null) {
      return cached;
    }
    String base = "SELECT " + table.defaultField() + " FROM " + tier.measurement(table.name())
        + (node == null ? "" : " WHERE " + MonroeSchemas.NODE_ID + " = '" + node + "'");
    List<RowSet> probes = executor.executeAll(
        List.of(base + " ORDER BY time LIMIT 1", base + " ORDER BY time DESC LIMIT 1"), null);
    Instant first = null;
    Instant last = null;
    for (RowSet probe : probes) {
      for (Series series : probe.series()) {
        int index = series.columnIndex(Series.TIME);
        if (index < 0) {
          continue;
        }
        for (List<Object> row : series.values()) {
          Instant time = Timestamps.fromStoreValue(row.get(index));
          if (time == null) {
            continue;
          }
          first = first == null || time.isBefore(first) ? time : first;
          last = last == null || time.isAfter(last) ? time : last;
        }
      }
    }
    Optional<TimeWindow> range = first == null ? Optional.empty() : Optional.of(new TimeWindow(first, last));
    rangeCache.put(key, range);
    return range;
  }

  /** Drop every memoized answer. */
  public void clearCaches() {
    distinctCache.clear();
    rangeCache.clear();
    nodesByTable = null;
  }

  private static int compareNodeIds(String left, String right) {
    try {
      return Long.compare(Long.parseLong(left), Long.parseLong(right));
    } catch (NumberFormatException e) {
      return left.compareTo(right);
    }
  }
}
