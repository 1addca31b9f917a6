package se.alipsa.jmonroe.schema;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import se.alipsa.jmonroe.UnknownColumnException;
import se.alipsa.jmonroe.UnknownTableException;

/**
 * Immutable set of table schemas, resolving table and column references requested by callers.
 */
public final class SchemaRegistry {

  /** Wildcard selecting every column of a table. */
  public static final String ALL_COLUMNS = "*";

  private final List<TableSchema> tables;
  private final Map<String, TableSchema> byName;

  /**
   * Create a registry from the supplied schemas.
   *
   * @param tables
   *          the schemas in registration order
   * @throws IllegalArgumentException
   *           if two schemas share a name or alias
   */
  public SchemaRegistry(List<TableSchema> tables) {
    this.tables = List.copyOf(tables);
    Map<String, TableSchema> index = new LinkedHashMap<>();
    for (TableSchema table : this.tables) {
      register(index, table.name(), table);
      for (String alias : table.aliases()) {
        register(index, alias, table);
      }
    }
    this.byName = Map.copyOf(index);
  }

  private static void register(Map<String, TableSchema> index, String name, TableSchema table) {
    String key = ColumnNameLookup.normalizeKey(name);
    TableSchema previous = index.putIfAbsent(key, table);
    if (previous != null && previous != table) {
      throw new IllegalArgumentException("Table name " + name + " is registered by both " + previous + " and " + table);
    }
  }

  /**
   * All registered schemas.
   *
   * @return immutable list in registration order
   */
  public List<TableSchema> tables() {
    return tables;
  }

  /**
   * Resolve a table by canonical name or alias, ignoring case.
   *
   * @param name
   *          the requested table
   * @return the schema
   * @throws UnknownTableException
   *           if no schema matches
   */
  public TableSchema table(String name) throws UnknownTableException {
    TableSchema table = byName.get(ColumnNameLookup.normalizeKey(name));
    if (table == null) {
      throw new UnknownTableException(name);
    }
    return table;
  }

  /**
   * Resolve a table handle, verifying that it belongs to this registry.
   *
   * @param table
   *          the schema instance
   * @return the registered schema of the same name
   * @throws UnknownTableException
   *           if the handle is not registered here
   */
  public TableSchema table(TableSchema table) throws UnknownTableException {
    if (table == null) {
      throw new UnknownTableException("null");
    }
    TableSchema registered = byName.get(ColumnNameLookup.normalizeKey(table.name()));
    if (registered == null || !registered.equals(table)) {
      throw new UnknownTableException(table.name());
    }
    return registered;
  }

  /**
   * Find the table owning a measurement returned by the store. Measurements are named
   * {@code <table>_<tier>}; the plain table name is accepted as well.
   *
   * @param measurement
   *          the measurement name
   * @param tierSuffixes
   *          the known tier suffixes
   * @return the schema
   * @throws UnknownTableException
   *           if the measurement does not belong to a registered table
   */
  public TableSchema tableForMeasurement(String measurement, Iterable<String> tierSuffixes)
      throws UnknownTableException {
    TableSchema direct = byName.get(ColumnNameLookup.normalizeKey(measurement));
    if (direct != null) {
      return direct;
    }
    if (measurement != null) {
      for (String suffix : tierSuffixes) {
        String tail = "_" + suffix;
        if (measurement.endsWith(tail)) {
          return table(measurement.substring(0, measurement.length() - tail.length()));
        }
      }
    }
    throw new UnknownTableException(measurement);
  }

  /**
   * Resolve one requested column of a table.
   *
   * @param table
   *          the table
   * @param column
   *          the column, case-insensitive and optionally qualified as {@code table.column}
   * @return the canonical column name
   * @throws UnknownColumnException
   *           if the table has no such column
   */
  public String resolveColumn(TableSchema table, String column) throws UnknownColumnException {
    String canonical = table.canonicalColumn(column);
    if (canonical == null) {
      throw new UnknownColumnException(table.name(), column);
    }
    return canonical;
  }

  /**
   * Resolve the columns requested from a table.
   *
   * <p>
   * {@value #ALL_COLUMNS}, an empty list or the table's own name select every column. Explicit
   * columns keep their requested order; with a wildcard the remaining columns follow in schema
   * order.
   * </p>
   *
   * @param table
   *          the table
   * @param columns
   *          the requested columns (may be {@code null})
   * @return the canonical column names without duplicates
   * @throws UnknownColumnException
   *           if an explicit column does not exist
   */
  public List<String> resolveColumns(TableSchema table, List<String> columns) throws UnknownColumnException {
    Set<String> resolved = new LinkedHashSet<>();
    boolean selectAll = columns == null || columns.isEmpty();
    if (columns != null) {
      for (String column : columns) {
        String trimmed = column == null ? "" : column.trim();
        if (ALL_COLUMNS.equals(trimmed) || isTableReference(table, trimmed)) {
          selectAll = true;
          continue;
        }
        resolved.add(resolveColumn(table, trimmed));
      }
    }
    if (selectAll) {
      resolved.addAll(table.columns());
    }
    return new ArrayList<>(resolved);
  }

  /**
   * Find the first registered table declaring a column as grouping key.
   *
   * @param column
   *          the column name, case-insensitive
   * @return the owning table, or {@code null} when no table uses the column as key
   */
  public TableSchema ownerOfKey(String column) {
    for (TableSchema table : tables) {
      String canonical = table.canonicalColumn(column);
      if (canonical != null && table.isGroupingKey(canonical)) {
        return table;
      }
    }
    return null;
  }

  private boolean isTableReference(TableSchema table, String requested) {
    String key = ColumnNameLookup.normalizeKey(requested);
    if (key.endsWith("." + ALL_COLUMNS)) {
      key = key.substring(0, key.length() - 2);
    }
    return byName.get(key) == table;
  }
}
