package se.alipsa.jmonroe.engine;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import se.alipsa.jmonroe.UnknownColumnException;
import se.alipsa.jmonroe.UnknownTableException;
import se.alipsa.jmonroe.helper.JMonroeUtil;
import se.alipsa.jmonroe.schema.SchemaRegistry;
import se.alipsa.jmonroe.schema.TableSchema;

/**
 * Distributes requested columns over the requested tables.
 *
 * <p>
 * An unqualified column goes to every requested table that has it; {@code table.column} only to
 * the named table. A grouping key that no requested table carries adds an auxiliary target on
 * the table owning the key, so the merged result has a join target for it.
 * </p>
 */
public final class ColumnPlanner {

  private final SchemaRegistry schemas;

  /**
   * One table to query.
   *
   * @param table
   *          the table
   * @param columns
   *          the canonical columns selected from it
   * @param auxiliary
   *          whether only the grouping keys of the table are wanted
   */
  public record Target(TableSchema table, List<String> columns, boolean auxiliary) {

    /** Canonical constructor copying the column list. */
    public Target {
      columns = List.copyOf(columns);
    }
  }

  /**
   * Create a planner.
   *
   * @param schemas
   *          the schema registry
   */
  public ColumnPlanner(SchemaRegistry schemas) {
    this.schemas = schemas;
  }

  /**
   * Plan the tables to query.
   *
   * @param tables
   *          the requested tables, resolved
   * @param columns
   *          the requested columns; {@code null}, empty or {@value SchemaRegistry#ALL_COLUMNS}
   *          select everything
   * @return one target per requested table, followed by the auxiliary targets
   * @throws UnknownColumnException
   *           if a column exists in none of the requested tables and is not a grouping key
   * @throws UnknownTableException
   *           if a column is qualified by an unknown table
   */
  public List<Target> plan(List<TableSchema> tables, List<String> columns)
      throws UnknownColumnException, UnknownTableException {
    Map<TableSchema, List<String>> requested = new LinkedHashMap<>();
    for (TableSchema table : tables) {
      requested.put(table, new ArrayList<>());
    }
    Map<TableSchema, Set<String>> auxiliary = new LinkedHashMap<>();
    for (String column : columns == null ? List.<String>of() : columns) {
      String trimmed = column.trim();
      if (trimmed.isEmpty()) {
        continue;
      }
      int dot = trimmed.lastIndexOf('.');
      if (dot > 0) {
        assignQualified(trimmed.substring(0, dot), trimmed, requested, auxiliary);
      } else {
        assignUnqualified(trimmed, requested, auxiliary);
      }
    }
    List<Target> targets = new ArrayList<>();
    for (Map.Entry<TableSchema, List<String>> entry : requested.entrySet()) {
      TableSchema table = entry.getKey();
      List<String> resolved = entry.getValue().isEmpty() && !hasExplicitColumns(columns)
          ? schemas.resolveColumns(table, List.of(SchemaRegistry.ALL_COLUMNS))
          : schemas.resolveColumns(table, entry.getValue().isEmpty() ? List.of(table.defaultField()) : entry.getValue());
      targets.add(new Target(table, resolved, false));
    }
    for (Map.Entry<TableSchema, Set<String>> entry : auxiliary.entrySet()) {
      targets.add(new Target(entry.getKey(), new ArrayList<>(entry.getValue()), true));
    }
    return targets;
  }

  private void assignQualified(String qualifier, String column, Map<TableSchema, List<String>> requested,
      Map<TableSchema, Set<String>> auxiliary) throws UnknownColumnException, UnknownTableException {
    TableSchema table = schemas.table(JMonroeUtil.normalizeQualifier(qualifier));
    String name = column.substring(column.lastIndexOf('.') + 1);
    List<String> selected = requested.get(table);
    if (selected != null) {
      selected.add(SchemaRegistry.ALL_COLUMNS.equals(name) ? name : schemas.resolveColumn(table, name));
      return;
    }
    String canonical = schemas.resolveColumn(table, name);
    if (!table.isGroupingKey(canonical)) {
      throw new UnknownColumnException(table.name(), column);
    }
    assignKey(canonical, table, requested, auxiliary);
  }

  private void assignUnqualified(String column, Map<TableSchema, List<String>> requested,
      Map<TableSchema, Set<String>> auxiliary) throws UnknownColumnException {
    if (SchemaRegistry.ALL_COLUMNS.equals(column)) {
      for (List<String> selected : requested.values()) {
        selected.add(column);
      }
      return;
    }
    boolean found = false;
    for (Map.Entry<TableSchema, List<String>> entry : requested.entrySet()) {
      String canonical = entry.getKey().canonicalColumn(column);
      if (canonical != null) {
        entry.getValue().add(canonical);
        found = true;
      }
    }
    if (found) {
      return;
    }
    TableSchema owner = schemas.ownerOfKey(column);
    if (owner == null) {
      String names = requested.keySet().stream().map(TableSchema::name).collect(Collectors.joining(","));
      throw new UnknownColumnException(names, column);
    }
    assignKey(owner.canonicalColumn(column), owner, requested, auxiliary);
  }

  private static void assignKey(String key, TableSchema owner, Map<TableSchema, List<String>> requested,
      Map<TableSchema, Set<String>> auxiliary) {
    for (Map.Entry<TableSchema, List<String>> entry : requested.entrySet()) {
      String canonical = entry.getKey().canonicalColumn(key);
      if (canonical != null && entry.getKey().isGroupingKey(canonical)) {
        entry.getValue().add(canonical);
        return;
      }
    }
    auxiliary.computeIfAbsent(owner, t -> new LinkedHashSet<>()).add(key);
  }

  private static boolean hasExplicitColumns(List<String> columns) {
    if (columns == null) {
      return false;
    }
    for (String column : columns) {
      if (column != null && !column.isBlank()) {
        return true;
      }
    }
    return false;
  }
}
