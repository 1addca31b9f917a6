package se.alipsa.jmonroe.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Columnar, time indexed in-memory table.
 *
 * <p>
 * Every row has an {@link Instant} in the time index and one cell per column. Cells are loosely
 * typed: numbers, text labels, {@code null} or {@code NaN} for missing values. Instances are
 * mutable and not thread safe; each fetch owns the tables it builds.
 * </p>
 */
public final class ResultTable {

  private final List<Instant> index = new ArrayList<>();
  private final Map<String, List<Object>> columns = new LinkedHashMap<>();

  /** Create an empty table without columns. */
  public ResultTable() {
  }

  /**
   * Create an empty table with the supplied columns.
   *
   * @param columnNames
   *          the column names in order
   */
  public ResultTable(List<String> columnNames) {
    for (String name : columnNames) {
      addColumn(name);
    }
  }

  /**
   * Number of rows.
   *
   * @return the row count
   */
  public int rowCount() {
    return index.size();
  }

  /**
   * Check whether the table has no rows.
   *
   * @return {@code true} when empty
   */
  public boolean isEmpty() {
    return index.isEmpty();
  }

  /**
   * The column names in order.
   *
   * @return immutable snapshot of the column names
   */
  public List<String> columnNames() {
    return List.copyOf(columns.keySet());
  }

  /**
   * Check whether a column exists.
   *
   * @param name
   *          the column name
   * @return {@code true} if present
   */
  public boolean hasColumn(String name) {
    return columns.containsKey(name);
  }

  /**
   * The time index.
   *
   * @return unmodifiable view of the index
   */
  public List<Instant> index() {
    return Collections.unmodifiableList(index);
  }

  /**
   * The time of a row.
   *
   * @param row
   *          the 0-based row
   * @return the row's time
   */
  public Instant time(int row) {
    return index.get(row);
  }

  /**
   * The values of a column.
   *
   * @param name
   *          the column name
   * @return unmodifiable view of the column's cells
   * @throws IllegalArgumentException
   *           if the column does not exist
   */
  public List<Object> column(String name) {
    return Collections.unmodifiableList(requireColumn(name));
  }

  /**
   * Read a cell.
   *
   * @param row
   *          the 0-based row
   * @param column
   *          the column name
   * @return the cell value (may be {@code null})
   */
  public Object get(int row, String column) {
    return requireColumn(column).get(row);
  }

  /**
   * Write a cell.
   *
   * @param row
   *          the 0-based row
   * @param column
   *          the column name
   * @param value
   *          the new value
   */
  public void set(int row, String column, Object value) {
    requireColumn(column).set(row, value);
  }

  /**
   * Append a column filled with {@code null}. Adding an existing column is a no-op.
   *
   * @param name
   *          the column name
   */
  public void addColumn(String name) {
    Objects.requireNonNull(name, "name");
    columns.computeIfAbsent(name, k -> new ArrayList<>(Collections.nCopies(index.size(), null)));
  }

  /**
   * Rename a column, keeping its position.
   *
   * @param from
   *          the current name
   * @param to
   *          the new name
   */
  public void renameColumn(String from, String to) {
    if (from.equals(to)) {
      return;
    }
    if (columns.containsKey(to)) {
      throw new IllegalArgumentException("Column already exists: " + to);
    }
    Map<String, List<Object>> renamed = new LinkedHashMap<>();
    for (Map.Entry<String, List<Object>> entry : columns.entrySet()) {
      renamed.put(entry.getKey().equals(from) ? to : entry.getKey(), entry.getValue());
    }
    if (!renamed.containsKey(to)) {
      throw new IllegalArgumentException("No such column: " + from);
    }
    columns.clear();
    columns.putAll(renamed);
  }

  /**
   * Remove a column if present.
   *
   * @param name
   *          the column name
   */
  public void removeColumn(String name) {
    columns.remove(name);
  }

  /**
   * Append a row. Columns missing from {@code values} receive {@code null}; unknown columns are
   * added.
   *
   * @param time
   *          the row time
   * @param values
   *          cell values by column name
   * @return the index of the new row
   */
  public int addRow(Instant time, Map<String, ?> values) {
    Objects.requireNonNull(time, "time");
    for (String name : values.keySet()) {
      addColumn(name);
    }
    index.add(time);
    for (Map.Entry<String, List<Object>> entry : columns.entrySet()) {
      entry.getValue().add(values.get(entry.getKey()));
    }
    return index.size() - 1;
  }

  /**
   * Copy one row.
   *
   * @param row
   *          the 0-based row
   * @return the cells by column name, in column order
   */
  public Map<String, Object> row(int row) {
    Map<String, Object> values = new LinkedHashMap<>();
    for (Map.Entry<String, List<Object>> entry : columns.entrySet()) {
      values.put(entry.getKey(), entry.getValue().get(row));
    }
    return values;
  }

  /** Sort the rows by time, keeping the relative order of rows with equal times. */
  public void sortByTime() {
    List<Integer> order = new ArrayList<>(index.size());
    for (int i = 0; i < index.size(); i++) {
      order.add(i);
    }
    order.sort(Comparator.comparing(index::get));
    reorder(order);
  }

  private void reorder(List<Integer> order) {
    List<Instant> newIndex = new ArrayList<>(order.size());
    for (int i : order) {
      newIndex.add(index.get(i));
    }
    index.clear();
    index.addAll(newIndex);
    for (Map.Entry<String, List<Object>> entry : columns.entrySet()) {
      List<Object> values = entry.getValue();
      List<Object> reordered = new ArrayList<>(order.size());
      for (int i : order) {
        reordered.add(values.get(i));
      }
      entry.setValue(reordered);
    }
  }

  private List<Object> requireColumn(String name) {
    List<Object> values = columns.get(name);
    if (values == null) {
      throw new IllegalArgumentException("No such column: " + name);
    }
    return values;
  }

  @Override
  public String toString() {
    return "ResultTable[" + index.size() + " rows, columns=" + columns.keySet() + "]";
  }
}
