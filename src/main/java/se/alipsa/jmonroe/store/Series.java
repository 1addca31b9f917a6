package se.alipsa.jmonroe.store;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One series of a {@link RowSet}.
 *
 * @param measurement
 *          measurement name, {@code <table>_<tier>}
 * @param tags
 *          fixed tag values shared by every row (grouping key values)
 * @param columns
 *          column names, {@code time} first
 * @param values
 *          the rows, each with one cell per column
 */
public record Series(String measurement, Map<String, String> tags, List<String> columns,
    List<List<Object>> values) {

  /** Name of the time column. */
  public static final String TIME = "time";

  /**
   * Canonical constructor validating that every row matches the column list. Rows may hold
   * {@code null} cells.
   */
  public Series {
    Objects.requireNonNull(measurement, "measurement");
    tags = tags == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(tags));
    columns = columns == null ? List.of() : List.copyOf(columns);
    List<List<Object>> rows = new ArrayList<>();
    if (values != null) {
      for (List<Object> row : values) {
        if (row.size() != columns.size()) {
          throw new IllegalArgumentException("Row " + row + " of " + measurement + " does not match columns " + columns);
        }
        rows.add(Collections.unmodifiableList(new ArrayList<>(row)));
      }
    }
    values = Collections.unmodifiableList(rows);
  }

  /**
   * Position of a column.
   *
   * @param column
   *          the column name
   * @return the 0-based position, -1 when absent
   */
  public int columnIndex(String column) {
    return columns.indexOf(column);
  }
}
