package se.alipsa.jmonroe.engine;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.alipsa.jmonroe.UnknownTableException;
import se.alipsa.jmonroe.helper.Timestamps;
import se.alipsa.jmonroe.helper.Values;
import se.alipsa.jmonroe.model.ResultTable;
import se.alipsa.jmonroe.schema.SchemaRegistry;
import se.alipsa.jmonroe.schema.TableSchema;
import se.alipsa.jmonroe.store.RowSet;
import se.alipsa.jmonroe.store.Series;

/**
 * Turns query results into one wide table.
 *
 * <p>
 * Each result is assigned to its table through the measurement name. Series tags become columns,
 * the table's value transform runs on the concatenated rows and non-key columns are qualified as
 * {@code table_Column}. The per-table frames are then full outer joined on the columns they share,
 * that is time and any common grouping keys.
 * </p>
 */
public final class FrameMerger {

  private static final Logger log = LoggerFactory.getLogger(FrameMerger.class);

  private final SchemaRegistry schemas;

  /**
   * Create a merger.
   *
   * @param schemas
   *          registry used to map measurements back to tables
   */
  public FrameMerger(SchemaRegistry schemas) {
    this.schemas = Objects.requireNonNull(schemas, "schemas");
  }

  /**
   * Merge the results of one batch.
   *
   * @param results
   *          the results in any order
   * @param auxiliaryTables
   *          tables queried only for their grouping keys
   * @return the joined table sorted by time
   * @throws UnknownTableException
   *           if a measurement belongs to no registered table
   */
  public ResultTable merge(Collection<RowSet> results, Set<TableSchema> auxiliaryTables)
      throws UnknownTableException {
    Map<TableSchema, ResultTable> frames = new LinkedHashMap<>();
    for (RowSet result : results) {
      for (Series series : result.series()) {
        TableSchema table = schemas.tableForMeasurement(series.measurement(), Granularity.suffixes());
        append(frames.computeIfAbsent(table, t -> new ResultTable()), table, series);
      }
    }
    List<Frame> prepared = new ArrayList<>();
    for (Map.Entry<TableSchema, ResultTable> entry : frames.entrySet()) {
      prepared.add(prepare(entry.getKey(), entry.getValue(), auxiliaryTables.contains(entry.getKey())));
    }
    return mergeFrames(prepared);
  }

  /**
   * Join already prepared frames. The join order is fixed by the frames themselves (more grouping
   * keys first, then table name), so the input order never changes the result.
   *
   * @param frames
   *          the frames
   * @return the joined table sorted by time
   */
  static ResultTable mergeFrames(List<Frame> frames) {
    if (frames.isEmpty()) {
      return new ResultTable();
    }
    List<Frame> ordered = new ArrayList<>(frames);
    ordered.sort(Comparator.comparingInt((Frame f) -> -f.keyCount()).thenComparing(Frame::name));
    ResultTable merged = ordered.get(0).table();
    for (int i = 1; i < ordered.size(); i++) {
      merged = outerJoin(merged, ordered.get(i).table());
    }
    merged.sortByTime();
    return merged;
  }

  /**
   * A per-table frame ready to be joined.
   *
   * @param name
   *          the table name
   * @param keyCount
   *          number of grouping key columns in the frame
   * @param table
   *          the rows
   */
  record Frame(String name, int keyCount, ResultTable table) {
  }

  private static void append(ResultTable frame, TableSchema table, Series series) {
    int timeIndex = series.columnIndex(Series.TIME);
    if (timeIndex < 0) {
      log.warn("Series {} has no time column, skipping {} rows", series.measurement(), series.values().size());
      return;
    }
    for (String tag : series.tags().keySet()) {
      frame.addColumn(columnName(table, tag));
    }
    for (int c = 0; c < series.columns().size(); c++) {
      if (c != timeIndex) {
        frame.addColumn(columnName(table, series.columns().get(c)));
      }
    }
    for (List<Object> row : series.values()) {
      Instant time = Timestamps.fromStoreValue(row.get(timeIndex));
      if (time == null) {
        continue;
      }
      Map<String, Object> values = new LinkedHashMap<>();
      for (Map.Entry<String, String> tag : series.tags().entrySet()) {
        values.put(columnName(table, tag.getKey()), tag.getValue());
      }
      for (int c = 0; c < row.size(); c++) {
        if (c != timeIndex) {
          values.put(columnName(table, series.columns().get(c)), row.get(c));
        }
      }
      frame.addRow(time, values);
    }
  }

  private static String columnName(TableSchema table, String column) {
    String canonical = table.canonicalColumn(column);
    return canonical == null ? column : canonical;
  }

  private static Frame prepare(TableSchema table, ResultTable frame, boolean auxiliary) {
    table.transform().apply(frame);
    int keys = 0;
    for (String column : frame.columnNames()) {
      if (table.isGroupingKey(column)) {
        keys++;
      } else if (auxiliary) {
        frame.removeColumn(column);
      } else {
        frame.renameColumn(column, table.name() + "_" + column);
      }
    }
    return new Frame(table.name(), keys, frame);
  }

  static ResultTable outerJoin(ResultTable left, ResultTable right) {
    List<String> common = new ArrayList<>();
    List<String> rightOnly = new ArrayList<>();
    for (String column : right.columnNames()) {
      if (left.hasColumn(column)) {
        common.add(column);
      } else {
        rightOnly.add(column);
      }
    }
    List<String> columns = new ArrayList<>(left.columnNames());
    columns.addAll(rightOnly);
    ResultTable joined = new ResultTable(columns);

    Map<List<Object>, List<Integer>> rightIndex = new HashMap<>();
    for (int r = 0; r < right.rowCount(); r++) {
      rightIndex.computeIfAbsent(joinKey(right, r, common), k -> new ArrayList<>()).add(r);
    }
    boolean[] matched = new boolean[right.rowCount()];
    for (int l = 0; l < left.rowCount(); l++) {
      List<Integer> matches = rightIndex.get(joinKey(left, l, common));
      if (matches == null) {
        joined.addRow(left.time(l), left.row(l));
        continue;
      }
      for (int r : matches) {
        matched[r] = true;
        Map<String, Object> values = left.row(l);
        for (String column : rightOnly) {
          values.put(column, right.get(r, column));
        }
        joined.addRow(left.time(l), values);
      }
    }
    for (int r = 0; r < right.rowCount(); r++) {
      if (!matched[r]) {
        joined.addRow(right.time(r), right.row(r));
      }
    }
    return joined;
  }

  private static List<Object> joinKey(ResultTable table, int row, List<String> common) {
    Object[] key = new Object[common.size() + 1];
    key[0] = table.time(row);
    for (int i = 0; i < common.size(); i++) {
      key[i + 1] = Values.toLabel(table.get(row, common.get(i)));
    }
    return Arrays.asList(key);
  }
}
