package se.alipsa.jmonroe.engine;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import se.alipsa.jmonroe.helper.Values;
import se.alipsa.jmonroe.model.ResultTable;
import se.alipsa.jmonroe.schema.AggregationRegistry;

/**
 * Fills gaps within each entity, never across entities.
 *
 * <p>
 * Numeric columns are interpolated with the requested method and their leading and trailing gaps
 * take the nearest valid value. {@link InterpolationMethod#FFILL} and
 * {@link InterpolationMethod#BFILL} apply to every column; for the other methods categorical
 * columns are forward filled. Rows whose value columns are still all missing are dropped.
 * </p>
 */
public final class Interpolator {

  private final AggregationRegistry aggregations;

  /**
   * Create an interpolator.
   *
   * @param aggregations
   *          registry providing grouping keys and categorical columns
   */
  public Interpolator(AggregationRegistry aggregations) {
    this.aggregations = Objects.requireNonNull(aggregations, "aggregations");
  }

  /**
   * Interpolate a table.
   *
   * @param table
   *          the input, left unchanged
   * @param method
   *          the gap filling method
   * @return a new table sorted by time
   */
  public ResultTable interpolate(ResultTable table, InterpolationMethod method) {
    List<String> columns = table.columnNames();
    List<String> keys = new ArrayList<>();
    List<String> valueColumns = new ArrayList<>();
    for (String column : columns) {
      if (aggregations.isGroupingKey(column)) {
        keys.add(column);
      } else {
        valueColumns.add(column);
      }
    }
    Map<List<String>, List<Integer>> groups = new LinkedHashMap<>();
    for (int row = 0; row < table.rowCount(); row++) {
      List<String> groupKey = new ArrayList<>(keys.size());
      for (String key : keys) {
        groupKey.add(Values.toLabel(table.get(row, key)));
      }
      groups.computeIfAbsent(groupKey, k -> new ArrayList<>()).add(row);
    }

    ResultTable result = new ResultTable(columns);
    for (List<Integer> rows : groups.values()) {
      rows.sort(Comparator.comparing(table::time));
      List<Instant> times = new ArrayList<>(rows.size());
      for (int row : rows) {
        times.add(table.time(row));
      }
      Map<String, List<Object>> filled = new LinkedHashMap<>();
      for (String column : valueColumns) {
        List<Object> values = new ArrayList<>(rows.size());
        for (int row : rows) {
          values.add(table.get(row, column));
        }
        filled.put(column, fill(column, values, times, method));
      }
      for (int i = 0; i < rows.size(); i++) {
        int row = rows.get(i);
        Map<String, Object> out = new LinkedHashMap<>();
        boolean anyPresent = valueColumns.isEmpty();
        for (String column : columns) {
          Object value = filled.containsKey(column) ? filled.get(column).get(i) : table.get(row, column);
          if (filled.containsKey(column) && !Values.isMissing(value)) {
            anyPresent = true;
          }
          out.put(column, value);
        }
        if (anyPresent) {
          result.addRow(times.get(i), out);
        }
      }
    }
    result.sortByTime();
    return result;
  }

  private List<Object> fill(String column, List<Object> values, List<Instant> times, InterpolationMethod method) {
    if (method.isFill()) {
      return method == InterpolationMethod.FFILL ? forwardFill(values) : backwardFill(values);
    }
    if (aggregations.isCategorical(column) || !isNumeric(values)) {
      return forwardFill(values);
    }
    List<Object> result = new ArrayList<>(values);
    int previous = -1;
    for (int i = 0; i < values.size(); i++) {
      if (Values.isMissing(values.get(i))) {
        continue;
      }
      if (previous >= 0 && i - previous > 1) {
        for (int gap = previous + 1; gap < i; gap++) {
          result.set(gap, between(values, times, previous, i, gap, method));
        }
      }
      previous = i;
    }
    return backwardFill(forwardFill(result));
  }

  private static Object between(List<Object> values, List<Instant> times, int lo, int hi, int at,
      InterpolationMethod method) {
    double low = Values.toDouble(values.get(lo));
    double high = Values.toDouble(values.get(hi));
    return switch (method) {
      case TIME -> {
        long span = times.get(hi).toEpochMilli() - times.get(lo).toEpochMilli();
        if (span == 0L) {
          yield low;
        }
        double fraction = (double) (times.get(at).toEpochMilli() - times.get(lo).toEpochMilli()) / span;
        yield low + (high - low) * fraction;
      }
      case NEAREST -> {
        long toLow = times.get(at).toEpochMilli() - times.get(lo).toEpochMilli();
        long toHigh = times.get(hi).toEpochMilli() - times.get(at).toEpochMilli();
        yield toLow <= toHigh ? low : high;
      }
      default -> low + (high - low) * (at - lo) / (double) (hi - lo);
    };
  }

  private static boolean isNumeric(List<Object> values) {
    for (Object value : values) {
      if (!Values.isMissing(value) && !(value instanceof Number)) {
        return false;
      }
    }
    return true;
  }

  private static List<Object> forwardFill(List<Object> values) {
    List<Object> result = new ArrayList<>(values);
    Object last = null;
    for (int i = 0; i < result.size(); i++) {
      if (Values.isMissing(result.get(i))) {
        if (last != null) {
          result.set(i, last);
        }
      } else {
        last = result.get(i);
      }
    }
    return result;
  }

  private static List<Object> backwardFill(List<Object> values) {
    List<Object> result = new ArrayList<>(values);
    Object next = null;
    for (int i = result.size() - 1; i >= 0; i--) {
      if (Values.isMissing(result.get(i))) {
        if (next != null) {
          result.set(i, next);
        }
      } else {
        next = result.get(i);
      }
    }
    return result;
  }
}
