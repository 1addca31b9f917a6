package se.alipsa.jmonroe.engine;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import se.alipsa.jmonroe.helper.Values;
import se.alipsa.jmonroe.model.ResultTable;
import se.alipsa.jmonroe.schema.Aggregation;
import se.alipsa.jmonroe.schema.AggregationRegistry;

/**
 * Buckets rows in time and reduces every value column with its registered aggregation.
 *
 * <p>
 * Rows are grouped by the grouping key columns present so that different nodes and SIMs are never
 * mixed. Columns without a registered aggregation are reduced by {@link Aggregation#MODE} when
 * categorical or non-numeric, otherwise by {@link Aggregation#MEAN}. Buckets whose reduced values
 * are all missing are dropped.
 * </p>
 *
 * <p>
 * Tables keyed by fewer columns (a node-only {@code gps} frame next to a node and SIM keyed
 * {@code ping} frame) leave rows with missing keys. Within a bucket such a row is folded into the
 * single row whose keys agree on every key it does carry, filling that row's missing values. When
 * no row or several rows agree, it stays a separate row.
 * </p>
 */
public final class Resampler {

  private final AggregationRegistry aggregations;

  /**
   * Create a resampler.
   *
   * @param aggregations
   *          registry of column aggregations
   */
  public Resampler(AggregationRegistry aggregations) {
    this.aggregations = Objects.requireNonNull(aggregations, "aggregations");
  }

  /**
   * Resample a table.
   *
   * @param table
   *          the input, left unchanged
   * @param rule
   *          the bucket rule
   * @return a new table indexed by bucket start and sorted by time
   */
  public ResultTable resample(ResultTable table, ResampleRule rule) {
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
    Map<String, Aggregation> reducers = new LinkedHashMap<>();
    for (String column : valueColumns) {
      reducers.put(column, aggregationOf(table, column));
    }

    Map<List<String>, TreeMap<Instant, List<Integer>>> groups = new LinkedHashMap<>();
    for (int row = 0; row < table.rowCount(); row++) {
      List<String> groupKey = new ArrayList<>(keys.size());
      for (String key : keys) {
        groupKey.add(Values.toLabel(table.get(row, key)));
      }
      groups.computeIfAbsent(groupKey, k -> new TreeMap<>())
          .computeIfAbsent(rule.floor(table.time(row)), b -> new ArrayList<>())
          .add(row);
    }

    List<Bucket> buckets = new ArrayList<>();
    for (Map.Entry<List<String>, TreeMap<Instant, List<Integer>>> group : groups.entrySet()) {
      for (Map.Entry<Instant, List<Integer>> bucket : group.getValue().entrySet()) {
        Map<String, Object> values = new LinkedHashMap<>();
        for (int i = 0; i < keys.size(); i++) {
          values.put(keys.get(i), group.getKey().get(i));
        }
        boolean anyPresent = valueColumns.isEmpty();
        for (Map.Entry<String, Aggregation> reducer : reducers.entrySet()) {
          String column = reducer.getKey();
          List<Object> cells = new ArrayList<>(bucket.getValue().size());
          for (int row : bucket.getValue()) {
            cells.add(table.get(row, column));
          }
          Object reduced = reducer.getValue().reduce(cells);
          if (Values.isMissing(reduced)) {
            reduced = aggregations.isCategorical(column) ? null : Double.NaN;
          } else {
            anyPresent = true;
          }
          values.put(column, reduced);
        }
        if (anyPresent) {
          buckets.add(new Bucket(bucket.getKey(), group.getKey(), values));
        }
      }
    }

    ResultTable result = new ResultTable(columns);
    for (Bucket bucket : foldPartialKeys(buckets, valueColumns)) {
      result.addRow(bucket.start(), bucket.values());
    }
    result.sortByTime();
    return result;
  }

  private record Bucket(Instant start, List<String> key, Map<String, Object> values) {
  }

  private static List<Bucket> foldPartialKeys(List<Bucket> buckets, List<String> valueColumns) {
    List<Bucket> kept = new ArrayList<>();
    for (Bucket bucket : buckets) {
      if (!bucket.key().contains(null)) {
        kept.add(bucket);
      }
    }
    for (Bucket partial : buckets) {
      if (!partial.key().contains(null)) {
        continue;
      }
      Bucket target = null;
      int matches = 0;
      for (Bucket full : kept) {
        if (full.start().equals(partial.start()) && !full.key().contains(null)
            && agrees(partial.key(), full.key())) {
          target = full;
          matches++;
        }
      }
      if (matches != 1) {
        kept.add(partial);
        continue;
      }
      for (String column : valueColumns) {
        Object value = partial.values().get(column);
        if (Values.isMissing(target.values().get(column)) && !Values.isMissing(value)) {
          target.values().put(column, value);
        }
      }
    }
    return kept;
  }

  private static boolean agrees(List<String> partial, List<String> full) {
    for (int i = 0; i < partial.size(); i++) {
      if (partial.get(i) != null && !partial.get(i).equals(full.get(i))) {
        return false;
      }
    }
    return true;
  }

  private Aggregation aggregationOf(ResultTable table, String column) {
    Aggregation registered = aggregations.aggregationFor(column);
    if (registered != null) {
      return registered;
    }
    if (aggregations.isCategorical(column)) {
      return Aggregation.MODE;
    }
    for (Object value : table.column(column)) {
      if (!Values.isMissing(value) && !(value instanceof Number)) {
        return Aggregation.MODE;
      }
    }
    return Aggregation.MEAN;
  }
}
