package se.alipsa.jmonroe.schema;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Column name to aggregation mapping derived from every schema of a {@link SchemaRegistry}.
 *
 * <p>
 * Columns are known both by their merged output name ({@code ping_RTT}) and by their bare name
 * ({@code RTT}). Grouping keys map to {@link Aggregation#MODE}. The categorical set holds every
 * column reduced by {@code MODE}, that is label-like columns and identity columns.
 * </p>
 */
public final class AggregationRegistry {

  private final Map<String, Aggregation> aggregations;
  private final Set<String> categorical;
  private final Set<String> groupingKeys;

  private AggregationRegistry(Map<String, Aggregation> aggregations, Set<String> groupingKeys) {
    this.aggregations = Map.copyOf(aggregations);
    Set<String> labels = new LinkedHashSet<>();
    for (Map.Entry<String, Aggregation> entry : aggregations.entrySet()) {
      if (entry.getValue() == Aggregation.MODE) {
        labels.add(entry.getKey());
      }
    }
    this.categorical = Set.copyOf(labels);
    this.groupingKeys = Set.copyOf(groupingKeys);
  }

  /**
   * Derive the registry from a schema registry.
   *
   * @param schemas
   *          the schemas
   * @return the derived, immutable registry
   */
  public static AggregationRegistry build(SchemaRegistry schemas) {
    Map<String, Aggregation> mapping = new LinkedHashMap<>();
    Set<String> keys = new LinkedHashSet<>();
    for (TableSchema table : schemas.tables()) {
      for (String column : table.columns()) {
        Aggregation aggregation = table.isGroupingKey(column) ? Aggregation.MODE : table.aggregation(column);
        if (table.isGroupingKey(column)) {
          keys.add(column);
        }
        mapping.put(table.outputName(column), aggregation);
        mapping.putIfAbsent(column, aggregation);
      }
    }
    return new AggregationRegistry(mapping, keys);
  }

  /**
   * The aggregation of a column.
   *
   * @param column
   *          an output name ({@code ping_RTT}) or bare column name
   * @return the aggregation, or {@code null} when the column is unknown
   */
  public Aggregation aggregationFor(String column) {
    return aggregations.get(column);
  }

  /**
   * Check whether a column holds labels rather than measurements.
   *
   * @param column
   *          an output name or bare column name
   * @return {@code true} for categorical columns
   */
  public boolean isCategorical(String column) {
    return categorical.contains(column);
  }

  /**
   * Check whether a column identifies the entity a row belongs to.
   *
   * @param column
   *          a column name
   * @return {@code true} for grouping keys
   */
  public boolean isGroupingKey(String column) {
    return groupingKeys.contains(column);
  }

  /**
   * The categorical column names.
   *
   * @return immutable set of output and bare names
   */
  public Set<String> categoricalColumns() {
    return categorical;
  }

  /**
   * The mapping from column name to aggregation.
   *
   * @return immutable map
   */
  public Map<String, Aggregation> aggregations() {
    return aggregations;
  }
}
