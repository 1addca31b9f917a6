package se.alipsa.jmonroe.schema;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Static description of one measurement table.
 *
 * @param name
 *          canonical table name, also the measurement prefix in the store
 * @param aliases
 *          alternative names the table may be requested by
 * @param columns
 *          all columns in schema order, grouping keys included
 * @param aggregations
 *          aggregation of every non-key column
 * @param groupingKeys
 *          identity columns, never aggregated
 * @param defaultField
 *          non-key column probed to find out whether the table holds data
 * @param transform
 *          post-fetch hook applied to the table's rows
 */
public record TableSchema(String name, Set<String> aliases, List<String> columns,
    Map<String, Aggregation> aggregations, List<String> groupingKeys, String defaultField,
    ValueTransform transform) {

  /**
   * Canonical constructor validating that every non-key column has exactly one aggregation and
   * that grouping keys carry none.
   */
  public TableSchema {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(columns, "columns");
    Objects.requireNonNull(aggregations, "aggregations");
    Objects.requireNonNull(defaultField, "defaultField");
    aliases = aliases == null ? Set.of() : Set.copyOf(aliases);
    groupingKeys = groupingKeys == null ? List.of() : List.copyOf(groupingKeys);
    transform = transform == null ? ValueTransform.IDENTITY : transform;
    columns = List.copyOf(columns);
    aggregations = Map.copyOf(aggregations);
    ColumnNameLookup.buildCaseInsensitiveIndex(columns);
    for (String key : groupingKeys) {
      if (!columns.contains(key)) {
        throw new IllegalArgumentException("Grouping key " + key + " is not a column of " + name);
      }
      if (aggregations.containsKey(key)) {
        throw new IllegalArgumentException("Grouping key " + key + " of " + name + " must not be aggregated");
      }
    }
    for (String column : columns) {
      if (!groupingKeys.contains(column) && !aggregations.containsKey(column)) {
        throw new IllegalArgumentException("Column " + column + " of " + name + " has no aggregation");
      }
    }
    for (String column : aggregations.keySet()) {
      if (!columns.contains(column)) {
        throw new IllegalArgumentException("Aggregated column " + column + " is not a column of " + name);
      }
    }
    if (groupingKeys.contains(defaultField) || !columns.contains(defaultField)) {
      throw new IllegalArgumentException("Default field " + defaultField + " must be a non-key column of " + name);
    }
  }

  /**
   * Start a schema definition.
   *
   * @param name
   *          the canonical table name
   * @return a new builder
   */
  public static Builder builder(String name) {
    return new Builder(name);
  }

  /**
   * Resolve a column name case-insensitively.
   *
   * @param column
   *          the column name, optionally qualified as {@code table.column}
   * @return the canonical column name, or {@code null} when the table has no such column
   */
  public String canonicalColumn(String column) {
    String key = ColumnNameLookup.normalizeKey(ColumnNameLookup.unqualified(column));
    for (String candidate : columns) {
      if (ColumnNameLookup.normalizeKey(candidate).equals(key)) {
        return candidate;
      }
    }
    return null;
  }

  /**
   * Check whether the table has a column, ignoring case.
   *
   * @param column
   *          the column name
   * @return {@code true} when the column exists
   */
  public boolean hasColumn(String column) {
    return canonicalColumn(column) != null;
  }

  /**
   * Check whether a canonical column is one of the grouping keys.
   *
   * @param column
   *          the canonical column name
   * @return {@code true} for identity columns
   */
  public boolean isGroupingKey(String column) {
    return groupingKeys.contains(column);
  }

  /**
   * The non-key columns in schema order.
   *
   * @return immutable list of aggregated columns
   */
  public List<String> valueColumns() {
    List<String> values = new ArrayList<>(columns.size());
    for (String column : columns) {
      if (!groupingKeys.contains(column)) {
        values.add(column);
      }
    }
    return List.copyOf(values);
  }

  /**
   * The aggregation of a non-key column.
   *
   * @param column
   *          the canonical column name
   * @return the aggregation, or {@code null} for grouping keys and unknown columns
   */
  public Aggregation aggregation(String column) {
    return aggregations.get(column);
  }

  /**
   * The name of a column in merged output, non-key columns being qualified by the table name.
   *
   * @param column
   *          the canonical column name
   * @return {@code table_Column} for non-key columns, the bare name for grouping keys
   */
  public String outputName(String column) {
    return isGroupingKey(column) ? column : name + "_" + column;
  }

  @Override
  public String toString() {
    return name;
  }

  /** Builder declaring columns in schema order. */
  public static final class Builder {

    private final String name;
    private final Set<String> aliases = new LinkedHashSet<>();
    private final List<String> columns = new ArrayList<>();
    private final Map<String, Aggregation> aggregations = new LinkedHashMap<>();
    private final List<String> groupingKeys = new ArrayList<>();
    private String defaultField;
    private ValueTransform transform;

    private Builder(String name) {
      this.name = Objects.requireNonNull(name, "name");
    }

    /**
     * Register an alternative name.
     *
     * @param alias
     *          the alias
     * @return this builder
     */
    public Builder alias(String alias) {
      aliases.add(alias);
      return this;
    }

    /**
     * Declare grouping key columns.
     *
     * @param keys
     *          the identity columns
     * @return this builder
     */
    public Builder groupBy(String... keys) {
      for (String key : keys) {
        columns.add(key);
        groupingKeys.add(key);
      }
      return this;
    }

    /**
     * Declare non-key columns sharing one aggregation.
     *
     * @param aggregation
     *          the aggregation of the columns
     * @param names
     *          the column names
     * @return this builder
     */
    public Builder columns(Aggregation aggregation, String... names) {
      Objects.requireNonNull(aggregation, "aggregation");
      for (String column : names) {
        columns.add(column);
        aggregations.put(column, aggregation);
      }
      return this;
    }

    /**
     * Set the column probed for data presence.
     *
     * @param field
     *          a non-key column
     * @return this builder
     */
    public Builder defaultField(String field) {
      this.defaultField = field;
      return this;
    }

    /**
     * Set the post-fetch transform.
     *
     * @param valueTransform
     *          the transform
     * @return this builder
     */
    public Builder transform(ValueTransform valueTransform) {
      this.transform = valueTransform;
      return this;
    }

    /**
     * Build the schema.
     *
     * @return the validated schema
     */
    public TableSchema build() {
      return new TableSchema(name, aliases, columns, aggregations, groupingKeys, defaultField, transform);
    }
  }
}
