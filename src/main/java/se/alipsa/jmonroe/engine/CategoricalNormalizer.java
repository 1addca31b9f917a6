package se.alipsa.jmonroe.engine;

import java.util.Objects;
import se.alipsa.jmonroe.helper.Values;
import se.alipsa.jmonroe.model.ResultTable;
import se.alipsa.jmonroe.schema.AggregationRegistry;

/**
 * Fixes value representations after a merge. Categorical columns hold text labels, with integral
 * numbers written as integer text ({@code "1"}, never {@code "1.0"}); every other column holds
 * {@code Double} values with {@code NaN} for missing ones.
 */
public final class CategoricalNormalizer {

  private final AggregationRegistry aggregations;

  /**
   * Create a normalizer.
   *
   * @param aggregations
   *          registry providing the categorical column set
   */
  public CategoricalNormalizer(AggregationRegistry aggregations) {
    this.aggregations = Objects.requireNonNull(aggregations, "aggregations");
  }

  /**
   * Normalize a table in place.
   *
   * @param table
   *          the table
   * @return the same table
   */
  public ResultTable normalize(ResultTable table) {
    for (String column : table.columnNames()) {
      boolean categorical = aggregations.isCategorical(column);
      for (int row = 0; row < table.rowCount(); row++) {
        Object value = table.get(row, column);
        table.set(row, column, categorical ? Values.toLabel(value) : toNumber(value));
      }
    }
    return table;
  }

  private static Object toNumber(Object value) {
    if (Values.isMissing(value)) {
      return Double.NaN;
    }
    if (value instanceof Number number) {
      return number.doubleValue();
    }
    return value;
  }
}
