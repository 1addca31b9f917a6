package se.alipsa.jmonroe.engine;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import se.alipsa.jmonroe.schema.Aggregation;
import se.alipsa.jmonroe.schema.TableSchema;

/**
 * Assembles the query text for one table.
 *
 * <p>
 * Raw queries select the requested non-key columns; resampled queries select one
 * {@code <agg>(<col>) AS <col>} per non-key column and group by {@code time(<rule>)}. Grouping keys
 * are never selected; they are returned as series tags through {@code GROUP BY}. A filter clause
 * is included only when its leading field is {@code time} or a column of the table.
 * </p>
 */
public final class QueryBuilder {

  private final Granularity granularity;
  private final ResampleRule resampleRule;
  private final int limit;

  /**
   * Create a builder for one fetch.
   *
   * @param granularity
   *          the tier to query
   * @param resampleRule
   *          the bucket rule, or {@code null} for raw rows
   * @param limit
   *          row limit per series, {@code 0} or less for none
   */
  public QueryBuilder(Granularity granularity, ResampleRule resampleRule, int limit) {
    this.granularity = Objects.requireNonNull(granularity, "granularity");
    this.resampleRule = resampleRule;
    this.limit = limit;
  }

  /**
   * Build the query of a planned target.
   *
   * @param target
   *          the table and its columns
   * @param clauses
   *          all filter clauses of the fetch
   * @return the query
   */
  public BuiltQuery build(ColumnPlanner.Target target, List<String> clauses) {
    TableSchema table = target.table();
    List<String> fields = new ArrayList<>();
    if (!target.auxiliary()) {
      for (String column : target.columns()) {
        if (!table.isGroupingKey(column)) {
          fields.add(column);
        }
      }
    }
    if (fields.isEmpty()) {
      fields.add(table.defaultField());
    }
    StringBuilder sql = new StringBuilder("SELECT ");
    for (int i = 0; i < fields.size(); i++) {
      if (i > 0) {
        sql.append(", ");
      }
      String field = fields.get(i);
      if (resampleRule == null) {
        sql.append(field);
      } else {
        Aggregation aggregation = table.aggregation(field);
        sql.append(aggregation.functionName()).append('(').append(field).append(") AS ").append(field);
      }
    }
    sql.append(" FROM ").append(granularity.measurement(table.name()));
    List<String> pushed = pushdown(table, clauses);
    if (!pushed.isEmpty()) {
      sql.append(" WHERE ").append(String.join(" AND ", pushed));
    }
    List<String> groupBy = new ArrayList<>();
    if (resampleRule != null) {
      groupBy.add("time(" + resampleRule.toQueryLiteral() + ")");
    }
    groupBy.addAll(table.groupingKeys());
    if (!groupBy.isEmpty()) {
      sql.append(" GROUP BY ").append(String.join(", ", groupBy));
    }
    if (limit > 0) {
      sql.append(" LIMIT ").append(limit);
    }
    String text = sql.toString();
    return new BuiltQuery(table, text, fields, target.auxiliary());
  }

  /**
   * The clauses that apply to a table, in their original order.
   *
   * @param table
   *          the table
   * @param clauses
   *          candidate clauses
   * @return the clauses whose leading field the table has
   */
  public static List<String> pushdown(TableSchema table, List<String> clauses) {
    List<String> pushed = new ArrayList<>();
    if (clauses == null) {
      return pushed;
    }
    for (String clause : clauses) {
      if (clause == null || clause.isBlank()) {
        continue;
      }
      if (ClauseFields.appliesTo(clause, table)) {
        pushed.add(clause.trim());
      }
    }
    return pushed;
  }
}
