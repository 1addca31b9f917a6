package se.alipsa.jmonroe;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import se.alipsa.jmonroe.helper.JMonroeUtil;
import se.alipsa.jmonroe.helper.Timestamps;
import se.alipsa.jmonroe.schema.TableSchema;

/**
 * What to fetch. Built with {@link #builder()}; only the tables are required.
 *
 * @param tables
 *          table names or aliases
 * @param tableHandles
 *          tables given as schema handles
 * @param columns
 *          requested columns, empty for all
 * @param where
 *          filter clauses, each pushed down to the tables having its leading field
 * @param nodeIds
 *          node ids to restrict to, empty for all nodes
 * @param start
 *          window start, {@code null} to derive it
 * @param end
 *          window end, {@code null} to derive it
 * @param granularity
 *          storage tier suffix, {@code null} to derive it from the window
 * @param resample
 *          resample rule such as {@code 1h}, or {@code null}
 * @param interpolate
 *          interpolation method, or {@code null}
 * @param limit
 *          rows per series, {@code null} for the configured limit
 */
public record FetchRequest(List<String> tables, List<TableSchema> tableHandles, List<String> columns,
    List<String> where, List<String> nodeIds, Instant start, Instant end, String granularity, String resample,
    String interpolate, Integer limit) {

  /** Canonical constructor copying the lists. */
  public FetchRequest {
    tables = tables == null ? List.of() : List.copyOf(tables);
    tableHandles = tableHandles == null ? List.of() : List.copyOf(tableHandles);
    columns = columns == null ? List.of() : List.copyOf(columns);
    where = where == null ? List.of() : List.copyOf(where);
    nodeIds = nodeIds == null ? List.of() : List.copyOf(nodeIds);
  }

  /**
   * Start a request.
   *
   * @return a new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /** Builder of {@link FetchRequest}. */
  public static final class Builder {

    private final List<String> tables = new ArrayList<>();
    private final List<TableSchema> tableHandles = new ArrayList<>();
    private final List<String> columns = new ArrayList<>();
    private final List<String> where = new ArrayList<>();
    private final List<String> nodeIds = new ArrayList<>();
    private Instant start;
    private Instant end;
    private String granularity;
    private String resample;
    private String interpolate;
    private Integer limit;

    private Builder() {
    }

    /**
     * Add tables by name. Comma or space separated lists are split.
     *
     * @param names
     *          table names or aliases
     * @return this builder
     */
    public Builder tables(String... names) {
      tables.addAll(JMonroeUtil.splitList(Arrays.asList(names)));
      return this;
    }

    /**
     * Add a table by schema handle.
     *
     * @param table
     *          the schema
     * @return this builder
     */
    public Builder table(TableSchema table) {
      tableHandles.add(table);
      return this;
    }

    /**
     * Add columns. Comma or space separated lists are split.
     *
     * @param names
     *          column names, optionally {@code table.column}
     * @return this builder
     */
    public Builder columns(String... names) {
      return columns(Arrays.asList(names));
    }

    /**
     * Add columns.
     *
     * @param names
     *          column names, optionally {@code table.column}
     * @return this builder
     */
    public Builder columns(Collection<String> names) {
      columns.addAll(JMonroeUtil.splitList(names));
      return this;
    }

    /**
     * Add filter clauses.
     *
     * @param clauses
     *          clauses such as {@code Operator = 'Telia'}
     * @return this builder
     */
    public Builder where(String... clauses) {
      for (String clause : clauses) {
        if (clause != null && !clause.isBlank()) {
          where.add(clause.trim());
        }
      }
      return this;
    }

    /**
     * Restrict to nodes.
     *
     * @param ids
     *          node ids
     * @return this builder
     */
    public Builder nodeIds(String... ids) {
      nodeIds.addAll(JMonroeUtil.splitList(Arrays.asList(ids)));
      return this;
    }

    public Builder start(Instant instant) {
      this.start = instant;
      return this;
    }

    /**
     * Set the window start from text such as {@code 2017-01-15} or {@code 2017-01-15T10:00:00Z}.
     *
     * @param text
     *          the timestamp
     * @return this builder
     */
    public Builder start(String text) {
      this.start = text == null ? null : Timestamps.parse(text);
      return this;
    }

    public Builder end(Instant instant) {
      this.end = instant;
      return this;
    }

    /**
     * Set the window end from text.
     *
     * @param text
     *          the timestamp
     * @return this builder
     */
    public Builder end(String text) {
      this.end = text == null ? null : Timestamps.parse(text);
      return this;
    }

    public Builder granularity(String tier) {
      this.granularity = tier;
      return this;
    }

    public Builder resample(String rule) {
      this.resample = rule;
      return this;
    }

    public Builder interpolate(String method) {
      this.interpolate = method;
      return this;
    }

    /**
     * Turn linear interpolation on or off.
     *
     * @param enabled
     *          {@code true} for linear interpolation
     * @return this builder
     */
    public Builder interpolate(boolean enabled) {
      this.interpolate = enabled ? "linear" : null;
      return this;
    }

    public Builder limit(int rows) {
      this.limit = rows;
      return this;
    }

    /**
     * Build the request.
     *
     * @return the request
     */
    public FetchRequest build() {
      return new FetchRequest(tables, tableHandles, columns, where, nodeIds, start, end, granularity, resample,
          interpolate, limit);
    }
  }
}
