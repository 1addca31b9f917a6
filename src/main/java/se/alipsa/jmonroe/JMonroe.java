package se.alipsa.jmonroe;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import se.alipsa.jmonroe.engine.BuiltQuery;
import se.alipsa.jmonroe.engine.CategoricalNormalizer;
import se.alipsa.jmonroe.engine.ColumnPlanner;
import se.alipsa.jmonroe.engine.FrameMerger;
import se.alipsa.jmonroe.engine.Granularity;
import se.alipsa.jmonroe.engine.InterpolationMethod;
import se.alipsa.jmonroe.engine.Interpolator;
import se.alipsa.jmonroe.engine.QueryBuilder;
import se.alipsa.jmonroe.engine.ResampleRule;
import se.alipsa.jmonroe.engine.Resampler;
import se.alipsa.jmonroe.engine.TimeRangeResolver;
import se.alipsa.jmonroe.helper.JMonroeUtil;
import se.alipsa.jmonroe.helper.Timestamps;
import se.alipsa.jmonroe.meta.StoreCatalog;
import se.alipsa.jmonroe.model.ResultTable;
import se.alipsa.jmonroe.schema.MonroeSchemas;
import se.alipsa.jmonroe.schema.SchemaRegistry;
import se.alipsa.jmonroe.schema.TableSchema;
import se.alipsa.jmonroe.store.ConcurrentQueryExecutor;
import se.alipsa.jmonroe.store.ProgressListener;
import se.alipsa.jmonroe.store.RowSet;
import se.alipsa.jmonroe.store.TimeSeriesStore;

/**
 * Entry point fetching MONROE measurements into one time-aligned table.
 *
 * <p>
 * <b>Example:</b>
 * </p>
 *
 * <pre>{@code
 * JMonroe monroe = JMonroe.connect(store);
 * ResultTable table = monroe.fetchTable(FetchRequest.builder()
 *     .tables("ping", "modem")
 *     .nodeIds("109")
 *     .start("2017-01-15").end("2017-01-16")
 *     .resample("1h")
 *     .build());
 * }</pre>
 */
public final class JMonroe {

  private final MonroeContext context;

  /**
   * Create a facade over a context.
   *
   * @param context
   *          the context
   */
  public JMonroe(MonroeContext context) {
    this.context = Objects.requireNonNull(context, "context");
  }

  /**
   * Create a facade over a store using the MONROE schemas and the loaded configuration.
   *
   * @param store
   *          the store
   * @return the facade
   */
  public static JMonroe connect(TimeSeriesStore store) {
    return new JMonroe(MonroeContext.of(store));
  }

  public MonroeContext context() {
    return context;
  }

  /**
   * The metadata catalog of the store.
   *
   * @return the catalog
   */
  public StoreCatalog catalog() {
    return context.catalog();
  }

  /**
   * Fetch all columns of tables over the default window.
   *
   * @param tables
   *          table names or aliases
   * @return the merged table
   * @throws MonroeException
   *           if a table is unknown or the store fails
   */
  public ResultTable fetchTable(String... tables) throws MonroeException {
    return fetchTable(FetchRequest.builder().tables(tables).build());
  }

  /**
   * Fetch a request.
   *
   * @param request
   *          the request
   * @return the merged, normalized and optionally resampled and interpolated table
   * @throws MonroeException
   *           on unknown tables or columns, invalid time ranges or tiers and store failures
   */
  public ResultTable fetchTable(FetchRequest request) throws MonroeException {
    return fetchTable(request, ProgressListener.NONE);
  }

  /**
   * Fetch a request, reporting query progress.
   *
   * @param request
   *          the request
   * @param listener
   *          notified once per completed query
   * @return the merged, normalized and optionally resampled and interpolated table
   * @throws UnknownTableException
   *           if a table is not registered, raised before any query runs
   * @throws UnknownColumnException
   *           if a column exists in none of the requested tables
   * @throws InvalidFrequencyException
   *           if an explicit granularity is not a tier
   * @throws InvalidTimeRangeException
   *           if the resolved start is after the resolved end
   * @throws StoreException
   *           if any query fails or the batch times out
   */
  public ResultTable fetchTable(FetchRequest request, ProgressListener listener) throws MonroeException {
    Objects.requireNonNull(request, "request");
    SchemaRegistry schemas = context.schemas();
    JMonroeConfig config = context.config();

    List<TableSchema> tables = resolveTables(schemas, request);
    Granularity granularity = request.granularity() == null ? null : Granularity.parse(request.granularity());
    ResampleRule rule = request.resample() == null ? null : ResampleRule.parse(request.resample());
    InterpolationMethod method = request.interpolate() == null ? null
        : InterpolationMethod.parse(request.interpolate());
    List<ColumnPlanner.Target> targets = new ColumnPlanner(schemas).plan(tables, request.columns());

    List<String> nodeIds = new ArrayList<>();
    for (String id : request.nodeIds()) {
      String canonical = JMonroeUtil.canonicalNodeId(id);
      if (!nodeIds.contains(canonical)) {
        nodeIds.add(canonical);
      }
    }
    List<String> clauses = new ArrayList<>(request.where());
    if (!nodeIds.isEmpty()) {
      clauses.add(entityClause(nodeIds));
    }

    TimeRangeResolver.Resolution resolution = new TimeRangeResolver(context.catalog(), context.clock(),
        config.window()).resolve(tables, request.start(), request.end(), granularity, nodeIds);
    clauses.add("time >= " + Timestamps.toQueryLiteral(resolution.window().start()));
    clauses.add("time <= " + Timestamps.toQueryLiteral(resolution.window().end()));

    int limit = request.limit() == null ? config.limit() : request.limit();
    QueryBuilder builder = new QueryBuilder(resolution.granularity(), rule, limit);
    List<String> queries = new ArrayList<>();
    Set<TableSchema> auxiliary = new LinkedHashSet<>();
    for (ColumnPlanner.Target target : targets) {
      BuiltQuery query = builder.build(target, clauses);
      queries.add(query.text());
      if (query.auxiliary()) {
        auxiliary.add(query.table());
      }
    }

    List<RowSet> results = new ConcurrentQueryExecutor(context.store(), config.timeoutGrace())
        .executeAll(queries, listener);
    ResultTable table = new FrameMerger(schemas).merge(results, auxiliary);
    new CategoricalNormalizer(context.aggregations()).normalize(table);
    if (rule != null && !table.isEmpty()) {
      table = new Resampler(context.aggregations()).resample(table, rule);
    }
    if (method != null && !table.isEmpty()) {
      table = new Interpolator(context.aggregations()).interpolate(table, method);
    }
    return table;
  }

  private static List<TableSchema> resolveTables(SchemaRegistry schemas, FetchRequest request)
      throws UnknownTableException {
    Set<TableSchema> tables = new LinkedHashSet<>();
    for (String name : request.tables()) {
      tables.add(schemas.table(name));
    }
    for (TableSchema handle : request.tableHandles()) {
      tables.add(schemas.table(handle));
    }
    if (tables.isEmpty()) {
      throw new IllegalArgumentException("At least one table must be requested");
    }
    return new ArrayList<>(tables);
  }

  static String entityClause(List<String> nodeIds) {
    if (nodeIds.size() == 1) {
      return MonroeSchemas.NODE_ID + " = '" + nodeIds.get(0) + "'";
    }
    List<String> parts = new ArrayList<>();
    for (String id : nodeIds) {
      parts.add(MonroeSchemas.NODE_ID + " = '" + id + "'");
    }
    return "(" + String.join(" OR ", parts) + ")";
  }
}
