package se.alipsa.jmonroe;

import java.time.Clock;
import java.util.Objects;
import se.alipsa.jmonroe.meta.StoreCatalog;
import se.alipsa.jmonroe.schema.AggregationRegistry;
import se.alipsa.jmonroe.schema.MonroeSchemas;
import se.alipsa.jmonroe.schema.SchemaRegistry;
import se.alipsa.jmonroe.store.TimeSeriesStore;

/**
 * Everything a fetch depends on: the store, the schemas, the configuration and the clock.
 *
 * <p>
 * A context is immutable apart from its memoized state, the aggregation registry (built on first
 * use) and the metadata catalog caches. Changing the store, schemas or configuration yields a new
 * context that starts with fresh memoized state.
 * </p>
 */
public final class MonroeContext {

  private final TimeSeriesStore store;
  private final SchemaRegistry schemas;
  private final JMonroeConfig config;
  private final Clock clock;
  private final StoreCatalog catalog;
  private volatile AggregationRegistry aggregations;

  /**
   * Create a context.
   *
   * @param store
   *          the store
   * @param schemas
   *          the schema registry
   * @param config
   *          the configuration
   * @param clock
   *          the clock providing "now"
   */
  public MonroeContext(TimeSeriesStore store, SchemaRegistry schemas, JMonroeConfig config, Clock clock) {
    this.store = Objects.requireNonNull(store, "store");
    this.schemas = Objects.requireNonNull(schemas, "schemas");
    this.config = Objects.requireNonNull(config, "config");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.catalog = new StoreCatalog(store, schemas, config.timeoutGrace());
  }

  /**
   * Context over the MONROE schemas with the loaded configuration and the UTC system clock.
   *
   * @param store
   *          the store
   * @return the context
   */
  public static MonroeContext of(TimeSeriesStore store) {
    return new MonroeContext(store, MonroeSchemas.registry(), JMonroeConfig.load(), Clock.systemUTC());
  }

  public TimeSeriesStore store() {
    return store;
  }

  public SchemaRegistry schemas() {
    return schemas;
  }

  public JMonroeConfig config() {
    return config;
  }

  public Clock clock() {
    return clock;
  }

  /**
   * The metadata catalog of this context.
   *
   * @return the catalog
   */
  public StoreCatalog catalog() {
    return catalog;
  }

  /**
   * The aggregation registry derived from the schemas, built on first call.
   *
   * @return the registry
   */
  public AggregationRegistry aggregations() {
    AggregationRegistry registry = aggregations;
    if (registry == null) {
      synchronized (this) {
        registry = aggregations;
        if (registry == null) {
          registry = AggregationRegistry.build(schemas);
          aggregations = registry;
        }
      }
    }
    return registry;
  }

  /**
   * Copy with another store.
   *
   * @param newStore
   *          the store
   * @return a new context
   */
  public MonroeContext withStore(TimeSeriesStore newStore) {
    return new MonroeContext(newStore, schemas, config, clock);
  }

  /**
   * Copy with other schemas.
   *
   * @param newSchemas
   *          the schema registry
   * @return a new context
   */
  public MonroeContext withSchemas(SchemaRegistry newSchemas) {
    return new MonroeContext(store, newSchemas, config, clock);
  }

  /**
   * Copy with another configuration.
   *
   * @param newConfig
   *          the configuration
   * @return a new context
   */
  public MonroeContext withConfig(JMonroeConfig newConfig) {
    return new MonroeContext(store, schemas, newConfig, clock);
  }

  /**
   * Copy with another clock.
   *
   * @param newClock
   *          the clock
   * @return a new context
   */
  public MonroeContext withClock(Clock newClock) {
    return new MonroeContext(store, schemas, config, newClock);
  }
}
