package se.alipsa.jmonroe.meta;

import java.util.Optional;
import se.alipsa.jmonroe.StoreException;
import se.alipsa.jmonroe.engine.TimeWindow;
import se.alipsa.jmonroe.schema.TableSchema;

/** Looks up the span of data a table holds. */
@FunctionalInterface
public interface TimeRangeLookup {

  /**
   * Earliest and latest timestamps of a table.
   *
   * @param table
   *          the table
   * @param entityId
   *          restrict to one node, or {@code null} for all nodes
   * @return the span, empty when the table holds no data
   * @throws StoreException
   *           if the store cannot be queried
   */
  Optional<TimeWindow> timeRange(TableSchema table, String entityId) throws StoreException;
}
