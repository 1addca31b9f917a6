package se.alipsa.jmonroe.store;

import java.time.Duration;
import se.alipsa.jmonroe.StoreException;

/**
 * Remote InfluxDB-style store executing one query text at a time. Implementations own transport,
 * authentication and retries and must be safe for concurrent calls.
 */
public interface TimeSeriesStore {

  /**
   * Execute a query.
   *
   * @param query
   *          the query text
   * @return the result series
   * @throws StoreException
   *           if the store rejects the query or cannot be reached
   */
  RowSet executeQuery(String query) throws StoreException;

  /**
   * Per-query timeout applied by the transport.
   *
   * @return the timeout, 30 seconds unless overridden
   */
  default Duration timeout() {
    return Duration.ofSeconds(30);
  }
}
