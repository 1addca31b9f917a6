package se.alipsa.jmonroe.store;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.alipsa.jmonroe.BatchTimeoutException;
import se.alipsa.jmonroe.QueryBatchFailedException;
import se.alipsa.jmonroe.StoreException;

/**
 * Scatter/gather executor running a batch of queries against a {@link TimeSeriesStore}.
 *
 * <p>
 * Each batch gets its own fixed pool sized to the number of queries, so all queries are in flight
 * at once. The batch either completes as a whole or fails as a whole: the first failure or the
 * batch deadline cancels every outstanding query and no partial results are returned.
 * </p>
 */
public final class ConcurrentQueryExecutor {

  private static final Logger log = LoggerFactory.getLogger(ConcurrentQueryExecutor.class);
  private static final AtomicInteger POOL_SEQUENCE = new AtomicInteger();

  private final TimeSeriesStore store;
  private final Duration grace;

  /**
   * Create an executor.
   *
   * @param store
   *          the store queries run against
   * @param grace
   *          time added to the store timeout to form the batch deadline
   */
  public ConcurrentQueryExecutor(TimeSeriesStore store, Duration grace) {
    this.store = Objects.requireNonNull(store, "store");
    this.grace = grace == null ? Duration.ZERO : grace;
  }

  /**
   * The batch deadline.
   *
   * @return store timeout plus grace
   */
  public Duration batchTimeout() {
    return store.timeout().plus(grace);
  }

  /**
   * Run a single query on the calling thread.
   *
   * @param query
   *          the query text
   * @return the result
   * @throws StoreException
   *           if the store fails
   */
  public RowSet execute(String query) throws StoreException {
    if (log.isDebugEnabled()) {
      log.debug("Executing query: {}", query);
    }
    return store.executeQuery(query);
  }

  /**
   * Run all queries concurrently.
   *
   * @param queries
   *          the query texts
   * @param listener
   *          notified after each successful query (may be {@code null})
   * @return the results in completion order
   * @throws BatchTimeoutException
   *           if the batch deadline passes before all queries complete
   * @throws QueryBatchFailedException
   *           if any query fails or the calling thread is interrupted
   */
  public List<RowSet> executeAll(List<String> queries, ProgressListener listener) throws QueryBatchFailedException {
    if (queries == null || queries.isEmpty()) {
      return List.of();
    }
    ProgressListener progress = listener == null ? ProgressListener.NONE : listener;
    int total = queries.size();
    Duration timeout = batchTimeout();
    ExecutorService pool = Executors.newFixedThreadPool(total, threadFactory());
    CompletionService<RowSet> completion = new ExecutorCompletionService<>(pool);
    List<RowSet> results = new ArrayList<>(total);
    try {
      for (String query : queries) {
        completion.submit(() -> execute(query));
      }
      long deadline = System.nanoTime() + timeout.toNanos();
      while (results.size() < total) {
        long remaining = deadline - System.nanoTime();
        Future<RowSet> done = remaining > 0 ? completion.poll(remaining, TimeUnit.NANOSECONDS) : null;
        if (done == null) {
          log.error("Query batch timed out after {} ms with {} of {} queries completed", timeout.toMillis(),
              results.size(), total);
          throw new BatchTimeoutException(results.size(), total, timeout);
        }
        results.add(done.get());
        progress.onQueryCompleted(results.size(), total);
      }
      return results;
    } catch (ExecutionException e) {
      Throwable cause = e.getCause() == null ? e : e.getCause();
      log.error("Query batch failed after {} of {} queries", results.size(), total, cause);
      throw new QueryBatchFailedException("Query batch failed: " + cause.getMessage(), cause);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new QueryBatchFailedException("Interrupted while waiting for query batch", e);
    } finally {
      pool.shutdownNow();
    }
  }

  private static ThreadFactory threadFactory() {
    int poolId = POOL_SEQUENCE.incrementAndGet();
    AtomicInteger threadId = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable, "jmonroe-query-" + poolId + "-" + threadId.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    };
  }
}
