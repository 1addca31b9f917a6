package se.alipsa.jmonroe;

import java.time.Duration;

/** Raised when a query batch does not complete within the store timeout plus grace period. */
public class BatchTimeoutException extends QueryBatchFailedException {

  private static final long serialVersionUID = 1L;

  /**
   * Create a new exception.
   *
   * @param completed
   *          number of queries that completed before the deadline
   * @param total
   *          number of queries in the batch
   * @param timeout
   *          the batch deadline that was exceeded
   */
  public BatchTimeoutException(int completed, int total, Duration timeout) {
    super("Query batch timed out after " + timeout.toMillis() + " ms (" + completed + " of " + total
        + " queries completed)", "HYT00", null);
  }
}
