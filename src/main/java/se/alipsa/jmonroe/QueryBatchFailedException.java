package se.alipsa.jmonroe;

/**
 * Raised when any query of a concurrently executed batch fails. Results of the sibling queries are
 * discarded.
 */
public class QueryBatchFailedException extends StoreException {

  private static final long serialVersionUID = 1L;

  /**
   * Create a new exception.
   *
   * @param message
   *          the detail message
   * @param cause
   *          the failure of the first query that failed
   */
  public QueryBatchFailedException(String message, Throwable cause) {
    super(message, cause);
  }

  /**
   * Constructor for subclasses using a more specific SQLState.
   *
   * @param message
   *          the detail message
   * @param sqlState
   *          the SQLState
   * @param cause
   *          the underlying failure, may be {@code null}
   */
  protected QueryBatchFailedException(String message, String sqlState, Throwable cause) {
    super(message, sqlState, cause);
  }
}
