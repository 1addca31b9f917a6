package se.alipsa.jmonroe;

/** Transport or query failure reported by the time-series store. */
public class StoreException extends MonroeException {

  private static final long serialVersionUID = 1L;

  /**
   * Create a new exception.
   *
   * @param message
   *          the detail message
   */
  public StoreException(String message) {
    super(message, "08000");
  }

  /**
   * Create a new exception with a cause.
   *
   * @param message
   *          the detail message
   * @param cause
   *          the underlying transport or parse failure
   */
  public StoreException(String message, Throwable cause) {
    super(message, "08000", cause);
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
  protected StoreException(String message, String sqlState, Throwable cause) {
    super(message, sqlState, cause);
  }
}
