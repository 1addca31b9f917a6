package se.alipsa.jmonroe;

import java.sql.SQLException;

/**
 * Base type of every failure raised while fetching MONROE measurement tables.
 *
 * <p>
 * The library reports errors as {@link SQLException}s so callers already handling JDBC style
 * failures can treat a fetch like any other query. Each subclass carries a fixed SQLState.
 * </p>
 */
public class MonroeException extends SQLException {

  private static final long serialVersionUID = 1L;

  /**
   * Create a new exception.
   *
   * @param message
   *          the detail message
   * @param sqlState
   *          the SQLState describing the failure class
   */
  public MonroeException(String message, String sqlState) {
    super(message, sqlState);
  }

  /**
   * Create a new exception caused by another throwable.
   *
   * @param message
   *          the detail message
   * @param sqlState
   *          the SQLState describing the failure class
   * @param cause
   *          the underlying cause
   */
  public MonroeException(String message, String sqlState, Throwable cause) {
    super(message, sqlState, cause);
  }
}
