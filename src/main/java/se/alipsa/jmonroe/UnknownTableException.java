package se.alipsa.jmonroe;

/** Raised when a table name or handle does not match any registered schema. */
public class UnknownTableException extends MonroeException {

  private static final long serialVersionUID = 1L;

  private final String table;

  /**
   * Create a new exception for the supplied table reference.
   *
   * @param table
   *          the table reference that could not be resolved
   */
  public UnknownTableException(String table) {
    super("Unknown MONROE table: " + table, "42S02");
    this.table = table;
  }

  /**
   * The table reference that failed to resolve.
   *
   * @return the requested table name
   */
  public String getTable() {
    return table;
  }
}
