package se.alipsa.jmonroe;

/** Raised when a requested column does not exist in the table it was resolved against. */
public class UnknownColumnException extends MonroeException {

  private static final long serialVersionUID = 1L;

  private final String table;
  private final String column;

  /**
   * Create a new exception.
   *
   * @param table
   *          the table the column was looked up in
   * @param column
   *          the column as requested by the caller
   */
  public UnknownColumnException(String table, String column) {
    super("Unknown column '" + column + "' for table '" + table + "'", "42S22");
    this.table = table;
    this.column = column;
  }

  /**
   * The table the lookup ran against.
   *
   * @return the table name
   */
  public String getTable() {
    return table;
  }

  /**
   * The column as requested by the caller.
   *
   * @return the unresolved column name
   */
  public String getColumn() {
    return column;
  }
}
