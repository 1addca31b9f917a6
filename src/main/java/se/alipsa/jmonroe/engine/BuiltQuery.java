package se.alipsa.jmonroe.engine;

import java.util.List;
import java.util.Objects;
import se.alipsa.jmonroe.schema.TableSchema;

/**
 * Query text for one table together with what it selects.
 *
 * @param table
 *          the queried table
 * @param text
 *          the query text sent to the store
 * @param fields
 *          the non-key columns selected
 * @param auxiliary
 *          whether the query only supplies grouping keys as a join target
 */
public record BuiltQuery(TableSchema table, String text, List<String> fields, boolean auxiliary) {

  /** Canonical constructor copying the field list. */
  public BuiltQuery {
    Objects.requireNonNull(table, "table");
    Objects.requireNonNull(text, "text");
    fields = List.copyOf(fields);
  }
}
