package se.alipsa.jmonroe.schema;

import se.alipsa.jmonroe.model.ResultTable;

/**
 * Post-fetch hook applied to the rows of one table before they are merged, e.g. to decode
 * integer enumerations into readable labels. Column names seen by the hook are the table's own
 * column names, not the table-qualified output names.
 */
@FunctionalInterface
public interface ValueTransform {

  /** Transform that leaves the frame untouched. */
  ValueTransform IDENTITY = frame -> {
  };

  /**
   * Transform the frame in place.
   *
   * @param frame
   *          the rows fetched for a single table
   */
  void apply(ResultTable frame);
}
