package se.alipsa.jmonroe.store;

import java.util.List;

/**
 * Result of one executed query.
 *
 * @param series
 *          the series, one per distinct tag combination
 */
public record RowSet(List<Series> series) {

  /** An empty result. */
  public static final RowSet EMPTY = new RowSet(List.of());

  /** Canonical constructor copying the series list. */
  public RowSet {
    series = series == null ? List.of() : List.copyOf(series);
  }

  /**
   * Check whether the result carries no rows.
   *
   * @return {@code true} when every series is empty
   */
  public boolean isEmpty() {
    for (Series s : series) {
      if (!s.values().isEmpty()) {
        return false;
      }
    }
    return true;
  }

  /**
   * Total number of rows across all series.
   *
   * @return the row count
   */
  public int rowCount() {
    int rows = 0;
    for (Series s : series) {
      rows += s.values().size();
    }
    return rows;
  }
}
