package se.alipsa.jmonroe.store;

/** Callback notified as queries of a batch complete. */
@FunctionalInterface
public interface ProgressListener {

  /** Listener ignoring all notifications. */
  ProgressListener NONE = (completed, total) -> {
  };

  /**
   * Called once per successfully completed query, from the coordinating thread.
   *
   * @param completed
   *          number of queries completed so far
   * @param total
   *          number of queries in the batch
   */
  void onQueryCompleted(int completed, int total);
}
