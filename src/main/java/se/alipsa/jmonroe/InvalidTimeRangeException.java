package se.alipsa.jmonroe;

import java.time.Instant;

/** Raised when the resolved start of a fetch lies after its resolved end. */
public class InvalidTimeRangeException extends MonroeException {

  private static final long serialVersionUID = 1L;

  /**
   * Create a new exception for the offending window.
   *
   * @param start
   *          the resolved start
   * @param end
   *          the resolved end
   */
  public InvalidTimeRangeException(Instant start, Instant end) {
    super("Start time " + start + " is after end time " + end, "22007");
  }
}
