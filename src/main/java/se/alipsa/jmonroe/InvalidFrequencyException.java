package se.alipsa.jmonroe;

import java.util.Collection;

/** Raised when an explicit granularity is not one of the tiers offered by the store. */
public class InvalidFrequencyException extends MonroeException {

  private static final long serialVersionUID = 1L;

  /**
   * Create a new exception.
   *
   * @param frequency
   *          the requested granularity
   * @param allowed
   *          the registered tiers
   */
  public InvalidFrequencyException(String frequency, Collection<String> allowed) {
    super("Invalid granularity '" + frequency + "', expected one of " + allowed, "22023");
  }
}
