package se.alipsa.jmonroe.schema;

import java.util.List;
import java.util.Locale;
import se.alipsa.jmonroe.engine.Reducers;

/** Aggregation applied to a non-key column when rows are bucketed in time. */
public enum Aggregation {
  MEAN("mean"), SUM("sum"), MODE("mode"), MAX("max");

  private final String functionName;

  Aggregation(String functionName) {
    this.functionName = functionName;
  }

  /**
   * The name of the matching aggregate function in the store's query language.
   *
   * @return the function name, e.g. {@code mean}
   */
  public String functionName() {
    return functionName;
  }

  /**
   * Reduce the values of one bucket.
   *
   * @param values
   *          the bucket values; missing values are skipped
   * @return the reduced value, {@code NaN} when no value is present
   */
  public Object reduce(List<?> values) {
    return switch (this) {
      case MEAN -> Reducers.mean(values);
      case SUM -> Reducers.sum(values);
      case MODE -> Reducers.mode(values);
      case MAX -> Reducers.max(values);
    };
  }

  /**
   * Look up an aggregation by its function name.
   *
   * @param name
   *          the function name, case-insensitive ({@code avg} and {@code average} are accepted for
   *          {@link #MEAN})
   * @return the aggregation, or {@code null} when the name is not supported
   */
  public static Aggregation from(String name) {
    if (name == null) {
      return null;
    }
    return switch (name.trim().toLowerCase(Locale.ROOT)) {
      case "mean", "avg", "average" -> MEAN;
      case "sum" -> SUM;
      case "mode" -> MODE;
      case "max" -> MAX;
      default -> null;
    };
  }
}
