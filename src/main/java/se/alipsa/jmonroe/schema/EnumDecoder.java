package se.alipsa.jmonroe.schema;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import se.alipsa.jmonroe.helper.Values;
import se.alipsa.jmonroe.model.ResultTable;

/**
 * {@link ValueTransform} replacing integer codes by labels. Codes without a label are kept as
 * they are.
 */
public final class EnumDecoder implements ValueTransform {

  private final Map<String, Map<Long, String>> labelsByColumn;

  private EnumDecoder(Map<String, Map<Long, String>> labelsByColumn) {
    this.labelsByColumn = labelsByColumn;
  }

  /**
   * Start a decoder definition.
   *
   * @return a new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  @Override
  public void apply(ResultTable frame) {
    for (Map.Entry<String, Map<Long, String>> entry : labelsByColumn.entrySet()) {
      String column = entry.getKey();
      if (!frame.hasColumn(column)) {
        continue;
      }
      Map<Long, String> labels = entry.getValue();
      for (int row = 0; row < frame.rowCount(); row++) {
        String label = decode(labels, frame.get(row, column));
        if (label != null) {
          frame.set(row, column, label);
        }
      }
    }
  }

  private static String decode(Map<Long, String> labels, Object value) {
    if (!Values.isNumeric(value)) {
      return null;
    }
    double code = Values.toDouble(value);
    if (code != Math.rint(code)) {
      return null;
    }
    return labels.get((long) code);
  }

  /** Builder collecting the label sequence of each decoded column. */
  public static final class Builder {

    private final Map<String, Map<Long, String>> labelsByColumn = new LinkedHashMap<>();

    private Builder() {
    }

    /**
     * Decode a column whose codes enumerate {@code labels} starting at {@code firstCode}.
     *
     * @param column
     *          the column to decode
     * @param firstCode
     *          the code of the first label
     * @param labels
     *          the labels in code order
     * @return this builder
     */
    public Builder column(String column, int firstCode, List<String> labels) {
      Objects.requireNonNull(column, "column");
      Map<Long, String> codes = new LinkedHashMap<>();
      for (int i = 0; i < labels.size(); i++) {
        codes.put((long) firstCode + i, labels.get(i));
      }
      labelsByColumn.put(column, Map.copyOf(codes));
      return this;
    }

    /**
     * Build the decoder.
     *
     * @return an immutable decoder
     */
    public EnumDecoder build() {
      return new EnumDecoder(Map.copyOf(labelsByColumn));
    }
  }
}
