package jmonroe.support;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import se.alipsa.jmonroe.StoreException;
import se.alipsa.jmonroe.store.RowSet;
import se.alipsa.jmonroe.store.RowSetParser;
import se.alipsa.jmonroe.store.Series;

/** Test data helpers. */
public final class Fixtures {

  private Fixtures() {
  }

  /**
   * Parse a JSON store response from {@code src/test/resources/fixtures}.
   *
   * @param name
   *          the file name
   * @return the parsed result
   */
  public static RowSet load(String name) {
    try (InputStream in = Fixtures.class.getResourceAsStream("/fixtures/" + name)) {
      if (in == null) {
        throw new IllegalArgumentException("No fixture " + name);
      }
      return RowSetParser.parse(in);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    } catch (StoreException e) {
      throw new IllegalStateException(e);
    }
  }

  /**
   * Build a single series result.
   *
   * @param measurement
   *          the measurement name
   * @param tags
   *          the series tags
   * @param columns
   *          the columns, {@code time} first
   * @param rows
   *          the rows
   * @return the result
   */
  public static RowSet series(String measurement, Map<String, String> tags, List<String> columns,
      Object[]... rows) {
    List<List<Object>> values = new ArrayList<>();
    for (Object[] row : rows) {
      values.add(new ArrayList<>(Arrays.asList(row)));
    }
    return new RowSet(List.of(new Series(measurement, tags, columns, values)));
  }

  /**
   * Tags in the given order.
   *
   * @param keysAndValues
   *          alternating tag keys and values
   * @return the tags
   */
  public static Map<String, String> tags(String... keysAndValues) {
    Map<String, String> tags = new LinkedHashMap<>();
    for (int i = 0; i + 1 < keysAndValues.length; i += 2) {
      tags.put(keysAndValues[i], keysAndValues[i + 1]);
    }
    return tags;
  }

  public static long millis(String isoInstant) {
    return Instant.parse(isoInstant).toEpochMilli();
  }
}
