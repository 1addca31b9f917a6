package se.alipsa.jmonroe.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.alipsa.jmonroe.StoreException;

/**
 * Decodes InfluxDB HTTP query responses into {@link RowSet}s.
 *
 * <p>
 * Accepted shapes are the full response ({@code {"results":[{"series":[...]}]}}), a single result
 * object ({@code {"series":[...]}}) and a bare series array. Integral numbers decode to
 * {@link Long}, other numbers to {@link Double}.
 * </p>
 */
public final class RowSetParser {

  private static final Logger log = LoggerFactory.getLogger(RowSetParser.class);
  private static final ObjectMapper MAPPER = new ObjectMapper();

  private RowSetParser() {
  }

  /**
   * Parse a response body.
   *
   * @param json
   *          the response text
   * @return the decoded result
   * @throws StoreException
   *           if the text is not valid JSON or the response reports an error
   */
  public static RowSet parse(String json) throws StoreException {
    if (json == null || json.isBlank()) {
      return RowSet.EMPTY;
    }
    try {
      return toRowSet(MAPPER.readTree(json));
    } catch (JsonProcessingException e) {
      throw new StoreException("Invalid store response: " + e.getOriginalMessage(), e);
    }
  }

  /**
   * Parse a response body from a stream. The stream is not closed.
   *
   * @param json
   *          the response stream
   * @return the decoded result
   * @throws StoreException
   *           if the stream cannot be read, is not valid JSON or reports an error
   */
  public static RowSet parse(InputStream json) throws StoreException {
    try {
      JsonNode root = MAPPER.readTree(json);
      return root == null ? RowSet.EMPTY : toRowSet(root);
    } catch (IOException e) {
      throw new StoreException("Failed to read store response: " + e.getMessage(), e);
    }
  }

  private static RowSet toRowSet(JsonNode root) throws StoreException {
    if (root == null || root.isMissingNode() || root.isNull()) {
      return RowSet.EMPTY;
    }
    List<Series> series = new ArrayList<>();
    if (root.isArray()) {
      addSeries(root, series);
    } else {
      checkError(root);
      JsonNode results = root.get("results");
      if (results != null && results.isArray()) {
        for (JsonNode result : results) {
          checkError(result);
          addSeries(result.get("series"), series);
        }
      } else {
        addSeries(root.get("series"), series);
      }
    }
    return new RowSet(series);
  }

  private static void checkError(JsonNode node) throws StoreException {
    JsonNode error = node.get("error");
    if (error != null && !error.isNull()) {
      log.warn("Store reported error: {}", error.asText());
      throw new StoreException("Store error: " + error.asText());
    }
  }

  private static void addSeries(JsonNode seriesArray, List<Series> target) {
    if (seriesArray == null || !seriesArray.isArray()) {
      return;
    }
    for (JsonNode node : seriesArray) {
      String name = node.has("name") ? node.path("name").asText("") : node.path("measurement").asText("");
      Map<String, String> tags = new LinkedHashMap<>();
      JsonNode tagNode = node.get("tags");
      if (tagNode != null && tagNode.isObject()) {
        Iterator<Map.Entry<String, JsonNode>> fields = tagNode.fields();
        while (fields.hasNext()) {
          Map.Entry<String, JsonNode> tag = fields.next();
          tags.put(tag.getKey(), tag.getValue().isNull() ? null : tag.getValue().asText());
        }
      }
      List<String> columns = new ArrayList<>();
      for (JsonNode column : node.path("columns")) {
        columns.add(column.asText());
      }
      List<List<Object>> rows = new ArrayList<>();
      for (JsonNode row : node.path("values")) {
        List<Object> cells = new ArrayList<>(columns.size());
        for (JsonNode cell : row) {
          cells.add(toValue(cell));
        }
        rows.add(cells);
      }
      target.add(new Series(name, tags, columns, rows));
    }
  }

  private static Object toValue(JsonNode cell) {
    if (cell == null || cell.isNull() || cell.isMissingNode()) {
      return null;
    }
    if (cell.isIntegralNumber()) {
      return cell.longValue();
    }
    if (cell.isNumber()) {
      return cell.doubleValue();
    }
    if (cell.isBoolean()) {
      return cell.booleanValue();
    }
    return cell.asText();
  }
}
