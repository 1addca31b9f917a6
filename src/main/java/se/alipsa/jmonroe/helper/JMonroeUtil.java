package se.alipsa.jmonroe.helper;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Properties;
import java.util.regex.Pattern;

/** Utility methods. */
public final class JMonroeUtil {

  private static final Pattern LIST_SEPARATOR = Pattern.compile("[\\s,]+");

  private JMonroeUtil() {
  }

  /**
   * Parses a URL query string into a Properties object.
   *
   * @param qs
   *          the query string
   * @return a Properties object containing the key-value pairs
   */
  public static Properties parseUrlQuery(String qs) {
    Properties p = new Properties();
    if (qs == null || qs.isEmpty()) {
      return p;
    }
    String s = qs.charAt(0) == '?' ? qs.substring(1) : qs;
    for (String kv : s.split("&")) {
      if (kv.isEmpty()) {
        continue;
      }
      String[] arr = kv.split("=", 2);
      String k = URLDecoder.decode(arr[0], StandardCharsets.UTF_8);
      String v = arr.length == 2 ? URLDecoder.decode(arr[1], StandardCharsets.UTF_8) : "";
      if (!k.isEmpty()) {
        p.setProperty(k, v);
      }
    }
    return p;
  }

  /**
   * Split list-like caller input into its elements.
   *
   * <p>
   * Every element is split further on commas and whitespace so {@code "ping,modem"},
   * {@code "ping modem"} and {@code ["ping", "modem"]} all yield the same list. Blank elements are
   * dropped.
   * </p>
   *
   * @param values
   *          the raw values (may be {@code null})
   * @return a mutable list of the non-blank elements in input order
   */
  public static List<String> splitList(Collection<String> values) {
    List<String> result = new ArrayList<>();
    if (values == null) {
      return result;
    }
    for (String value : values) {
      if (value == null) {
        continue;
      }
      for (String part : LIST_SEPARATOR.split(value.trim())) {
        if (!part.isEmpty()) {
          result.add(part);
        }
      }
    }
    return result;
  }

  /**
   * Normalizes a table or column qualifier by removing quotes, backticks, and brackets, and
   * converting to lowercase.
   *
   * @param qualifier
   *          the qualifier to normalize (e.g., table name, column name)
   * @return the normalized qualifier, or null if the input is null or empty
   */
  public static String normalizeQualifier(String qualifier) {
    if (qualifier == null) {
      return null;
    }
    String trimmed = qualifier.trim();
    if (trimmed.isEmpty()) {
      return null;
    }
    if ((trimmed.startsWith("\"") && trimmed.endsWith("\"")) || (trimmed.startsWith("`") && trimmed.endsWith("`"))) {
      trimmed = trimmed.substring(1, trimmed.length() - 1);
    }
    if (trimmed.startsWith("[") && trimmed.endsWith("]")) {
      trimmed = trimmed.substring(1, trimmed.length() - 1);
    }
    return trimmed.toLowerCase(Locale.ROOT);
  }

  /**
   * Validate and canonicalize a MONROE node identifier.
   *
   * @param nodeId
   *          the identifier as supplied by the caller, e.g. {@code " 0109"}
   * @return the identifier in canonical integer form, e.g. {@code "109"}
   * @throws IllegalArgumentException
   *           if the identifier is not an integer
   */
  public static String canonicalNodeId(String nodeId) {
    if (nodeId == null || nodeId.isBlank()) {
      throw new IllegalArgumentException("Node id must not be blank");
    }
    try {
      return Long.toString(Long.parseLong(nodeId.trim()));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Node id must be an integer: " + nodeId, e);
    }
  }
}
