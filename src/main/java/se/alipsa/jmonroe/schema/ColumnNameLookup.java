package se.alipsa.jmonroe.schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Utility helpers for resolving caller supplied column names against a table's canonical names.
 */
final class ColumnNameLookup {

  private ColumnNameLookup() {
  }

  /**
   * Build a case-insensitive lookup map for the supplied column names.
   *
   * @param canonicalNames
   *          canonical column names in schema order
   * @return an immutable map associating normalized column names to their canonical spelling
   * @throws IllegalArgumentException
   *           if two names only differ by case
   */
  static Map<String, String> buildCaseInsensitiveIndex(List<String> canonicalNames) {
    if (canonicalNames == null || canonicalNames.isEmpty()) {
      return Map.of();
    }
    Map<String, String> index = new LinkedHashMap<>();
    for (String name : canonicalNames) {
      String key = normalizeKey(name);
      if (key.isEmpty()) {
        throw new IllegalArgumentException("Column names must not be blank");
      }
      String previous = index.putIfAbsent(key, name);
      if (previous != null) {
        throw new IllegalArgumentException("Duplicate column name: " + name);
      }
    }
    return Collections.unmodifiableMap(index);
  }

  /**
   * Strip an optional {@code table.} qualifier from a requested column.
   *
   * @param requested
   *          the requested name, e.g. {@code ping.RTT} or {@code RTT}
   * @return the part after the last dot
   */
  static String unqualified(String requested) {
    if (requested == null) {
      return "";
    }
    String trimmed = requested.trim();
    int dot = trimmed.lastIndexOf('.');
    return dot >= 0 ? trimmed.substring(dot + 1) : trimmed;
  }

  /**
   * Normalize a column name for case-insensitive lookups.
   *
   * @param name
   *          the column name to normalize (may be {@code null})
   * @return the normalized key, or an empty string when {@code name} is {@code null} or blank
   */
  static String normalizeKey(String name) {
    if (name == null) {
      return "";
    }
    String trimmed = name.trim();
    if (trimmed.isEmpty()) {
      return "";
    }
    return trimmed.toLowerCase(Locale.ROOT);
  }
}
