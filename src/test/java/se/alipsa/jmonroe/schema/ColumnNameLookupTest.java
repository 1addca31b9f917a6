package se.alipsa.jmonroe.schema;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

public class ColumnNameLookupTest {

  @Test
  public void testCaseInsensitiveIndex() {
    Map<String, String> index = ColumnNameLookup.buildCaseInsensitiveIndex(List.of("NodeId", "RTT"));
    assertEquals("NodeId", index.get("nodeid"));
    assertEquals("RTT", index.get("rtt"));
  }

  @Test
  public void testDuplicateAndBlankNames() {
    assertThrows(IllegalArgumentException.class,
        () -> ColumnNameLookup.buildCaseInsensitiveIndex(List.of("RTT", "rtt")));
    assertThrows(IllegalArgumentException.class, () -> ColumnNameLookup.buildCaseInsensitiveIndex(List.of(" ")));
  }

  @Test
  public void testQualifiedNames() {
    assertEquals("RTT", ColumnNameLookup.unqualified(" ping.RTT "));
    assertEquals("RTT", ColumnNameLookup.unqualified("RTT"));
    assertEquals("", ColumnNameLookup.normalizeKey(null));
  }
}
