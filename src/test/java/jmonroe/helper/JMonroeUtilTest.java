package jmonroe.helper;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Arrays;
import java.util.List;
import java.util.Properties;
import org.junit.jupiter.api.Test;
import se.alipsa.jmonroe.helper.JMonroeUtil;

/** Tests for {@link JMonroeUtil}. */
class JMonroeUtilTest {

  @Test
  void parsesUrlQuery() {
    Properties props = JMonroeUtil.parseUrlQuery("?limit=500&windowDays=7&name=a%20b&flag");
    assertEquals("500", props.getProperty("limit"));
    assertEquals("7", props.getProperty("windowDays"));
    assertEquals("a b", props.getProperty("name"));
    assertEquals("", props.getProperty("flag"));
    assertEquals(0, JMonroeUtil.parseUrlQuery(null).size());
  }

  @Test
  void splitsCommaAndSpaceSeparatedLists() {
    assertEquals(List.of("ping", "modem", "gps"), JMonroeUtil.splitList(Arrays.asList("ping,modem", " gps ", null)));
  }

  @Test
  void canonicalizesNodeIds() {
    assertEquals("109", JMonroeUtil.canonicalNodeId(" 0109 "));
    assertThrows(IllegalArgumentException.class, () -> JMonroeUtil.canonicalNodeId("node-1"));
    assertThrows(IllegalArgumentException.class, () -> JMonroeUtil.canonicalNodeId(""));
  }

  @Test
  void normalizesQuotedQualifiers() {
    assertEquals("ping", JMonroeUtil.normalizeQualifier("\"Ping\""));
    assertEquals("monroe_exp_ping", JMonroeUtil.normalizeQualifier(" `monroe_exp_ping` "));
    assertEquals("modem", JMonroeUtil.normalizeQualifier("[modem]"));
    assertNull(JMonroeUtil.normalizeQualifier("  "));
  }
}
