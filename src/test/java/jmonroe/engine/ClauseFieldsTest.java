package jmonroe.engine;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import se.alipsa.jmonroe.engine.ClauseFields;
import se.alipsa.jmonroe.schema.MonroeSchemas;

/** Tests for {@link ClauseFields}. */
class ClauseFieldsTest {

  @Test
  void findsLeadingFieldOfSqlConditions() {
    assertEquals("Iccid", ClauseFields.leadingField("Iccid = '8946'"));
    assertEquals("RTT", ClauseFields.leadingField("RTT > 100 AND Operator = 'Telia'"));
    assertEquals("NodeId", ClauseFields.leadingField("(NodeId = '1' OR NodeId = '2')"));
    assertEquals("Operator", ClauseFields.leadingField("\"Operator\" = 'Telia'"));
  }

  @Test
  void fallsBackToLeadingIdentifier() {
    assertEquals("Operator", ClauseFields.leadingField("Operator =~ /Telia/"));
    assertEquals("", ClauseFields.leadingField("  "));
  }

  @Test
  void pushesDownOnlyToTablesWithTheField() {
    assertTrue(ClauseFields.appliesTo("Iccid = '8946'", MonroeSchemas.PING));
    assertFalse(ClauseFields.appliesTo("Iccid = '8946'", MonroeSchemas.GPS));
    assertTrue(ClauseFields.appliesTo("time >= '2017-01-15T00:00:00Z'", MonroeSchemas.GPS));
    assertTrue(ClauseFields.appliesTo("rtt > 10", MonroeSchemas.PING));
  }
}
