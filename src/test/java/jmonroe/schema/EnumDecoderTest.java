package jmonroe.schema;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;
import se.alipsa.jmonroe.model.ResultTable;
import se.alipsa.jmonroe.schema.EnumDecoder;
import se.alipsa.jmonroe.schema.MonroeSchemas;

/** Tests for {@link EnumDecoder} through the modem table transform. */
class EnumDecoderTest {

  private static Map<String, Object> row(Object mode, Object state) {
    Map<String, Object> values = new HashMap<>();
    values.put("DeviceMode", mode);
    values.put("DeviceState", state);
    return values;
  }

  @Test
  void decodesModemCodes() {
    ResultTable frame = new ResultTable();
    Instant t = Instant.parse("2017-01-15T00:00:00Z");
    frame.addRow(t, row(6L, 0L));
    frame.addRow(t, row(2.0, 3L));
    frame.addRow(t, row(99L, null));
    frame.addRow(t, row("LTE", 4.5));

    MonroeSchemas.MODEM.transform().apply(frame);

    assertEquals("LTE", frame.get(0, "DeviceMode"));
    assertEquals("unknown", frame.get(0, "DeviceState"));
    assertEquals("disconnected", frame.get(1, "DeviceMode"));
    assertEquals("connected", frame.get(1, "DeviceState"));
    assertEquals(99L, frame.get(2, "DeviceMode"));
    assertNull(frame.get(2, "DeviceState"));
    assertEquals("LTE", frame.get(3, "DeviceMode"));
    assertEquals(4.5, frame.get(3, "DeviceState"));
  }

  @Test
  void ignoresFramesWithoutEnumColumns() {
    ResultTable frame = new ResultTable();
    frame.addRow(Instant.EPOCH, Map.of("RSSI", -70L));
    MonroeSchemas.MODEM.transform().apply(frame);
    assertEquals(-70L, frame.get(0, "RSSI"));
  }
}
