package se.alipsa.jmonroe.schema;

import static se.alipsa.jmonroe.schema.Aggregation.MAX;
import static se.alipsa.jmonroe.schema.Aggregation.MEAN;
import static se.alipsa.jmonroe.schema.Aggregation.MODE;
import static se.alipsa.jmonroe.schema.Aggregation.SUM;

import java.util.List;

/**
 * The measurement tables of the MONROE node database.
 *
 * <p>
 * Every table is keyed by {@code NodeId}; tables recorded per SIM card are keyed by
 * {@code Iccid} as well.
 * </p>
 */
public final class MonroeSchemas {

  /** Node identity column. */
  public static final String NODE_ID = "NodeId";
  /** SIM card identity column. */
  public static final String ICCID = "Iccid";

  public static final TableSchema PING = TableSchema.builder("ping")
      .alias("monroe_exp_ping")
      .groupBy(NODE_ID, ICCID)
      .columns(MEAN, "RTT")
      .columns(SUM, "Error")
      .columns(MODE, "Operator", "Host")
      .defaultField("RTT")
      .build();

  public static final TableSchema GPS = TableSchema.builder("gps")
      .alias("monroe_meta_device_gps")
      .groupBy(NODE_ID)
      .columns(MEAN, "Latitude", "Longitude", "Altitude", "Speed", "SatelliteCount")
      .defaultField("Latitude")
      .build();

  public static final TableSchema SENSOR = TableSchema.builder("sensor")
      .alias("monroe_meta_node_sensor")
      .groupBy(NODE_ID)
      .columns(MEAN, "CPU_User", "CPU_Apps", "Free", "Swap", "bat_usb0", "bat_usb1", "bat_usb2")
      .columns(MAX, "BootCounter", "Uptime", "CumUptime")
      .defaultField("Uptime")
      .build();

  public static final TableSchema EVENT = TableSchema.builder("event")
      .alias("monroe_meta_node_event")
      .groupBy(NODE_ID)
      .columns(MODE, "EventType", "Message")
      .defaultField("EventType")
      .build();

  // Codes from the MONROE data exporter
  public static final TableSchema MODEM = TableSchema.builder("modem")
      .alias("monroe_meta_device_modem")
      .groupBy(NODE_ID, ICCID)
      .columns(MODE, "Interface", "CID", "DeviceMode", "DeviceState", "Frequency", "MCC_MNC", "Operator",
          "IP_Address")
      .columns(MEAN, "ECIO", "RSRQ", "RSSI")
      .defaultField("DeviceMode")
      .transform(EnumDecoder.builder()
          .column("DeviceMode", 1, List.of("unknown", "disconnected", "no_service", "2G", "3G", "LTE"))
          .column("DeviceState", 0, List.of("unknown", "registered", "unregistered", "connected", "disconnected"))
          .build())
      .build();

  public static final TableSchema HTTP = TableSchema.builder("http")
      .alias("monroe_exp_http_download")
      .groupBy(NODE_ID, ICCID)
      .columns(MEAN, "DownloadTime", "Speed")
      .columns(MODE, "Operator", "Host", "ErrorCode")
      .defaultField("DownloadTime")
      .build();

  public static final TableSchema TRACEROUTE = TableSchema.builder("traceroute")
      .alias("monroe_exp_simple_traceroute")
      .groupBy(NODE_ID)
      .columns(MODE, "targetdomainname", "InterfaceName", "IpDst", "RTTSection")
      .columns(MAX, "numberOfHops")
      .defaultField("numberOfHops")
      .build();

  private static final SchemaRegistry REGISTRY = new SchemaRegistry(
      List.of(PING, GPS, SENSOR, EVENT, MODEM, HTTP, TRACEROUTE));

  private MonroeSchemas() {
  }

  /**
   * The registry holding every MONROE table.
   *
   * @return the shared, immutable registry
   */
  public static SchemaRegistry registry() {
    return REGISTRY;
  }
}
