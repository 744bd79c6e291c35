package ca.gc.cra.docwatch.testutil;

import ca.gc.cra.docwatch.domain.delivery.RelayConfig;
import ca.gc.cra.docwatch.domain.delivery.TlsMode;

/** Relay fixtures. */
public final class Relays {
  private Relays() {}

  public static RelayConfig relay(String name, String host, String user, int ordinal) {
    return new RelayConfig(name, host, 465, user, "secret-" + name, "证件管理系统", TlsMode.SSL, ordinal);
  }
}
