package ca.gc.cra.docwatch.config;

import ca.gc.cra.docwatch.domain.delivery.RecipientSet;
import ca.gc.cra.docwatch.domain.delivery.RelayConfig;
import java.util.List;
import java.util.Objects;

/**
 * Canonical mail settings: relays in preference order and the recipient list.
 *
 * <p>Both configuration shapes (single legacy relay, primary plus backups) are normalized into this record by
 * {@link YamlConfigLoader}; nothing downstream sees either raw shape.</p>
 *
 * @param relays primary first, then backups in configured order
 * @param recipients parsed recipients
 * @since 0.1.0
 */
public record EmailConfig(List<RelayConfig> relays, RecipientSet recipients) {
  public EmailConfig {
    relays = List.copyOf(Objects.requireNonNull(relays, "relays"));
    if (relays.isEmpty()) {
      throw new IllegalArgumentException("at least one relay is required");
    }
    Objects.requireNonNull(recipients, "recipients");
  }

  public RelayConfig primary() {
    return relays.get(0);
  }

  public List<RelayConfig> backups() {
    return relays.subList(1, relays.size());
  }
}
