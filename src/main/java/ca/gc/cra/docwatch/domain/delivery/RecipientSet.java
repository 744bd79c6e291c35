package ca.gc.cra.docwatch.domain.delivery;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Ordered mail recipients parsed from a comma-separated string.
 *
 * <p>Entries are trimmed but neither filtered nor de-duplicated; configuration validation rejects
 * malformed entries.</p>
 *
 * @param addresses recipients in configured order
 * @since 0.1.0
 */
public record RecipientSet(List<String> addresses) {
  public RecipientSet {
    addresses = List.copyOf(Objects.requireNonNull(addresses, "addresses"));
  }

  /**
   * Splits {@code raw} on commas and trims every piece.
   *
   * @param raw configured recipient string
   * @return parsed set; a {@code null} input yields an empty set
   */
  public static RecipientSet parse(String raw) {
    if (raw == null) {
      return new RecipientSet(List.of());
    }
    List<String> parsed = new ArrayList<>();
    for (String piece : raw.split(",", -1)) {
      parsed.add(piece.trim());
    }
    return new RecipientSet(parsed);
  }

  public boolean isEmpty() {
    return addresses.isEmpty();
  }

  public int size() {
    return addresses.size();
  }

  /**
   * Renders the set the way a {@code To} header lists it.
   *
   * @return comma-joined addresses
   */
  public String joined() {
    return String.join(", ", addresses);
  }
}
