package ca.gc.cra.didagent.domain.connection;

import java.util.List;
import java.util.Objects;

/**
 * Connection invitation.
 *
 * <p>Either {@code did} is set (public invitation resolved through the ledger) or
 * {@code recipientKeys} and {@code serviceEndpoint} are set (pairwise invitation).</p>
 */
public record Invitation(
    String id,
    String label,
    String did,
    List<String> recipientKeys,
    String serviceEndpoint,
    List<String> routingKeys) {

  public Invitation {
    Objects.requireNonNull(id, "id");
    recipientKeys = recipientKeys == null ? List.of() : List.copyOf(recipientKeys);
    routingKeys = routingKeys == null ? List.of() : List.copyOf(routingKeys);
    if (did == null && (recipientKeys.isEmpty() || serviceEndpoint == null)) {
      throw new IllegalArgumentException("Invitation needs a DID or recipient keys with an endpoint");
    }
  }

  public boolean isPublic() {
    return did != null;
  }
}
