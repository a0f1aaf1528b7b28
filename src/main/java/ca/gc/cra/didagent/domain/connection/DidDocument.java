package ca.gc.cra.didagent.domain.connection;

import java.util.List;
import java.util.Objects;

/**
 * Minimal resolved DID document: one verification key and one service.
 */
public record DidDocument(String did, String verkey, String serviceEndpoint, List<String> routingKeys) {
  public DidDocument {
    Objects.requireNonNull(did, "did");
    Objects.requireNonNull(verkey, "verkey");
    routingKeys = routingKeys == null ? List.of() : List.copyOf(routingKeys);
  }
}
