package ca.gc.cra.didagent.domain.connection;

import java.util.Objects;

/**
 * A DID with its Base58 verification key.
 */
public record AgentIdentity(String did, String verkey) {
  public AgentIdentity {
    Objects.requireNonNull(did, "did");
    Objects.requireNonNull(verkey, "verkey");
  }
}
