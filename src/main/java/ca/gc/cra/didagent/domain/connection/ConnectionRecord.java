package ca.gc.cra.didagent.domain.connection;

import java.util.List;
import java.util.Objects;

/**
 * Stored state of a pairwise connection.
 *
 * <p>Key and DID fields are {@code null} until the corresponding side of the exchange has
 * happened; an invitation record carries only {@code invitationKey}.</p>
 */
public record ConnectionRecord(
    String connectionId,
    ConnectionState state,
    InvitationMode invitationMode,
    String theirRole,
    String alias,
    String invitationKey,
    String myDid,
    String myVerkey,
    String theirDid,
    String theirVerkey,
    String theirLabel,
    String theirEndpoint,
    List<String> routingKeys) {

  public ConnectionRecord {
    Objects.requireNonNull(connectionId, "connectionId");
    Objects.requireNonNull(state, "state");
    Objects.requireNonNull(invitationMode, "invitationMode");
    routingKeys = routingKeys == null ? List.of() : List.copyOf(routingKeys);
  }

  public ConnectionRecord withState(ConnectionState next) {
    return new ConnectionRecord(connectionId, next, invitationMode, theirRole, alias, invitationKey,
        myDid, myVerkey, theirDid, theirVerkey, theirLabel, theirEndpoint, routingKeys);
  }
}
