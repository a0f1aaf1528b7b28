package ca.gc.cra.didagent.application.port;

import ca.gc.cra.didagent.application.connection.ConnectionManagerException;
import ca.gc.cra.didagent.domain.connection.ConnectionRecord;
import ca.gc.cra.didagent.domain.connection.ConnectionTarget;
import ca.gc.cra.didagent.domain.connection.DidDocument;
import ca.gc.cra.didagent.domain.connection.Invitation;
import ca.gc.cra.didagent.domain.msg.InboundMessage;
import java.util.List;
import java.util.Optional;

/**
 * <strong>What:</strong> Manages pairwise connections: creation, lookup and recipient resolution.
 * <p><strong>Role:</strong> Created per use from the injection context; state lives in the
 * store bound in that context, so instances are cheap and interchangeable.</p>
 *
 * @since 0.1.0
 */
public interface ConnectionManager {
  /**
   * Resolves delivery targets for a connection.
   *
   * @throws ConnectionManagerException if the connection is unknown or not ready for delivery
   */
  List<ConnectionTarget> getConnectionTargets(String connectionId) throws ConnectionManagerException;

  /**
   * Creates an active connection from two known 32-byte seeds without any exchange.
   *
   * @throws ConnectionManagerException if either seed is unusable
   */
  ConnectionRecord createStaticConnection(
      byte[] mySeed, byte[] theirSeed, String theirEndpoint, String theirRole, String alias)
      throws ConnectionManagerException;

  /**
   * Creates an invitation.
   *
   * @param theirRole role assigned to whoever accepts; may be {@code null}
   * @param myLabel label presented to the invitee; {@code null} uses the configured label
   * @param multiUse whether more than one party may accept
   * @param publicInvitation whether to invite with the agent's public DID
   * @throws ConnectionManagerException if the invitation cannot be issued
   */
  InvitationResult createInvitation(String theirRole, String myLabel, boolean multiUse, boolean publicInvitation)
      throws ConnectionManagerException;

  /**
   * Finds the connection an inbound message belongs to, by its envelope keys.
   */
  Optional<ConnectionRecord> findMessageConnection(InboundMessage message);

  Optional<DidDocument> fetchDidDocument(String did);

  /**
   * Invitation plus the connection record tracking it; {@code connection} is {@code null} for
   * public invitations.
   */
  record InvitationResult(ConnectionRecord connection, Invitation invitation) {}
}
