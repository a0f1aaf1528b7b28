package ca.gc.cra.didagent.infrastructure.connection;

import ca.gc.cra.didagent.application.connection.ConnectionManagerException;
import ca.gc.cra.didagent.application.context.InjectionContext;
import ca.gc.cra.didagent.application.port.ConnectionManager;
import ca.gc.cra.didagent.domain.connection.AgentIdentity;
import ca.gc.cra.didagent.domain.connection.ConnectionRecord;
import ca.gc.cra.didagent.domain.connection.ConnectionState;
import ca.gc.cra.didagent.domain.connection.ConnectionTarget;
import ca.gc.cra.didagent.domain.connection.DidDocument;
import ca.gc.cra.didagent.domain.connection.Invitation;
import ca.gc.cra.didagent.domain.connection.InvitationMode;
import ca.gc.cra.didagent.domain.msg.InboundMessage;
import ca.gc.cra.didagent.domain.msg.MessageReceipt;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Connection manager over a {@link ConnectionStore}.
 *
 * <p>Static connections are active immediately. Invitations create a record in
 * {@link ConnectionState#INVITATION} keyed by a fresh invitation key; public invitations use the
 * agent's public DID and create no record.</p>
 */
public final class InMemoryConnectionManager implements ConnectionManager {
  private static final Logger log = LoggerFactory.getLogger(InMemoryConnectionManager.class);
  static final String DEFAULT_LABEL = "didagent";

  private final InjectionContext context;
  private final ConnectionStore store;

  public InMemoryConnectionManager(InjectionContext context, ConnectionStore store) {
    this.context = Objects.requireNonNull(context, "context");
    this.store = Objects.requireNonNull(store, "store");
  }

  @Override
  public List<ConnectionTarget> getConnectionTargets(String connectionId) throws ConnectionManagerException {
    ConnectionRecord connection = store.find(connectionId)
        .orElseThrow(() -> new ConnectionManagerException("Connection not found: " + connectionId));
    if (!connection.state().deliverable()) {
      throw new ConnectionManagerException(
          "Connection " + connectionId + " is not ready for delivery (state " + connection.state() + ")");
    }
    if (connection.theirEndpoint() == null || connection.theirVerkey() == null) {
      throw new ConnectionManagerException("Connection " + connectionId + " has no delivery endpoint");
    }
    return List.of(new ConnectionTarget(
        connection.theirDid(),
        connection.theirEndpoint(),
        connection.theirLabel(),
        List.of(connection.theirVerkey()),
        connection.routingKeys(),
        connection.myVerkey()));
  }

  @Override
  public ConnectionRecord createStaticConnection(
      byte[] mySeed, byte[] theirSeed, String theirEndpoint, String theirRole, String alias)
      throws ConnectionManagerException {
    AgentIdentity mine;
    AgentIdentity theirs;
    try {
      mine = DidKeys.fromSeed(mySeed);
      theirs = DidKeys.fromSeed(theirSeed);
    } catch (IllegalArgumentException ex) {
      throw new ConnectionManagerException("Cannot derive static connection keys", ex);
    }
    ConnectionRecord connection = new ConnectionRecord(
        UUID.randomUUID().toString(),
        ConnectionState.ACTIVE,
        InvitationMode.STATIC,
        theirRole,
        alias,
        null,
        mine.did(),
        mine.verkey(),
        theirs.did(),
        theirs.verkey(),
        alias,
        theirEndpoint,
        List.of());
    store.save(connection);
    log.info("Created static connection {} ({} -> {})", connection.connectionId(), mine.did(), theirs.did());
    return connection;
  }

  @Override
  public InvitationResult createInvitation(
      String theirRole, String myLabel, boolean multiUse, boolean publicInvitation)
      throws ConnectionManagerException {
    String label = myLabel != null && !myLabel.isBlank()
        ? myLabel
        : context.settings().getString("default_label", DEFAULT_LABEL);
    if (publicInvitation) {
      if (multiUse) {
        throw new ConnectionManagerException("Cannot use public and multi_use at the same time");
      }
      AgentIdentity identity = context.injectIfPresent(AgentIdentity.class)
          .orElseThrow(() -> new ConnectionManagerException("Cannot create public invitation with no public DID"));
      return new InvitationResult(null, new Invitation(
          UUID.randomUUID().toString(), label, identity.did(), List.of(), null, List.of()));
    }
    String endpoint = context.settings().getString("default_endpoint");
    if (endpoint == null || endpoint.isBlank()) {
      throw new ConnectionManagerException("default_endpoint is required to create an invitation");
    }
    AgentIdentity invitationKey = DidKeys.random();
    ConnectionRecord connection = new ConnectionRecord(
        UUID.randomUUID().toString(),
        ConnectionState.INVITATION,
        multiUse ? InvitationMode.MULTI : InvitationMode.ONCE,
        theirRole,
        null,
        invitationKey.verkey(),
        null,
        null,
        null,
        null,
        null,
        null,
        List.of());
    store.save(connection);
    Invitation invitation = new Invitation(
        UUID.randomUUID().toString(), label, null, List.of(invitationKey.verkey()), endpoint, List.of());
    log.debug("Created invitation {} for connection {}", invitation.id(), connection.connectionId());
    return new InvitationResult(connection, invitation);
  }

  @Override
  public Optional<ConnectionRecord> findMessageConnection(InboundMessage message) {
    MessageReceipt receipt = message.receipt();
    Optional<String> sender = receipt.sender();
    Optional<String> recipient = receipt.recipient();
    if (recipient.isEmpty()) {
      return Optional.empty();
    }
    String recipientKey = recipient.get();
    if (sender.isPresent()) {
      String senderKey = sender.get();
      Optional<ConnectionRecord> pairwise = store.findFirst(
          record -> recipientKey.equals(record.myVerkey()) && senderKey.equals(record.theirVerkey()));
      if (pairwise.isPresent()) {
        return pairwise;
      }
    }
    return store.findFirst(record -> recipientKey.equals(record.invitationKey()));
  }

  @Override
  public Optional<DidDocument> fetchDidDocument(String did) {
    if (did == null) {
      return Optional.empty();
    }
    Optional<ConnectionRecord> theirs = store.findFirst(record -> did.equals(record.theirDid()));
    if (theirs.isPresent()) {
      ConnectionRecord record = theirs.get();
      return Optional.of(new DidDocument(did, record.theirVerkey(), record.theirEndpoint(), record.routingKeys()));
    }
    String endpoint = context.settings().getString("default_endpoint");
    Optional<ConnectionRecord> mine = store.findFirst(record -> did.equals(record.myDid()));
    if (mine.isPresent()) {
      return Optional.of(new DidDocument(did, mine.get().myVerkey(), endpoint, List.of()));
    }
    return context.injectIfPresent(AgentIdentity.class)
        .filter(identity -> did.equals(identity.did()))
        .map(identity -> new DidDocument(did, identity.verkey(), endpoint, List.of()));
  }
}
