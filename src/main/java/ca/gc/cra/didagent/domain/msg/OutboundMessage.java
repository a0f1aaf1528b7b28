package ca.gc.cra.didagent.domain.msg;

import ca.gc.cra.didagent.domain.connection.ConnectionTarget;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Message awaiting delivery.
 *
 * <p>Recipients are given either directly ({@link #target()} or {@link #targetList()}) or
 * indirectly through {@link #connectionId()}. The outbound router resolves a connection id into a
 * target list exactly once; an already resolved message is never re-resolved.</p>
 *
 * <p><strong>Thread-safety:</strong> the target list is published through a volatile field; the
 * message is otherwise owned by one routing call at a time.</p>
 */
public final class OutboundMessage {
  private final String payload;
  private final String connectionId;
  private final ConnectionTarget target;
  private final String replyThreadId;
  private volatile List<ConnectionTarget> targetList;

  private OutboundMessage(Builder builder) {
    this.payload = Objects.requireNonNull(builder.payload, "payload");
    this.connectionId = builder.connectionId;
    this.target = builder.target;
    this.replyThreadId = builder.replyThreadId;
    this.targetList = builder.targetList == null ? null : List.copyOf(builder.targetList);
  }

  public static Builder builder(String payload) {
    return new Builder(payload);
  }

  public String payload() {
    return payload;
  }

  public Optional<String> connectionId() {
    return Optional.ofNullable(connectionId);
  }

  public Optional<ConnectionTarget> target() {
    return Optional.ofNullable(target);
  }

  /**
   * @return resolved or explicit recipients; empty if none has been set
   */
  public List<ConnectionTarget> targetList() {
    List<ConnectionTarget> current = targetList;
    return current == null ? List.of() : current;
  }

  /**
   * @return {@code true} when a single target or a non-empty target list is present
   */
  public boolean hasTargets() {
    List<ConnectionTarget> current = targetList;
    return target != null || (current != null && !current.isEmpty());
  }

  public Optional<String> replyThreadId() {
    return Optional.ofNullable(replyThreadId);
  }

  /**
   * Records the recipients resolved for {@link #connectionId()}.
   *
   * @param targets resolved targets; copied
   * @throws IllegalStateException if a target or a non-empty target list is already present
   */
  public synchronized void resolveTargets(List<ConnectionTarget> targets) {
    Objects.requireNonNull(targets, "targets");
    if (hasTargets()) {
      throw new IllegalStateException("Outbound message targets already set");
    }
    this.targetList = List.copyOf(targets);
  }

  @Override
  public String toString() {
    return "OutboundMessage{connectionId=" + connectionId
        + ", target=" + (target == null ? null : target.endpoint())
        + ", targets=" + targetList().size() + '}';
  }

  /** Builder for {@link OutboundMessage}. */
  public static final class Builder {
    private final String payload;
    private String connectionId;
    private ConnectionTarget target;
    private List<ConnectionTarget> targetList;
    private String replyThreadId;

    private Builder(String payload) {
      this.payload = payload;
    }

    public Builder connectionId(String connectionId) {
      this.connectionId = connectionId;
      return this;
    }

    public Builder target(ConnectionTarget target) {
      this.target = target;
      return this;
    }

    public Builder targetList(List<ConnectionTarget> targetList) {
      this.targetList = targetList;
      return this;
    }

    public Builder replyThreadId(String replyThreadId) {
      this.replyThreadId = replyThreadId;
      return this;
    }

    public OutboundMessage build() {
      return new OutboundMessage(this);
    }
  }
}
