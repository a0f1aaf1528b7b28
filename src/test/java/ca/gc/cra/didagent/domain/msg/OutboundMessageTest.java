package ca.gc.cra.didagent.domain.msg;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.didagent.domain.connection.ConnectionTarget;
import java.util.List;
import org.junit.jupiter.api.Test;

class OutboundMessageTest {

  private static final ConnectionTarget PEER =
      new ConnectionTarget("did-1", "loop://peer", "peer", List.of("their-key"), List.of(), "my-key");

  @Test
  void emptyTargetListDoesNotCountAsTargets() {
    OutboundMessage message = OutboundMessage.builder("{}").connectionId("c1").targetList(List.of()).build();

    assertFalse(message.hasTargets());

    message.resolveTargets(List.of(PEER));

    assertTrue(message.hasTargets());
    assertEquals(List.of(PEER), message.targetList());
  }

  @Test
  void singleTargetOrNonEmptyListCountsAsTargets() {
    assertTrue(OutboundMessage.builder("{}").target(PEER).build().hasTargets());
    assertTrue(OutboundMessage.builder("{}").targetList(List.of(PEER)).build().hasTargets());
    assertFalse(OutboundMessage.builder("{}").connectionId("c1").build().hasTargets());
  }

  @Test
  void resolvedTargetsAreNotReplaced() {
    OutboundMessage message = OutboundMessage.builder("{}").connectionId("c1").build();
    message.resolveTargets(List.of(PEER));

    assertThrows(IllegalStateException.class, () -> message.resolveTargets(List.of(PEER)));
    assertThrows(IllegalStateException.class,
        () -> OutboundMessage.builder("{}").target(PEER).build().resolveTargets(List.of(PEER)));
  }
}
