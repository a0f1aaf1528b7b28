package ca.gc.cra.didagent.application.json;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.didagent.domain.connection.Invitation;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class InvitationUrlsTest {
  private final JsonSupport json = new JsonSupport();
  private final InvitationUrls urls = new InvitationUrls(json);

  @Test
  void pairwiseInvitationCarriesKeysAndEndpoint() {
    Invitation invitation = new Invitation(
        "inv-1", "didagent", null, List.of("VerKey111"), "http://agent.example:8020", List.of());

    Map<String, Object> body = json.parseObject(urls.toJson(invitation));

    assertEquals(InvitationUrls.INVITATION_TYPE, body.get("@type"));
    assertEquals("inv-1", body.get("@id"));
    assertEquals("didagent", body.get("label"));
    assertEquals(List.of("VerKey111"), body.get("recipientKeys"));
    assertEquals("http://agent.example:8020", body.get("serviceEndpoint"));
    assertFalse(body.containsKey("routingKeys"));
    assertFalse(body.containsKey("did"));
  }

  @Test
  void publicInvitationCarriesOnlyDid() {
    Invitation invitation = new Invitation("inv-2", null, "did:sov:PublicDid1", null, null, null);

    Map<String, Object> body = json.parseObject(urls.toJson(invitation));

    assertEquals("did:sov:PublicDid1", body.get("did"));
    assertFalse(body.containsKey("recipientKeys"));
    assertFalse(body.containsKey("label"));
  }

  @Test
  void urlEmbedsBase64UrlEncodedInvitation() {
    Invitation invitation = new Invitation(
        "inv-3", "didagent", null, List.of("VerKey111"), "http://agent.example:8020", List.of("Route1"));

    String url = urls.toUrl(invitation, "http://agent.example:8020");

    assertTrue(url.startsWith("http://agent.example:8020?c_i="));
    String encoded = url.substring(url.indexOf("c_i=") + 4);
    String decoded = new String(Base64.getUrlDecoder().decode(encoded), StandardCharsets.UTF_8);
    assertEquals(urls.toJson(invitation), decoded);
  }

  @Test
  void urlAppendsToExistingQuery() {
    Invitation invitation = new Invitation("inv-4", null, "did:sov:PublicDid1", null, null, null);

    assertTrue(urls.toUrl(invitation, "http://agent.example/join?x=1").startsWith("http://agent.example/join?x=1&c_i="));
  }

  @Test
  void blankBaseUrlIsRejected() {
    Invitation invitation = new Invitation("inv-5", null, "did:sov:PublicDid1", null, null, null);

    assertThrows(IllegalArgumentException.class, () -> urls.toUrl(invitation, " "));
  }

  @Test
  void invitationWithoutDidNeedsKeysAndEndpoint() {
    assertThrows(IllegalArgumentException.class,
        () -> new Invitation("inv-6", null, null, List.of(), "http://agent.example", null));
  }
}
