package ca.gc.cra.didagent.application.json;

import ca.gc.cra.didagent.domain.connection.Invitation;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Encodes invitations as shareable URLs: {@code <base>?c_i=<base64url(invitation JSON)>}.
 */
public final class InvitationUrls {
  public static final String INVITATION_TYPE =
      "did:sov:BzCbsNYhMrjHiqZDTUASHg;spec/connections/1.0/invitation";

  private final JsonSupport json;

  public InvitationUrls() {
    this(new JsonSupport());
  }

  public InvitationUrls(JsonSupport json) {
    this.json = Objects.requireNonNull(json, "json");
  }

  /**
   * @param invitation invitation to encode
   * @return the invitation message JSON
   */
  public String toJson(Invitation invitation) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("@type", INVITATION_TYPE);
    body.put("@id", invitation.id());
    if (invitation.label() != null) {
      body.put("label", invitation.label());
    }
    if (invitation.isPublic()) {
      body.put("did", invitation.did());
    } else {
      body.put("recipientKeys", invitation.recipientKeys());
      body.put("serviceEndpoint", invitation.serviceEndpoint());
      if (!invitation.routingKeys().isEmpty()) {
        body.put("routingKeys", invitation.routingKeys());
      }
    }
    return json.write(body);
  }

  /**
   * @param invitation invitation to encode
   * @param baseUrl URL the invitation is appended to; must not be blank
   * @return invitation URL
   */
  public String toUrl(Invitation invitation, String baseUrl) {
    Objects.requireNonNull(invitation, "invitation");
    if (baseUrl == null || baseUrl.isBlank()) {
      throw new IllegalArgumentException("baseUrl must not be blank");
    }
    String encoded = Base64.getUrlEncoder()
        .encodeToString(toJson(invitation).getBytes(StandardCharsets.UTF_8));
    return baseUrl + (baseUrl.contains("?") ? "&" : "?") + "c_i=" + encoded;
  }
}
