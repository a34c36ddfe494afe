package eu.xfsc.cv.core.service.verification;

import java.util.List;

import jakarta.json.Json;
import jakarta.json.JsonObject;

/**
 * JSON-LD frames used to pull the pieces of a credential verification out of fetched documents.
 */
final class Frames {

  private Frames() {
  }

  /** The credential with its signature block embedded. */
  static JsonObject signedObject(String contextUrl) {
    return Json.createObjectBuilder()
        .add("@context", contextUrl)
        .add("signature", Json.createObjectBuilder().add("@embed", true))
        .build();
  }

  /** A public key with its owner left as a reference. */
  static JsonObject publicKey(String contextUrl) {
    return Json.createObjectBuilder()
        .add("@context", contextUrl)
        .add("type", "CryptographicKey")
        .add("owner", Json.createObjectBuilder().add("@embed", false))
        .add("publicKeyPem", Json.createObjectBuilder())
        .build();
  }

  /**
   * Identity shapes in the order they are tried: the generic identity, then the legacy Open Badges identity.
   */
  static List<JsonObject> identities(String contextUrl) {
    return List.of(identity(contextUrl), identity(VerifierSettings.OPEN_BADGES_CONTEXT_URL));
  }

  private static JsonObject identity(String contextUrl) {
    return Json.createObjectBuilder()
        .add("@context", contextUrl)
        .add("type", "Identity")
        .add("publicKey", Json.createObjectBuilder()
            .add("@embed", false)
            .add("@default", Json.createArrayBuilder()))
        .build();
  }
}
