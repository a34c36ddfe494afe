package eu.xfsc.cv.core.pojo;

import eu.xfsc.cv.core.util.JsonLdValues;
import jakarta.json.JsonObject;

/**
 * Signature block detached from a credential.
 */
@lombok.Getter
@lombok.ToString
@lombok.EqualsAndHashCode
@lombok.AllArgsConstructor(access = lombok.AccessLevel.PRIVATE)
public class CredentialSignature {

  private final SignatureType type;
  private final String creator;
  private final String created;
  private final String nonce;
  private final String domain;
  private final String signatureValue;

  /**
   * Reads a signature block as produced by framing a credential.
   *
   * @param node the framed {@code signature} object
   * @return the signature
   */
  public static CredentialSignature from(JsonObject node) {
    return new CredentialSignature(SignatureType.of(JsonLdValues.getString(node, "type")),
        JsonLdValues.getString(node, "creator"),
        JsonLdValues.getString(node, "created"),
        JsonLdValues.getString(node, "nonce"),
        JsonLdValues.getString(node, "domain"),
        JsonLdValues.getString(node, "signatureValue"));
  }
}
