package eu.xfsc.cv.core.pojo;

import java.time.Instant;

import jakarta.json.JsonObject;

/**
 * Parameters gathered while verifying one credential. Owned by a single verification call.
 */
@lombok.Getter
@lombok.Setter
@lombok.ToString(exclude = {"data", "publicKey", "identity", "normalized", "signedData", "verifiedData"})
public class VerificationParams {

  /** Claims payload, without the signature block. */
  private JsonObject data;
  private CredentialSignature signature;
  private JsonObject publicKey;
  private JsonObject identity;
  /** Canonical N-Quads of the claims payload. */
  private String normalized;
  /** Exact string the signature was computed over. */
  private String signedData;
  private boolean hasExpiration;
  private Instant expiration;
  private JsonObject verifiedData;
}
