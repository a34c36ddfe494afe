package eu.xfsc.cv.core.pojo;

/**
 * Named boolean checks of a credential verification, in evaluation order.
 */
public enum VerificationCheck {

  SIGNED("signed"),
  PUBLIC_KEY_ACCESSIBLE("publicKeyAccessible"),
  PUBLIC_KEY_OWNER("publicKeyOwner"),
  KNOWN_SIGNATURE_TYPE("knownSignatureType"),
  PUBLIC_KEY_NOT_REVOKED("publicKeyNotRevoked"),
  SIGNATURE_VERIFIED("signatureVerified"),
  NOT_EXPIRED("notExpired");

  private final String key;

  VerificationCheck(String key) {
    this.key = key;
  }

  /**
   * @return the name the check is reported under
   */
  public String getKey() {
    return key;
  }
}
