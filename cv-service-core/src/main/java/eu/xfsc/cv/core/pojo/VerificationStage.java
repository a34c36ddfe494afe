package eu.xfsc.cv.core.pojo;

/**
 * Pipeline stages whose failures are reported in {@link VerificationResult#getErrors()}.
 */
public enum VerificationStage {

  DATA("data"),
  PUBLIC_KEY("publicKey"),
  PUBLIC_KEY_OWNER("publicKeyOwner"),
  NORMALIZATION("normalization"),
  SIGNATURE("signature"),
  EXPIRATION("expiration"),
  COMPACT("compact");

  private final String key;

  VerificationStage(String key) {
    this.key = key;
  }

  public String getKey() {
    return key;
  }
}
