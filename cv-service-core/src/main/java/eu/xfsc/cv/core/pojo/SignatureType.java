package eu.xfsc.cv.core.pojo;

/**
 * Linked-data signature suites understood by the verifier, each bound to the
 * canonicalization algorithm its signed data was produced with.
 */
public enum SignatureType {

  GRAPH_SIGNATURE_2012("GraphSignature2012", CanonicalizationAlgorithm.URGNA2012),
  LINKED_DATA_SIGNATURE_2015("LinkedDataSignature2015", CanonicalizationAlgorithm.URDNA2015),
  UNKNOWN(null, CanonicalizationAlgorithm.DEFAULT);

  private final String typeName;
  private final CanonicalizationAlgorithm algorithm;

  SignatureType(String typeName, CanonicalizationAlgorithm algorithm) {
    this.typeName = typeName;
    this.algorithm = algorithm;
  }

  public CanonicalizationAlgorithm getAlgorithm() {
    return algorithm;
  }

  public boolean isKnown() {
    return this != UNKNOWN;
  }

  /**
   * Resolves the declared {@code type} of a signature block.
   *
   * @param typeName the declared type, may be {@code null}
   * @return the matching type, {@link #UNKNOWN} for anything else
   */
  public static SignatureType of(String typeName) {
    for (SignatureType type : values()) {
      if (type.typeName != null && type.typeName.equals(typeName)) {
        return type;
      }
    }
    return UNKNOWN;
  }
}
