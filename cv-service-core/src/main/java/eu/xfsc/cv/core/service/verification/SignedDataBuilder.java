package eu.xfsc.cv.core.service.verification;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;

import eu.xfsc.cv.core.pojo.CredentialSignature;

/**
 * Assembles the exact string a signature was computed over, per signature type.
 */
class SignedDataBuilder {

  /** LinkedDataSignature2015 headers, in the lexicographic order they are signed in. */
  private static final List<Header> LDS_2015_HEADERS = List.of(
      new Header("http://purl.org/dc/elements/1.1/created", CredentialSignature::getCreated),
      new Header("https://w3id.org/security#domain", CredentialSignature::getDomain),
      new Header("https://w3id.org/security#nonce", CredentialSignature::getNonce));

  /**
   * @param signature the signature block
   * @param normalized canonical N-Quads of the claims
   * @return the signed data, empty for unknown signature types
   */
  Optional<String> build(CredentialSignature signature, String normalized) {
    return switch (signature.getType()) {
      case GRAPH_SIGNATURE_2012 -> Optional.of(graphSignature2012(signature, normalized));
      case LINKED_DATA_SIGNATURE_2015 -> Optional.of(linkedDataSignature2015(signature, normalized));
      default -> Optional.empty();
    };
  }

  private static String graphSignature2012(CredentialSignature signature, String normalized) {
    StringBuilder data = new StringBuilder();
    if (signature.getNonce() != null) {
      data.append(signature.getNonce());
    }
    if (signature.getCreated() != null) {
      data.append(signature.getCreated());
    }
    return data.append(normalized).toString();
  }

  private static String linkedDataSignature2015(CredentialSignature signature, String normalized) {
    StringBuilder data = new StringBuilder();
    for (Header header : LDS_2015_HEADERS) {
      String value = header.value().apply(signature);
      if (value != null) {
        data.append(header.uri()).append(": ").append(value).append('\n');
      }
    }
    return data.append(normalized).toString();
  }

  private record Header(String uri, Function<CredentialSignature, String> value) {
  }
}
