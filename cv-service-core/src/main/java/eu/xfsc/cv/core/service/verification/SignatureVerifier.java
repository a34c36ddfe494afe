package eu.xfsc.cv.core.service.verification;

import java.nio.charset.StandardCharsets;
import java.security.PublicKey;
import java.util.Base64;

import eu.xfsc.cv.core.exception.SignatureVerificationException;
import eu.xfsc.cv.core.pojo.VerificationResult;
import eu.xfsc.cv.core.pojo.VerificationStage;
import eu.xfsc.cv.core.service.crypto.CryptoProvider;
import lombok.extern.slf4j.Slf4j;

/**
 * Checks a base64 signature value against the signed data with the signer's PEM key.
 */
@Slf4j
class SignatureVerifier {

  private final CryptoProvider cryptoProvider;

  SignatureVerifier(CryptoProvider cryptoProvider) {
    this.cryptoProvider = cryptoProvider;
  }

  /**
   * A mismatch and a failure to check are both reported as {@code false}, with the reason
   * recorded under {@link VerificationStage#SIGNATURE}.
   *
   * @return {@code true} only if the signature matches
   */
  boolean verify(String publicKeyPem, String signedData, String signatureValue, VerificationResult result) {
    try {
      if (signatureValue == null) {
        throw new SignatureVerificationException("Signature has no signatureValue");
      }
      PublicKey key = cryptoProvider.parsePublicKeyPem(publicKeyPem);
      byte[] signature = Base64.getMimeDecoder().decode(signatureValue);
      if (!cryptoProvider.verify(signedData.getBytes(StandardCharsets.UTF_8), signature, key)) {
        throw new SignatureVerificationException("Signature value incorrect.");
      }
      return true;
    } catch (RuntimeException ex) {
      log.info("verify.error; {}", ex.getMessage());
      result.addError(VerificationStage.SIGNATURE, ex);
      return false;
    }
  }
}
