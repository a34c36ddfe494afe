package eu.xfsc.cv.core.service.verification;

import java.util.concurrent.CompletableFuture;

import eu.xfsc.cv.core.pojo.DocumentRef;
import eu.xfsc.cv.core.pojo.VerificationResult;
import jakarta.json.JsonObject;

/**
 * Verifies signed linked-data credentials.
 *
 * <p>None of the methods throws on a failed verification: callers must inspect
 * {@link VerificationResult#isVerified()} and {@link VerificationResult#getErrors()}.</p>
 */
public interface CredentialVerifier {

  /**
   * Verifies the credential published at the given URL.
   *
   * @param credentialUrl location of the credential
   * @return the verification result
   */
  VerificationResult verifyCredential(String credentialUrl);

  /**
   * Verifies an inline credential. The given object is not modified.
   *
   * @param credential the credential document
   * @return the verification result
   */
  VerificationResult verifyCredential(JsonObject credential);

  /**
   * Verifies a credential on the verifier's executor.
   *
   * @param credential the credential, inline or by URL
   * @return a future that always completes normally with the verification result
   */
  CompletableFuture<VerificationResult> verifyCredentialAsync(DocumentRef credential);

}
