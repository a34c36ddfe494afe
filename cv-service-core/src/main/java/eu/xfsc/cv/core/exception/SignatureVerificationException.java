package eu.xfsc.cv.core.exception;

/**
 * The signature value did not verify against the signed data, or the crypto provider failed.
 */
public class SignatureVerificationException extends VerificationException {

  public SignatureVerificationException(String message) {
    super(message);
  }

  public SignatureVerificationException(String message, Throwable cause) {
    super(message, cause);
  }
}
