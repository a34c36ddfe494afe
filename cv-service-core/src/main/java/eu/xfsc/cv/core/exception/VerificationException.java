package eu.xfsc.cv.core.exception;

/**
 * Failure of one stage of the credential verification pipeline.
 * Instances are captured into the verification result rather than propagated to the caller.
 */
public class VerificationException extends ServiceException {

  public VerificationException(String message) {
    super(message);
  }

  public VerificationException(String message, Throwable cause) {
    super(message, cause);
  }
}
