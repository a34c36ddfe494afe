package eu.xfsc.cv.core.exception;

/**
 * The verified claims could not be compacted against the credential context.
 */
public class CompactionException extends VerificationException {

  public CompactionException(String message) {
    super(message);
  }

  public CompactionException(String message, Throwable cause) {
    super(message, cause);
  }
}
