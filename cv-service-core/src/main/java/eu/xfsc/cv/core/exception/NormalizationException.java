package eu.xfsc.cv.core.exception;

/**
 * The claims payload could not be canonicalized into N-Quads.
 */
public class NormalizationException extends VerificationException {

  public NormalizationException(String message) {
    super(message);
  }

  public NormalizationException(String message, Throwable cause) {
    super(message, cause);
  }
}
