package eu.xfsc.cv.core.exception;

/**
 * A document referenced by value or URL could not be fetched or parsed.
 */
public class ResolutionException extends VerificationException {

  public ResolutionException(String message) {
    super(message);
  }

  public ResolutionException(String message, Throwable cause) {
    super(message, cause);
  }
}
