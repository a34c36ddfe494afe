package eu.xfsc.cv.core.exception;

/**
 * No object in a linked-data document matched the requested frame.
 */
public class FramingException extends VerificationException {

  public FramingException(String message) {
    super(message);
  }

  public FramingException(String message, Throwable cause) {
    super(message, cause);
  }
}
